package me.golemcore.invocation.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UriContent implements Content {

    public static final String TYPE = "uri";

    private String uri;
    private String mediaType;

    @Override
    public String getType() {
        return TYPE;
    }
}
