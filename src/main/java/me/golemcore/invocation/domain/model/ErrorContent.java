package me.golemcore.invocation.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Non-fatal error reported by the model service as part of a response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorContent implements Content {

    public static final String TYPE = "error";

    private String message;
    private String errorCode;

    @Override
    public String getType() {
        return TYPE;
    }
}
