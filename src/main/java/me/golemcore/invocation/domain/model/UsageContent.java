package me.golemcore.invocation.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token usage reported inline by a streaming update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageContent implements Content {

    public static final String TYPE = "usage";

    private UsageDetails details;

    public static UsageContent of(UsageDetails details) {
        return new UsageContent(details);
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
