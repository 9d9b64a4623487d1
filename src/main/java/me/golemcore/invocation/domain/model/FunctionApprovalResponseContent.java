package me.golemcore.invocation.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The caller's decision on a {@link FunctionApprovalRequestContent}, matched by
 * id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FunctionApprovalResponseContent implements Content {

    public static final String TYPE = "function_approval_response";

    private String id;
    private boolean approved;
    private FunctionCallContent functionCall;

    @Override
    public String getType() {
        return TYPE;
    }
}
