package me.golemcore.invocation.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Asks the caller to approve a function call before it runs.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FunctionApprovalRequestContent implements Content {

    public static final String TYPE = "function_approval_request";

    private String id;
    private FunctionCallContent functionCall;
    private Map<String, Object> additionalProperties;

    public static FunctionApprovalRequestContent forCall(FunctionCallContent functionCall) {
        return FunctionApprovalRequestContent.builder()
                .id(functionCall.getCallId())
                .functionCall(functionCall)
                .build();
    }

    @Override
    public String getType() {
        return TYPE;
    }

    public FunctionApprovalResponseContent createResponse(boolean approved) {
        return FunctionApprovalResponseContent.builder()
                .id(id)
                .approved(approved)
                .functionCall(functionCall)
                .build();
    }
}
