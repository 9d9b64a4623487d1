package me.golemcore.invocation.domain.service;

import me.golemcore.invocation.domain.model.Content;

import java.util.List;

/**
 * Outcome of gating one batch of function calls.
 *
 * @param kind
 *            what the orchestrator should do with the batch
 * @param contents
 *            the calls to execute, the approval requests to surface, or the
 *            unchanged calls to hand back
 */
public record ApprovalDecision(Kind kind, List<Content> contents) {

    public enum Kind {
        EXECUTE, APPROVAL_REQUIRED, RETURN_TO_CALLER
    }

    public static ApprovalDecision execute(List<? extends Content> calls) {
        return new ApprovalDecision(Kind.EXECUTE, List.copyOf(calls));
    }

    public static ApprovalDecision approvalRequired(List<? extends Content> requests) {
        return new ApprovalDecision(Kind.APPROVAL_REQUIRED, List.copyOf(requests));
    }

    public static ApprovalDecision returnToCaller(List<? extends Content> calls) {
        return new ApprovalDecision(Kind.RETURN_TO_CALLER, List.copyOf(calls));
    }
}
