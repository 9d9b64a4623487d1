package me.golemcore.invocation.domain.system.toolloop;

import me.golemcore.invocation.domain.model.ChatResponse;
import me.golemcore.invocation.domain.model.Content;

import java.util.List;

/**
 * What happened after the model answered in one round.
 *
 * @param emitted
 *            approval requests or function results to surface to a streaming
 *            caller
 */
record RoundOutcome(Kind kind, ChatResponse response, List<Content> emitted) {

    enum Kind {
        /** No calls left to run, the response is final. */
        FINISHED,
        /** Approval requests were attached to the response. */
        APPROVAL_REQUIRED,
        /** Calls are for the caller to handle. */
        RETURNED_TO_CALLER,
        /** Results were recorded and the model should be called again. */
        CONTINUE,
        /** A middleware asked to stop. */
        TERMINATED,
        /** Too many failing rounds in a row. */
        ERRORS_EXHAUSTED
    }

    static RoundOutcome of(Kind kind, ChatResponse response) {
        return new RoundOutcome(kind, response, List.of());
    }
}
