package me.golemcore.invocation.domain.service;

import me.golemcore.invocation.domain.model.Content;
import me.golemcore.invocation.domain.model.FunctionResultContent;

import java.util.List;

/**
 * Results of one executed batch, in call order.
 *
 * @param results
 *            one entry per input call; a passed-through approval response stays
 *            as is
 * @param terminate
 *            whether a middleware asked to stop the loop
 */
public record FunctionCallBatchResult(List<Content> results, boolean terminate) {

    public boolean hasErrors() {
        return results.stream()
                .anyMatch(content -> content instanceof FunctionResultContent result && result.hasError());
    }
}
