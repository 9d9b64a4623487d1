package me.golemcore.invocation.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.invocation.domain.middleware.FunctionInvocationContext;
import me.golemcore.invocation.domain.middleware.FunctionMiddlewarePipeline;
import me.golemcore.invocation.domain.model.Content;
import me.golemcore.invocation.domain.model.FunctionApprovalResponseContent;
import me.golemcore.invocation.domain.model.FunctionCallContent;
import me.golemcore.invocation.domain.model.FunctionInvocationConfiguration;
import me.golemcore.invocation.domain.model.FunctionResultContent;
import me.golemcore.invocation.domain.model.Tool;
import me.golemcore.invocation.domain.model.ToolError;
import me.golemcore.invocation.domain.model.ToolException;
import me.golemcore.invocation.domain.model.ToolFailureKind;
import me.golemcore.invocation.domain.model.ToolRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Executes a batch of function calls concurrently and collects one result per
 * call, in call order.
 *
 * <p>
 * Failures never escape a call: an unknown function, invalid arguments or a
 * failing tool all become a {@link FunctionResultContent} carrying a
 * {@link ToolError}, so one bad call cannot abort its siblings.
 */
@Slf4j
public class FunctionCallExecutionService {

    static final String NOT_FOUND_TEMPLATE = "Error: Requested function \"%s\" not found.";
    static final String ARGUMENT_PARSING_FAILED = "Error: Argument parsing failed.";
    static final String FUNCTION_FAILED = "Error: Function failed.";

    private final ToolArgumentValidator argumentValidator;
    private final FunctionMiddlewarePipeline middlewarePipeline;

    public FunctionCallExecutionService(ToolArgumentValidator argumentValidator,
            FunctionMiddlewarePipeline middlewarePipeline) {
        this.argumentValidator = argumentValidator;
        this.middlewarePipeline = middlewarePipeline;
    }

    /**
     * Runs every item of the batch at once and waits for all of them.
     *
     * @param items
     *            function calls, or approved approval responses replayed by the
     *            caller
     * @param additionalArguments
     *            caller-supplied arguments merged under the model's arguments
     * @param iteration
     *            current loop round, exposed to middlewares
     */
    public CompletableFuture<FunctionCallBatchResult> executeBatch(List<? extends Content> items,
            ToolRegistry registry, Map<String, Object> additionalArguments,
            FunctionInvocationConfiguration configuration, int iteration) {
        List<FunctionInvocationContext> contexts = new ArrayList<>();
        List<CompletableFuture<Content>> futures = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            Content item = items.get(i);
            try {
                futures.add(executeItem(item, i, registry, additionalArguments, configuration, iteration,
                        contexts));
            } catch (RuntimeException e) {
                log.warn("[Tools] Call {} failed before invocation: {}", callIdOf(item), safeCauseMessage(e));
                futures.add(CompletableFuture.completedFuture(FunctionResultContent.failure(callIdOf(item),
                        new ToolError(ToolFailureKind.EXECUTION_FAILED,
                                withDetail(FUNCTION_FAILED, safeCauseMessage(e), configuration), e))));
            }
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<Content> results = futures.stream().map(CompletableFuture::join).toList();
                    boolean terminate;
                    synchronized (contexts) {
                        terminate = contexts.stream().anyMatch(FunctionInvocationContext::isTerminate);
                    }
                    return new FunctionCallBatchResult(results, terminate);
                });
    }

    private CompletableFuture<Content> executeItem(Content item, int sequenceIndex, ToolRegistry registry,
            Map<String, Object> additionalArguments, FunctionInvocationConfiguration configuration, int iteration,
            List<FunctionInvocationContext> contexts) {
        FunctionCallContent call;
        boolean approvalResponse = false;
        if (item instanceof FunctionApprovalResponseContent response) {
            call = response.getFunctionCall();
            approvalResponse = true;
        } else if (item instanceof FunctionCallContent functionCall) {
            call = functionCall;
        } else {
            return CompletableFuture.completedFuture(item);
        }

        Optional<Tool> resolved = registry.resolve(call.getName());
        if (resolved.isEmpty()) {
            if (approvalResponse) {
                // hosted tool, the service runs it
                return CompletableFuture.completedFuture(item);
            }
            log.warn("[Tools] Requested function '{}' not found", call.getName());
            return CompletableFuture.completedFuture(FunctionResultContent.failure(call.getCallId(),
                    ToolError.of(ToolFailureKind.UNKNOWN_TOOL, String.format(NOT_FOUND_TEMPLATE, call.getName()))));
        }
        Tool tool = resolved.get();

        Map<String, Object> arguments = mergeArguments(tool, additionalArguments, call.parseArguments());
        List<String> validationErrors = argumentValidator.validate(tool, arguments);
        if (!validationErrors.isEmpty()) {
            String detail = String.join("; ", validationErrors);
            return CompletableFuture.completedFuture(FunctionResultContent.failure(call.getCallId(),
                    new ToolError(ToolFailureKind.ARGUMENT_VALIDATION_FAILED,
                            withDetail(ARGUMENT_PARSING_FAILED, detail, configuration), null)));
        }

        log.info("[Tools] Invoking '{}' (call {})", tool.getName(), call.getCallId());
        log.debug("[Tools] Arguments for '{}': {}", tool.getName(), arguments);
        CompletableFuture<Object> invocation;
        if (middlewarePipeline.hasMiddlewares()) {
            FunctionInvocationContext context = FunctionInvocationContext.builder()
                    .function(tool)
                    .arguments(arguments)
                    .additionalArguments(additionalArguments)
                    .functionCall(call)
                    .sequenceIndex(sequenceIndex)
                    .iteration(iteration)
                    .build();
            synchronized (contexts) {
                contexts.add(context);
            }
            invocation = middlewarePipeline.execute(context,
                    current -> current.getFunction().invoke(current.getArguments()));
        } else {
            invocation = tool.invoke(arguments);
        }

        return invocation.handle((result, error) -> {
            if (error == null) {
                log.debug("[Tools] '{}' returned: {}", tool.getName(), result);
                return FunctionResultContent.success(call.getCallId(), result);
            }
            Throwable cause = unwrap(error);
            ToolFailureKind kind = cause instanceof ToolException toolException
                    ? toolException.getKind()
                    : ToolFailureKind.EXECUTION_FAILED;
            log.warn("[Tools] '{}' failed ({}): {}", tool.getName(), kind, safeCauseMessage(cause));
            return FunctionResultContent.failure(call.getCallId(),
                    new ToolError(kind, withDetail(FUNCTION_FAILED, safeCauseMessage(cause), configuration), cause));
        });
    }

    /**
     * Caller arguments are only passed for parameters the schema declares (all of
     * them when the schema declares no properties at all). The model's own
     * arguments win on conflicts.
     */
    static Map<String, Object> mergeArguments(Tool tool, Map<String, Object> additionalArguments,
            Map<String, Object> parsedArguments) {
        if (additionalArguments == null || additionalArguments.isEmpty()) {
            return parsedArguments;
        }
        Object properties = tool.getInputSchema().get("properties");
        Map<String, Object> merged = new LinkedHashMap<>();
        additionalArguments.forEach((key, value) -> {
            if (!(properties instanceof Map<?, ?> declared) || declared.containsKey(key)) {
                merged.put(key, value);
            }
        });
        merged.putAll(parsedArguments);
        return merged;
    }

    private static String withDetail(String message, String detail, FunctionInvocationConfiguration configuration) {
        if (!configuration.isIncludeDetailedErrors() || detail == null) {
            return message;
        }
        return message + " Exception: " + detail;
    }

    private static String callIdOf(Content item) {
        if (item instanceof FunctionCallContent call) {
            return call.getCallId();
        }
        if (item instanceof FunctionApprovalResponseContent response && response.getFunctionCall() != null) {
            return response.getFunctionCall().getCallId();
        }
        return null;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            message = error.getClass().getSimpleName();
        }
        return message;
    }
}
