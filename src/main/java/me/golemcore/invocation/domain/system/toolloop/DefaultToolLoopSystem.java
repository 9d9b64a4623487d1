package me.golemcore.invocation.domain.system.toolloop;

import me.golemcore.invocation.domain.model.ChatOptions;
import me.golemcore.invocation.domain.model.ChatResponse;
import me.golemcore.invocation.domain.model.ChatResponseUpdate;
import me.golemcore.invocation.domain.model.Content;
import me.golemcore.invocation.domain.model.FunctionApprovalRequestContent;
import me.golemcore.invocation.domain.model.FunctionApprovalResponseContent;
import me.golemcore.invocation.domain.model.FunctionCallContent;
import me.golemcore.invocation.domain.model.FunctionInvocationConfiguration;
import me.golemcore.invocation.domain.model.FunctionResultContent;
import me.golemcore.invocation.domain.model.Message;
import me.golemcore.invocation.domain.model.ToolMode;
import me.golemcore.invocation.domain.model.ToolRegistry;
import me.golemcore.invocation.domain.service.ApprovalDecision;
import me.golemcore.invocation.domain.service.ChatResponseAssembler;
import me.golemcore.invocation.domain.service.FunctionApprovalGate;
import me.golemcore.invocation.domain.service.FunctionCallBatchResult;
import me.golemcore.invocation.domain.service.FunctionCallExecutionService;
import me.golemcore.invocation.domain.service.ToolCatalog;
import me.golemcore.invocation.port.outbound.ChatClientPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Function invocation loop around a {@link ChatClientPort}.
 *
 * <p>
 * Each round: 1) approval responses supplied by the caller are executed and
 * folded back into the conversation, 2) the model is called, 3) its function
 * calls are gated and executed concurrently, 4) the results are appended as a
 * tool message and the next round starts. The loop ends when the model stops
 * calling functions, when calls need approval or belong to the caller, when a
 * middleware terminates, or after too many rounds. In the last case the model
 * is called once more with tool choice {@code none}.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    private final ChatClientPort chatClient;
    private final ToolCatalog toolCatalog;
    private final FunctionApprovalGate approvalGate;
    private final FunctionCallExecutionService executionService;
    private final ChatResponseAssembler assembler;
    private final FunctionInvocationConfiguration configuration;

    public DefaultToolLoopSystem(ChatClientPort chatClient, ToolCatalog toolCatalog,
            FunctionApprovalGate approvalGate, FunctionCallExecutionService executionService,
            ChatResponseAssembler assembler, FunctionInvocationConfiguration configuration) {
        this.chatClient = chatClient;
        this.toolCatalog = toolCatalog;
        this.approvalGate = approvalGate;
        this.executionService = executionService;
        this.assembler = assembler;
        this.configuration = configuration != null ? configuration : FunctionInvocationConfiguration.defaults();
    }

    @Override
    public FunctionInvocationConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public CompletableFuture<ChatResponse> getResponse(List<Message> messages, ChatOptions options) {
        LoopState state = new LoopState(Message.copyOf(messages), withToolDefaults(options));
        if (!configuration.isEnabled()) {
            return failSafe(state);
        }
        return runRound(state);
    }

    @Override
    public Flux<ChatResponseUpdate> getStreamingResponse(List<Message> messages, ChatOptions options) {
        return Flux.defer(() -> {
            LoopState state = new LoopState(Message.copyOf(messages), withToolDefaults(options));
            if (!configuration.isEnabled()) {
                return streamFailSafe(state);
            }
            return streamRound(state);
        });
    }

    // ==================== NON-STREAMING ====================

    private CompletableFuture<ChatResponse> runRound(LoopState state) {
        if (state.getIteration() >= configuration.getMaxIterations()) {
            log.info("[ToolLoop] Reached max iterations ({}), asking for a final answer",
                    configuration.getMaxIterations());
            return failSafe(state);
        }
        int iteration = state.nextIteration();
        return resolvePendingApprovals(state, iteration).thenCompose(exhausted -> {
            if (exhausted) {
                return failSafe(state);
            }
            log.debug("[ToolLoop] Round {}: calling model with {} message(s)", iteration + 1,
                    state.getMessages().size());
            return chatClient.getResponse(state.snapshot(), state.getOptions())
                    .thenCompose(response -> processResponse(state, response, iteration))
                    .thenCompose(outcome -> afterRound(state, outcome));
        });
    }

    private CompletableFuture<ChatResponse> afterRound(LoopState state, RoundOutcome outcome) {
        return switch (outcome.kind()) {
        case CONTINUE -> runRound(state);
        case ERRORS_EXHAUSTED -> failSafe(state);
        case TERMINATED -> {
            ChatResponse terminated = outcome.response();
            terminated.setMessages(new ArrayList<>(state.getTranscript()));
            yield CompletableFuture.completedFuture(terminated);
        }
        default -> CompletableFuture.completedFuture(state.withTranscript(outcome.response()));
        };
    }

    private CompletableFuture<ChatResponse> failSafe(LoopState state) {
        ChatOptions options = state.getOptions().toBuilder().toolChoice(ToolMode.NONE).build();
        return chatClient.getResponse(state.snapshot(), options).thenApply(state::withTranscript);
    }

    // ==================== STREAMING ====================

    private Flux<ChatResponseUpdate> streamRound(LoopState state) {
        if (state.getIteration() >= configuration.getMaxIterations()) {
            log.info("[ToolLoop] Reached max iterations ({}), streaming a final answer",
                    configuration.getMaxIterations());
            return streamFailSafe(state);
        }
        int iteration = state.nextIteration();
        return Mono.fromFuture(() -> resolvePendingApprovals(state, iteration)).flatMapMany(exhausted -> {
            if (exhausted) {
                return streamFailSafe(state);
            }
            List<ChatResponseUpdate> buffered = new ArrayList<>();
            return chatClient.getStreamingResponse(state.snapshot(), state.getOptions())
                    .doOnNext(buffered::add)
                    .concatWith(Flux.defer(() -> afterStreamedRound(state, buffered, iteration)));
        });
    }

    private Flux<ChatResponseUpdate> afterStreamedRound(LoopState state, List<ChatResponseUpdate> updates,
            int iteration) {
        boolean hasCalls = updates.stream()
                .filter(update -> update.getContents() != null)
                .flatMap(update -> update.getContents().stream())
                .anyMatch(content -> content instanceof FunctionCallContent
                        || content instanceof FunctionApprovalRequestContent);
        if (!hasCalls) {
            return Flux.empty();
        }
        ChatResponse response = assembler.assemble(updates);
        return Mono.fromFuture(() -> processResponse(state, response, iteration)).flatMapMany(outcome -> {
            Flux<ChatResponseUpdate> emitted = switch (outcome.kind()) {
            case APPROVAL_REQUIRED -> Flux.just(ChatResponseUpdate.of(Message.ROLE_ASSISTANT, outcome.emitted()));
            case TERMINATED -> Flux.just(ChatResponseUpdate.of(Message.ROLE_TOOL, outcome.emitted()));
            case CONTINUE -> Flux.just(ChatResponseUpdate.of(Message.ROLE_TOOL, outcome.emitted()))
                    .concatWith(Flux.defer(() -> streamRound(state)));
            case ERRORS_EXHAUSTED -> Flux.just(ChatResponseUpdate.of(Message.ROLE_TOOL, outcome.emitted()))
                    .concatWith(Flux.defer(() -> streamFailSafe(state)));
            default -> Flux.empty();
            };
            return emitted;
        });
    }

    private Flux<ChatResponseUpdate> streamFailSafe(LoopState state) {
        ChatOptions options = state.getOptions().toBuilder().toolChoice(ToolMode.NONE).build();
        return chatClient.getStreamingResponse(state.snapshot(), options);
    }

    // ==================== SHARED ROUND LOGIC ====================

    /**
     * Executes approved calls replayed by the caller and rewrites the approval
     * contents in place.
     *
     * @return a future completed with {@code true} when the consecutive error limit
     *         was reached
     */
    private CompletableFuture<Boolean> resolvePendingApprovals(LoopState state, int iteration) {
        Map<String, FunctionApprovalResponseContent> responses = approvalGate
                .collectApprovalResponses(state.getMessages());
        responses.keySet().removeAll(state.getHandledApprovalIds());
        if (responses.isEmpty()) {
            return CompletableFuture.completedFuture(false);
        }
        state.getHandledApprovalIds().addAll(responses.keySet());

        List<FunctionApprovalResponseContent> approved = responses.values().stream()
                .filter(FunctionApprovalResponseContent::isApproved)
                .toList();
        log.info("[Approval] Resuming with {} approved and {} rejected call(s)", approved.size(),
                responses.size() - approved.size());

        CompletableFuture<FunctionCallBatchResult> execution;
        if (approved.isEmpty()) {
            execution = CompletableFuture.completedFuture(new FunctionCallBatchResult(List.of(), false));
        } else {
            ToolRegistry registry = toolCatalog.buildRegistry(state.getOptions().getTools());
            execution = executionService.executeBatch(approved, registry,
                    state.getOptions().getAdditionalArguments(), configuration, iteration);
        }
        return execution.thenApply(batch -> {
            approvalGate.replaceApprovalContentsWithResults(state.getMessages(), responses, batch.results());
            if (batch.hasErrors() && state.recordFailedRound(configuration.getMaxConsecutiveErrorsPerRequest())) {
                logErrorsExhausted();
                return true;
            }
            return false;
        });
    }

    private CompletableFuture<RoundOutcome> processResponse(LoopState state, ChatResponse response, int iteration) {
        if (response.getMessages() == null) {
            response.setMessages(new ArrayList<>());
        }
        if (response.getConversationId() != null) {
            state.switchToConversation(response.getConversationId());
        }

        List<FunctionCallContent> calls = pendingCalls(response);
        ToolRegistry registry = toolCatalog.buildRegistry(state.getOptions().getTools());
        if (calls.isEmpty() || (registry.isEmpty() && configuration.getAdditionalTools().isEmpty())) {
            return CompletableFuture.completedFuture(RoundOutcome.of(RoundOutcome.Kind.FINISHED, response));
        }

        ApprovalDecision decision;
        try {
            decision = approvalGate.classify(calls, registry, configuration);
        } catch (RuntimeException e) {
            log.warn("[ToolLoop] Stopping: {}", e.getMessage());
            return CompletableFuture.failedFuture(e);
        }

        if (decision.kind() == ApprovalDecision.Kind.APPROVAL_REQUIRED) {
            attachToAssistantMessage(response, decision.contents());
            return CompletableFuture.completedFuture(
                    new RoundOutcome(RoundOutcome.Kind.APPROVAL_REQUIRED, response, decision.contents()));
        }
        if (decision.kind() == ApprovalDecision.Kind.RETURN_TO_CALLER) {
            return CompletableFuture.completedFuture(RoundOutcome.of(RoundOutcome.Kind.RETURNED_TO_CALLER, response));
        }

        log.info("[ToolLoop] Round {}: executing {} function call(s)", iteration + 1, calls.size());
        return executionService.executeBatch(calls, registry, state.getOptions().getAdditionalArguments(),
                configuration, iteration)
                .thenApply(batch -> recordExecutedRound(state, response, batch));
    }

    private RoundOutcome recordExecutedRound(LoopState state, ChatResponse response, FunctionCallBatchResult batch) {
        Message toolMessage = Message.tool(batch.results());
        response.addMessage(toolMessage);
        state.recordRound(response, toolMessage);

        if (batch.terminate()) {
            log.info("[ToolLoop] Middleware requested termination");
            return new RoundOutcome(RoundOutcome.Kind.TERMINATED, response, batch.results());
        }
        if (batch.hasErrors()) {
            if (state.recordFailedRound(configuration.getMaxConsecutiveErrorsPerRequest())) {
                logErrorsExhausted();
                return new RoundOutcome(RoundOutcome.Kind.ERRORS_EXHAUSTED, response, batch.results());
            }
        } else {
            state.recordSuccessfulRound();
        }
        return new RoundOutcome(RoundOutcome.Kind.CONTINUE, response, batch.results());
    }

    private void logErrorsExhausted() {
        log.warn("[ToolLoop] Maximum consecutive function call errors reached ({}). "
                + "Stopping further function calls for this request.",
                configuration.getMaxConsecutiveErrorsPerRequest());
    }

    /**
     * Function calls of the response that do not already have a result in it.
     */
    static List<FunctionCallContent> pendingCalls(ChatResponse response) {
        Set<String> answered = new HashSet<>();
        List<FunctionCallContent> calls = new ArrayList<>();
        for (Message message : response.getMessages()) {
            if (message.getContents() == null) {
                continue;
            }
            for (Content content : message.getContents()) {
                if (content instanceof FunctionResultContent result) {
                    answered.add(result.getCallId());
                } else if (content instanceof FunctionCallContent call) {
                    calls.add(call);
                }
            }
        }
        return calls.stream()
                .filter(call -> call.getCallId() == null || !answered.contains(call.getCallId()))
                .toList();
    }

    private static void attachToAssistantMessage(ChatResponse response, List<Content> requests) {
        for (Message message : response.getMessages()) {
            if (message.isAssistantMessage()) {
                message.getContents().addAll(requests);
                return;
            }
        }
        response.addMessage(Message.assistant(requests));
    }

    private static ChatOptions withToolDefaults(ChatOptions options) {
        ChatOptions effective = options != null ? options : ChatOptions.empty();
        if (effective.hasTools() && effective.getToolChoice() == null) {
            return effective.toBuilder().toolChoice(ToolMode.AUTO).build();
        }
        return effective;
    }
}
