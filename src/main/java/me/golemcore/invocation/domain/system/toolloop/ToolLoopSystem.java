package me.golemcore.invocation.domain.system.toolloop;

import me.golemcore.invocation.domain.model.ChatOptions;
import me.golemcore.invocation.domain.model.ChatResponse;
import me.golemcore.invocation.domain.model.ChatResponseUpdate;
import me.golemcore.invocation.domain.model.FunctionInvocationConfiguration;
import me.golemcore.invocation.domain.model.Message;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Calls the model, runs the functions it asks for, and feeds the results back
 * until the model answers without further calls.
 */
public interface ToolLoopSystem {

    CompletableFuture<ChatResponse> getResponse(List<Message> messages, ChatOptions options);

    default CompletableFuture<ChatResponse> getResponse(String prompt, ChatOptions options) {
        return getResponse(List.of(Message.user(prompt)), options);
    }

    /**
     * Streams every model update as it arrives, plus synthetic updates for approval
     * requests ({@code assistant}) and function results ({@code tool}).
     */
    Flux<ChatResponseUpdate> getStreamingResponse(List<Message> messages, ChatOptions options);

    FunctionInvocationConfiguration getConfiguration();
}
