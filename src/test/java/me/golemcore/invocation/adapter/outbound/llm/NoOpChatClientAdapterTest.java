package me.golemcore.invocation.adapter.outbound.llm;

import me.golemcore.invocation.domain.model.ChatOptions;
import me.golemcore.invocation.domain.model.ChatResponse;
import me.golemcore.invocation.domain.model.FinishReason;
import me.golemcore.invocation.domain.model.FunctionCallContent;
import me.golemcore.invocation.domain.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NoOpChatClientAdapterTest {

    private NoOpChatClientAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new NoOpChatClientAdapter();
    }

    // --- getResponse ---

    @Test
    void shouldReturnPlaceholderResponse() throws Exception {
        ChatResponse response = adapter.getResponse(List.of(Message.user("Hi")), ChatOptions.empty()).get();

        assertEquals("[No LLM configured]", response.getText());
        assertEquals("none", response.getModelId());
        assertEquals(FinishReason.STOP, response.getFinishReason());
    }

    @Test
    void shouldReturnZeroUsage() throws Exception {
        ChatResponse response = adapter.getResponse(List.of(), ChatOptions.empty()).get();

        assertNotNull(response.getUsage());
        assertEquals(0, response.getUsage().getInputTokenCount());
        assertEquals(0, response.getUsage().getOutputTokenCount());
        assertEquals(0, response.getUsage().getTotalTokenCount());
    }

    @Test
    void shouldReturnCompletedFuture() {
        CompletableFuture<ChatResponse> future = adapter.getResponse(List.of(), ChatOptions.empty());

        assertTrue(future.isDone());
        assertFalse(future.isCompletedExceptionally());
    }

    @Test
    void shouldNeverRequestFunctionCalls() throws Exception {
        ChatResponse response = adapter.getResponse(List.of(), ChatOptions.empty()).get();

        assertTrue(response.getMessages().get(0).contentsOf(FunctionCallContent.class).isEmpty());
    }

    // --- getStreamingResponse ---

    @Test
    void shouldStreamSinglePlaceholderUpdate() {
        StepVerifier.create(adapter.getStreamingResponse(List.of(), ChatOptions.empty()))
                .assertNext(update -> {
                    assertEquals("[No LLM configured]", update.getText());
                    assertEquals(Message.ROLE_ASSISTANT, update.getRole());
                    assertEquals(FinishReason.STOP, update.getFinishReason());
                })
                .verifyComplete();
    }

    @Test
    void shouldSupportStreaming() {
        assertTrue(adapter.supportsStreaming());
    }

    @Test
    void shouldReturnNoneForProviderId() {
        assertEquals("none", adapter.getProviderId());
    }
}
