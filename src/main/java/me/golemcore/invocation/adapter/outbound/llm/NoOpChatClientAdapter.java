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

package me.golemcore.invocation.adapter.outbound.llm;

import me.golemcore.invocation.domain.model.ChatOptions;
import me.golemcore.invocation.domain.model.ChatResponse;
import me.golemcore.invocation.domain.model.ChatResponseUpdate;
import me.golemcore.invocation.domain.model.FinishReason;
import me.golemcore.invocation.domain.model.Message;
import me.golemcore.invocation.domain.model.UsageDetails;
import me.golemcore.invocation.port.outbound.ChatClientPort;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * No-op model client used when no real provider is configured.
 *
 * <p>
 * Always answers with a placeholder text and never requests tools, so the
 * invocation loop finishes after a single round.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Slf4j
public class NoOpChatClientAdapter implements ChatClientPort {

    static final String PLACEHOLDER = "[No LLM configured]";

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<ChatResponse> getResponse(List<Message> messages, ChatOptions options) {
        log.warn("NoOpChatClientAdapter: getResponse() called - no LLM configured");
        ChatResponse response = ChatResponse.of(Message.assistant(PLACEHOLDER));
        response.setModelId("none");
        response.setFinishReason(FinishReason.STOP);
        response.setUsage(UsageDetails.of(0, 0));
        return CompletableFuture.completedFuture(response);
    }

    @Override
    public Flux<ChatResponseUpdate> getStreamingResponse(List<Message> messages, ChatOptions options) {
        log.warn("NoOpChatClientAdapter: getStreamingResponse() called - no LLM configured");
        ChatResponseUpdate update = ChatResponseUpdate.text(PLACEHOLDER);
        update.setModelId("none");
        update.setFinishReason(FinishReason.STOP);
        return Flux.just(update);
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }
}
