package me.golemcore.invocation.port.outbound;

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

import me.golemcore.invocation.domain.model.ChatOptions;
import me.golemcore.invocation.domain.model.ChatResponse;
import me.golemcore.invocation.domain.model.ChatResponseUpdate;
import me.golemcore.invocation.domain.model.Message;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the underlying model service (OpenAI, Anthropic, etc.). Provider
 * adapters translate messages and options into their own wire format.
 */
public interface ChatClientPort {

    /**
     * Returns the provider identifier (e.g., "openai", "anthropic").
     */
    String getProviderId();

    /**
     * Sends the conversation and returns the full response.
     */
    CompletableFuture<ChatResponse> getResponse(List<Message> messages, ChatOptions options);

    /**
     * Sends the conversation and returns incremental updates. Default
     * implementation throws UnsupportedOperationException; providers should
     * override if streaming is supported.
     */
    default Flux<ChatResponseUpdate> getStreamingResponse(List<Message> messages, ChatOptions options) {
        throw new UnsupportedOperationException("Streaming not supported by this provider");
    }

    default boolean supportsStreaming() {
        return false;
    }
}
