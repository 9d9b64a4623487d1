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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.invocation.domain.model.ChatResponse;
import me.golemcore.invocation.domain.model.ChatResponseUpdate;
import me.golemcore.invocation.domain.model.Content;
import me.golemcore.invocation.domain.model.ContentMismatchException;
import me.golemcore.invocation.domain.model.FunctionCallContent;
import me.golemcore.invocation.domain.model.Message;
import me.golemcore.invocation.domain.model.TextContent;
import me.golemcore.invocation.domain.model.TextReasoningContent;
import me.golemcore.invocation.domain.model.UsageContent;
import me.golemcore.invocation.domain.model.UsageDetails;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Builds a complete {@link ChatResponse} out of streamed
 * {@link ChatResponseUpdate} fragments.
 *
 * <p>
 * Updates can be folded in one at a time with
 * {@link #accept(ChatResponse, ChatResponseUpdate)} followed by
 * {@link #finish(ChatResponse, Class)}, or all at once through the
 * {@code assemble} overloads.
 */
@Slf4j
public class ChatResponseAssembler {

    private final ObjectMapper objectMapper;

    public ChatResponseAssembler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ChatResponse newResponse() {
        return ChatResponse.builder().build();
    }

    public ChatResponse assemble(List<ChatResponseUpdate> updates) {
        return assemble(updates, null);
    }

    public ChatResponse assemble(List<ChatResponseUpdate> updates, Class<?> outputType) {
        ChatResponse response = newResponse();
        for (ChatResponseUpdate update : updates) {
            accept(response, update);
        }
        finish(response, outputType);
        return response;
    }

    public Mono<ChatResponse> assemble(Flux<ChatResponseUpdate> updates) {
        return assemble(updates, null);
    }

    public Mono<ChatResponse> assemble(Flux<ChatResponseUpdate> updates, Class<?> outputType) {
        return updates.collect(ChatResponseAssembler::newResponse, this::accept)
                .map(response -> {
                    finish(response, outputType);
                    return response;
                });
    }

    /**
     * Folds one update into the response being built.
     */
    public void accept(ChatResponse response, ChatResponseUpdate update) {
        Message message = currentMessage(response, update);
        if (update.getAuthorName() != null) {
            message.setAuthorName(update.getAuthorName());
        }
        if (update.getRole() != null) {
            message.setRole(update.getRole());
        }
        if (update.getMessageId() != null && !update.getMessageId().isEmpty()) {
            message.setId(update.getMessageId());
        }

        if (update.getContents() != null) {
            for (Content content : update.getContents()) {
                addContent(response, message, content);
            }
        }

        if (update.getResponseId() != null) {
            response.setResponseId(update.getResponseId());
        }
        if (update.getConversationId() != null) {
            response.setConversationId(update.getConversationId());
        }
        if (update.getModelId() != null) {
            response.setModelId(update.getModelId());
        }
        if (update.getFinishReason() != null) {
            response.setFinishReason(update.getFinishReason());
        }
        if (update.getCreatedAt() != null) {
            response.setCreatedAt(update.getCreatedAt());
        }
        if (update.getAdditionalProperties() != null && !update.getAdditionalProperties().isEmpty()) {
            if (response.getAdditionalProperties() == null) {
                response.setAdditionalProperties(new LinkedHashMap<>());
            }
            response.getAdditionalProperties().putAll(update.getAdditionalProperties());
        }
        if (update.getRawRepresentation() != null) {
            if (response.getRawRepresentations() == null) {
                response.setRawRepresentations(new ArrayList<>());
            }
            response.getRawRepresentations().add(update.getRawRepresentation());
        }
    }

    private Message currentMessage(ChatResponse response, ChatResponseUpdate update) {
        List<Message> messages = response.getMessages();
        if (messages == null) {
            messages = new ArrayList<>();
            response.setMessages(messages);
        }
        if (!messages.isEmpty()) {
            Message last = messages.get(messages.size() - 1);
            boolean idChanged = update.getMessageId() != null && last.getId() != null
                    && !last.getId().equals(update.getMessageId());
            boolean roleChanged = update.getRole() != null && last.getRole() != null
                    && !last.getRole().equals(update.getRole());
            if (!idChanged && !roleChanged) {
                return last;
            }
        }
        Message message = Message.builder().role(Message.ROLE_ASSISTANT).build();
        messages.add(message);
        return message;
    }

    private void addContent(ChatResponse response, Message message, Content content) {
        if (content instanceof UsageContent usage) {
            response.setUsage(UsageDetails.add(response.getUsage(), usage.getDetails()));
            return;
        }
        List<Content> contents = message.getContents();
        if (content instanceof FunctionCallContent fragment && !contents.isEmpty()
                && contents.get(contents.size() - 1) instanceof FunctionCallContent previous) {
            try {
                contents.set(contents.size() - 1, previous.merge(fragment));
            } catch (ContentMismatchException e) {
                contents.add(fragment);
            }
            return;
        }
        message.addContent(content);
    }

    public void finish(ChatResponse response) {
        finish(response, null);
    }

    /**
     * Coalesces adjacent text and reasoning fragments and, when an output type is
     * given, parses the text into {@link ChatResponse#getValue()}.
     */
    public void finish(ChatResponse response, Class<?> outputType) {
        if (response.getMessages() != null) {
            for (Message message : response.getMessages()) {
                message.setContents(coalesce(message.getContents()));
            }
        }
        if (outputType != null && response.getValue() == null) {
            String text = response.getText();
            try {
                response.setValue(objectMapper.readValue(text, outputType));
            } catch (JsonProcessingException e) {
                log.debug("[Assembler] Could not parse response text as {}: {}", outputType.getSimpleName(),
                        e.getMessage());
            }
        }
    }

    static List<Content> coalesce(List<Content> contents) {
        List<Content> coalesced = new ArrayList<>();
        if (contents == null) {
            return coalesced;
        }
        for (Content content : contents) {
            Content last = coalesced.isEmpty() ? null : coalesced.get(coalesced.size() - 1);
            if (content instanceof TextContent text && last instanceof TextContent previous) {
                coalesced.set(coalesced.size() - 1, previous.concat(text));
            } else if (content instanceof TextReasoningContent reasoning
                    && last instanceof TextReasoningContent previous) {
                coalesced.set(coalesced.size() - 1, previous.concat(reasoning));
            } else if (content instanceof TextContent text) {
                coalesced.add(text.toBuilder().build());
            } else if (content instanceof TextReasoningContent reasoning) {
                coalesced.add(reasoning.toBuilder().build());
            } else {
                coalesced.add(content);
            }
        }
        return coalesced;
    }
}
