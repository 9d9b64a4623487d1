package me.golemcore.invocation.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A complete model response, possibly spanning several messages.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    private String responseId;
    private String conversationId;
    private String modelId;
    private UsageDetails usage;
    private FinishReason finishReason;
    private Instant createdAt;

    /**
     * Structured value parsed from the text when an output type was requested.
     */
    private Object value;

    private Map<String, Object> additionalProperties;

    @Builder.Default
    private List<Object> rawRepresentations = new ArrayList<>();

    public static ChatResponse of(Message message) {
        List<Message> messages = new ArrayList<>();
        messages.add(message);
        return ChatResponse.builder().messages(messages).build();
    }

    /**
     * Joins the text of all messages with newlines.
     */
    public String getText() {
        if (messages == null) {
            return "";
        }
        return messages.stream()
                .map(Message::getText)
                .collect(Collectors.joining("\n"))
                .strip();
    }

    public void addMessage(Message message) {
        if (messages == null) {
            messages = new ArrayList<>();
        }
        messages.add(message);
    }
}
