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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A single conversation turn made of typed contents.
 */
@Data
@Builder(toBuilder = true)
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_TOOL = "tool";

    private String id;
    private String role; // user, assistant, system, tool
    private String authorName;

    @Builder.Default
    private List<Content> contents = new ArrayList<>();

    private Map<String, Object> additionalProperties;

    public static Message user(String text) {
        return ofText(ROLE_USER, text);
    }

    public static Message system(String text) {
        return ofText(ROLE_SYSTEM, text);
    }

    public static Message assistant(String text) {
        return ofText(ROLE_ASSISTANT, text);
    }

    public static Message assistant(List<? extends Content> contents) {
        return Message.builder().role(ROLE_ASSISTANT).contents(new ArrayList<>(contents)).build();
    }

    public static Message tool(List<? extends Content> contents) {
        return Message.builder().role(ROLE_TOOL).contents(new ArrayList<>(contents)).build();
    }

    private static Message ofText(String role, String text) {
        List<Content> contents = new ArrayList<>();
        contents.add(TextContent.of(text));
        return Message.builder().role(role).contents(contents).build();
    }

    /**
     * Copies each message with its own mutable contents list, so the copies can be
     * edited without touching the caller's conversation.
     */
    public static List<Message> copyOf(List<Message> messages) {
        List<Message> copies = new ArrayList<>();
        if (messages == null) {
            return copies;
        }
        for (Message message : messages) {
            List<Content> contents = message.getContents() != null
                    ? new ArrayList<>(message.getContents())
                    : new ArrayList<>();
            copies.add(message.toBuilder().contents(contents).build());
        }
        return copies;
    }

    /**
     * Concatenates the text of all text contents.
     */
    public String getText() {
        if (contents == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Content content : contents) {
            if (content instanceof TextContent text && text.getText() != null) {
                sb.append(text.getText());
            }
        }
        return sb.toString();
    }

    public void addContent(Content content) {
        if (contents == null) {
            contents = new ArrayList<>();
        }
        contents.add(content);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    /**
     * Returns the contents of the given type, in order.
     */
    public <T extends Content> List<T> contentsOf(Class<T> type) {
        List<T> matching = new ArrayList<>();
        if (contents == null) {
            return matching;
        }
        for (Content content : contents) {
            if (type.isInstance(content)) {
                matching.add(type.cast(content));
            }
        }
        return matching;
    }
}
