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
 * Per-request options forwarded to the model client.
 */
@Data
@Builder(toBuilder = true)
public class ChatOptions {

    private String model;

    @Builder.Default
    private List<ToolSpec> tools = new ArrayList<>();

    private ToolMode toolChoice;

    /**
     * Service-side conversation id. When set, only new messages are sent on each
     * round.
     */
    private String conversationId;

    private Double temperature;
    private Integer maxTokens;

    /**
     * Extra arguments supplied by the caller and merged into tool arguments.
     */
    private Map<String, Object> additionalArguments;

    private Map<String, Object> additionalProperties;

    public static ChatOptions empty() {
        return ChatOptions.builder().build();
    }

    public boolean hasTools() {
        return tools != null && !tools.isEmpty();
    }
}
