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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A request from the model to call a function.
 *
 * <p>
 * Arguments arrive either as a raw JSON string (usually streamed in fragments)
 * or as an already structured map. Exactly one of {@link #rawArguments} and
 * {@link #arguments} is expected to be set; fragments of the same call are
 * combined with {@link #merge(FunctionCallContent)}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FunctionCallContent implements Content {

    public static final String TYPE = "function_call";
    public static final String RAW_ARGUMENT_KEY = "raw";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private String callId;
    private String name;
    private String rawArguments;
    private Map<String, Object> arguments;
    private ToolError error;
    private Map<String, Object> additionalProperties;
    private Object rawRepresentation;

    public static FunctionCallContent of(String callId, String name, String rawArguments) {
        return FunctionCallContent.builder()
                .callId(callId)
                .name(name)
                .rawArguments(rawArguments)
                .build();
    }

    public static FunctionCallContent of(String callId, String name, Map<String, Object> arguments) {
        return FunctionCallContent.builder()
                .callId(callId)
                .name(name)
                .arguments(arguments)
                .build();
    }

    @Override
    public String getType() {
        return TYPE;
    }

    public boolean hasArguments() {
        return hasRawArguments() || hasStructuredArguments();
    }

    private boolean hasRawArguments() {
        return rawArguments != null && !rawArguments.isEmpty();
    }

    private boolean hasStructuredArguments() {
        return arguments != null && !arguments.isEmpty();
    }

    /**
     * Combines this fragment with the next fragment of the same call.
     *
     * @throws ContentMismatchException
     *             if both fragments carry different call ids
     * @throws IllegalArgumentException
     *             if one fragment has string arguments and the other a map
     */
    public FunctionCallContent merge(FunctionCallContent other) {
        Objects.requireNonNull(other, "other");
        if (!isEmpty(callId) && !isEmpty(other.getCallId()) && !callId.equals(other.getCallId())) {
            throw new ContentMismatchException(
                    "Function call ids do not match: " + callId + " and " + other.getCallId());
        }
        FunctionCallContentBuilder merged = FunctionCallContent.builder()
                .callId(!isEmpty(callId) ? callId : other.getCallId())
                .name(!isEmpty(name) ? name : other.getName())
                .error(error != null ? error : other.getError())
                .additionalProperties(mergeProperties(additionalProperties, other.getAdditionalProperties()))
                .rawRepresentation(TextContent.mergeRaw(rawRepresentation, other.getRawRepresentation()));

        if (!hasArguments()) {
            merged.rawArguments(other.getRawArguments()).arguments(copy(other.getArguments()));
        } else if (!other.hasArguments()) {
            merged.rawArguments(rawArguments).arguments(copy(arguments));
        } else if (hasRawArguments() && other.hasRawArguments()) {
            merged.rawArguments(rawArguments + other.getRawArguments());
        } else if (hasStructuredArguments() && other.hasStructuredArguments()) {
            Map<String, Object> combined = new LinkedHashMap<>(arguments);
            combined.putAll(other.getArguments());
            merged.arguments(combined);
        } else {
            throw new IllegalArgumentException(
                    "Cannot merge string arguments with structured arguments for call " + callId);
        }
        return merged.build();
    }

    /**
     * Returns the arguments as a map. A JSON object string is parsed, any other
     * JSON value is wrapped under {@value #RAW_ARGUMENT_KEY}, and a string that is
     * not JSON at all is wrapped as is.
     */
    public Map<String, Object> parseArguments() {
        if (hasStructuredArguments()) {
            return new LinkedHashMap<>(arguments);
        }
        if (!hasRawArguments()) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> parsed = new LinkedHashMap<>();
        try {
            JsonNode node = OBJECT_MAPPER.readTree(rawArguments);
            if (node != null && node.isObject()) {
                parsed.putAll(OBJECT_MAPPER.convertValue(node, MAP_TYPE));
            } else {
                parsed.put(RAW_ARGUMENT_KEY, OBJECT_MAPPER.convertValue(node, Object.class));
            }
        } catch (JsonProcessingException e) {
            parsed.put(RAW_ARGUMENT_KEY, rawArguments);
        }
        return parsed;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source != null ? new LinkedHashMap<>(source) : null;
    }

    private static Map<String, Object> mergeProperties(Map<String, Object> left, Map<String, Object> right) {
        if (left == null && right == null) {
            return null;
        }
        Map<String, Object> merged = new LinkedHashMap<>();
        if (left != null) {
            merged.putAll(left);
        }
        if (right != null) {
            merged.putAll(right);
        }
        return merged;
    }
}
