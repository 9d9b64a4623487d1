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

/**
 * The outcome of a function call, correlated with the call by call id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FunctionResultContent implements Content {

    public static final String TYPE = "function_result";

    private String callId;
    private Object result;
    private ToolError error;
    private Object rawRepresentation;

    public static FunctionResultContent success(String callId, Object result) {
        return FunctionResultContent.builder()
                .callId(callId)
                .result(result)
                .build();
    }

    /**
     * Creates a failed result. The message doubles as the result so the model sees
     * it verbatim.
     */
    public static FunctionResultContent failure(String callId, ToolError error) {
        return FunctionResultContent.builder()
                .callId(callId)
                .result(error.message())
                .error(error)
                .build();
    }

    @Override
    public String getType() {
        return TYPE;
    }

    public boolean hasError() {
        return error != null;
    }
}
