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
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Limits and switches of the function invocation loop.
 *
 * <p>
 * Unset builder values fall back to the defaults: enabled, 40 iterations, 3
 * consecutive failing rounds, unknown calls are not fatal and error details are
 * not shown to the model.
 */
@Getter
@ToString
public final class FunctionInvocationConfiguration {

    public static final int DEFAULT_MAX_ITERATIONS = 40;
    public static final int DEFAULT_MAX_CONSECUTIVE_ERRORS_PER_REQUEST = 3;

    private final boolean enabled;
    private final int maxIterations;
    private final int maxConsecutiveErrorsPerRequest;
    private final boolean terminateOnUnknownCalls;

    /**
     * Tools the model may know about that are never executed here. A batch calling
     * one of them is handed back to the caller.
     */
    private final List<Tool> additionalTools;

    private final boolean includeDetailedErrors;

    @Builder
    private FunctionInvocationConfiguration(Boolean enabled, Integer maxIterations,
            Integer maxConsecutiveErrorsPerRequest, Boolean terminateOnUnknownCalls, List<Tool> additionalTools,
            Boolean includeDetailedErrors) {
        int iterations = maxIterations != null ? maxIterations : DEFAULT_MAX_ITERATIONS;
        int consecutiveErrors = maxConsecutiveErrorsPerRequest != null
                ? maxConsecutiveErrorsPerRequest
                : DEFAULT_MAX_CONSECUTIVE_ERRORS_PER_REQUEST;
        if (iterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + iterations);
        }
        if (consecutiveErrors < 0) {
            throw new IllegalArgumentException(
                    "maxConsecutiveErrorsPerRequest must not be negative, got " + consecutiveErrors);
        }
        this.enabled = enabled == null || enabled;
        this.maxIterations = iterations;
        this.maxConsecutiveErrorsPerRequest = consecutiveErrors;
        this.terminateOnUnknownCalls = Boolean.TRUE.equals(terminateOnUnknownCalls);
        this.additionalTools = additionalTools != null ? List.copyOf(additionalTools) : List.of();
        this.includeDetailedErrors = Boolean.TRUE.equals(includeDetailedErrors);
    }

    public static FunctionInvocationConfiguration defaults() {
        return FunctionInvocationConfiguration.builder().build();
    }

    public boolean isAdditionalTool(String name) {
        return name != null && additionalTools.stream().anyMatch(tool -> name.equals(tool.getName()));
    }
}
