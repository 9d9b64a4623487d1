package me.golemcore.invocation.infrastructure.config;

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

import lombok.Data;
import me.golemcore.invocation.domain.model.FunctionInvocationConfiguration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Function invocation settings bound from {@code golemcore.invocation.*}.
 *
 * <p>
 * Values are validated when they are turned into a
 * {@link FunctionInvocationConfiguration}, so an invalid limit fails the
 * application context on startup.
 */
@ConfigurationProperties(prefix = "golemcore.invocation")
@Data
public class InvocationProperties {

    /**
     * Whether the model's function calls are executed at all. When disabled the
     * model is called once with tool choice {@code none}.
     */
    private boolean enabled = true;

    /**
     * Maximum number of model rounds that may execute tools.
     */
    private int maxIterations = FunctionInvocationConfiguration.DEFAULT_MAX_ITERATIONS;

    /**
     * Consecutive rounds with at least one failed call before the loop gives up on
     * tools.
     */
    private int maxConsecutiveErrorsPerRequest = FunctionInvocationConfiguration.DEFAULT_MAX_CONSECUTIVE_ERRORS_PER_REQUEST;

    /**
     * Fail the request when the model calls a function that is not registered.
     */
    private boolean terminateOnUnknownCalls = false;

    /**
     * Append exception messages to the error text returned to the model.
     */
    private boolean includeDetailedErrors = false;

    public FunctionInvocationConfiguration toConfiguration() {
        return FunctionInvocationConfiguration.builder()
                .enabled(enabled)
                .maxIterations(maxIterations)
                .maxConsecutiveErrorsPerRequest(maxConsecutiveErrorsPerRequest)
                .terminateOnUnknownCalls(terminateOnUnknownCalls)
                .includeDetailedErrors(includeDetailedErrors)
                .build();
    }
}
