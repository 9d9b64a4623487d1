package me.golemcore.invocation.domain.component;

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

import me.golemcore.invocation.domain.model.ApprovalMode;
import me.golemcore.invocation.domain.model.ToolDefinition;
import me.golemcore.invocation.domain.model.ToolSpec;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A tool supplied as a component object rather than a ready {@code Tool}.
 *
 * <p>
 * Components may be listed directly in the chat options. They are wrapped into
 * a {@code Tool} once per instance, so invocation limits hold across rounds.
 */
public interface ToolComponent extends ToolSpec {

    /**
     * Returns the tool definition with JSON Schema for function calling. The
     * definition includes the tool name, description, and parameter schema.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with arguments that already passed schema validation.
     *
     * @param parameters
     *            the execution parameters as a map
     * @return a future containing the tool output
     */
    CompletableFuture<Object> execute(Map<String, Object> parameters);

    default String getToolName() {
        return getDefinition().getName();
    }

    default ApprovalMode getApprovalMode() {
        return ApprovalMode.NEVER_REQUIRE;
    }

    /**
     * Maximum number of invocations, or {@code null} for no limit.
     */
    default Integer getMaxInvocations() {
        return null;
    }

    /**
     * Maximum number of failed invocations, or {@code null} for no limit.
     */
    default Integer getMaxInvocationExceptions() {
        return null;
    }

    /**
     * Components disabled via configuration are not offered for execution.
     */
    default boolean isEnabled() {
        return true;
    }
}
