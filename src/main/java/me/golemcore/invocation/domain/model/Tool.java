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

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A named callable exposed to the model.
 *
 * <p>
 * A tool without an implementation is declaration-only: the model may request
 * it but it is never run locally. Invocation and failure counters live on the
 * tool instance and are never reset, so limits apply across all rounds of a
 * conversation that reuses the same instance.
 */
@Getter
public final class Tool implements ToolSpec {

    private final String name;
    private final String description;
    private final Map<String, Object> inputSchema;
    private final ApprovalMode approvalMode;
    private final Integer maxInvocations;
    private final Integer maxInvocationExceptions;
    private final ToolImplementation implementation;
    private final Map<String, Object> additionalProperties;

    @Getter(AccessLevel.NONE)
    private final AtomicInteger invocationCount = new AtomicInteger();

    @Getter(AccessLevel.NONE)
    private final AtomicInteger invocationExceptionCount = new AtomicInteger();

    @Getter(AccessLevel.NONE)
    private final Object invocationLock = new Object();

    @Builder
    private Tool(String name, String description, Map<String, Object> inputSchema, ApprovalMode approvalMode,
            Integer maxInvocations, Integer maxInvocationExceptions, ToolImplementation implementation,
            Map<String, Object> additionalProperties) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        if (maxInvocations != null && maxInvocations < 1) {
            throw new IllegalArgumentException("maxInvocations must be at least 1, got " + maxInvocations);
        }
        if (maxInvocationExceptions != null && maxInvocationExceptions < 1) {
            throw new IllegalArgumentException(
                    "maxInvocationExceptions must be at least 1, got " + maxInvocationExceptions);
        }
        this.name = name;
        this.description = description != null ? description : "";
        this.inputSchema = inputSchema != null ? inputSchema : ToolDefinition.emptySchema();
        this.approvalMode = approvalMode != null ? approvalMode : ApprovalMode.NEVER_REQUIRE;
        this.maxInvocations = maxInvocations;
        this.maxInvocationExceptions = maxInvocationExceptions;
        this.implementation = implementation;
        this.additionalProperties = additionalProperties;
    }

    public static Tool declarationOnly(String name, String description, Map<String, Object> inputSchema) {
        return Tool.builder()
                .name(name)
                .description(description)
                .inputSchema(inputSchema)
                .build();
    }

    public boolean isDeclarationOnly() {
        return implementation == null;
    }

    public boolean requiresApproval() {
        return approvalMode == ApprovalMode.ALWAYS_REQUIRE;
    }

    public int getInvocationCount() {
        return invocationCount.get();
    }

    public int getInvocationExceptionCount() {
        return invocationExceptionCount.get();
    }

    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(inputSchema)
                .build();
    }

    public Map<String, Object> toJsonSchemaSpec() {
        return getDefinition().toJsonSchemaSpec();
    }

    /**
     * Runs the implementation with already validated arguments.
     *
     * @return a future completed with the tool output, or failed with a
     *         {@link ToolException} when the tool cannot run and with the
     *         implementation's own exception when it fails
     */
    public CompletableFuture<Object> invoke(Map<String, Object> arguments) {
        if (implementation == null) {
            return CompletableFuture.failedFuture(new ToolException(ToolFailureKind.DECLARATION_ONLY,
                    "Tool '" + name + "' is declaration only and cannot be invoked"));
        }
        synchronized (invocationLock) {
            if (maxInvocations != null && invocationCount.get() >= maxInvocations) {
                return CompletableFuture.failedFuture(new ToolException(ToolFailureKind.INVOCATION_LIMIT_EXCEEDED,
                        "Tool '" + name + "' reached its maximum of " + maxInvocations + " invocations"));
            }
            if (maxInvocationExceptions != null && invocationExceptionCount.get() >= maxInvocationExceptions) {
                return CompletableFuture.failedFuture(new ToolException(ToolFailureKind.EXCEPTION_LIMIT_EXCEEDED,
                        "Tool '" + name + "' reached its maximum of " + maxInvocationExceptions
                                + " failed invocations"));
            }
            invocationCount.incrementAndGet();
        }

        CompletableFuture<Object> future;
        try {
            future = implementation.invoke(arguments);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            future = CompletableFuture.completedFuture(null);
        }
        return future.whenComplete((result, error) -> {
            if (error != null) {
                invocationExceptionCount.incrementAndGet();
            }
        });
    }

    @Override
    public String toString() {
        return "Tool{" + name + "}";
    }
}
