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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.invocation.domain.component.ToolComponent;
import me.golemcore.invocation.domain.model.Tool;
import me.golemcore.invocation.domain.model.ToolDefinition;
import me.golemcore.invocation.domain.model.ToolRegistry;
import me.golemcore.invocation.domain.model.ToolSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the tool specs listed in chat options into executable {@link Tool}s.
 *
 * <p>
 * Each {@link ToolComponent} is wrapped exactly once, so the invocation
 * counters of the wrapper survive registry rebuilds between rounds. Raw
 * provider specs are not executable and are skipped.
 */
@Slf4j
public class ToolCatalog {

    private final Map<ToolComponent, Tool> wrappedComponents = Collections.synchronizedMap(new IdentityHashMap<>());

    public ToolRegistry buildRegistry(List<? extends ToolSpec> specs) {
        return ToolRegistry.of(resolveTools(specs));
    }

    public List<Tool> resolveTools(List<? extends ToolSpec> specs) {
        List<Tool> tools = new ArrayList<>();
        if (specs == null) {
            return tools;
        }
        for (ToolSpec spec : specs) {
            if (spec instanceof Tool tool) {
                tools.add(tool);
            } else if (spec instanceof ToolComponent component) {
                if (component.isEnabled()) {
                    tools.add(wrap(component));
                } else {
                    log.debug("[Tools] Skipping disabled tool component '{}'", component.getToolName());
                }
            }
        }
        return tools;
    }

    public Tool wrap(ToolComponent component) {
        return wrappedComponents.computeIfAbsent(component, ToolCatalog::toTool);
    }

    private static Tool toTool(ToolComponent component) {
        ToolDefinition definition = component.getDefinition();
        log.debug("[Tools] Wrapping tool component '{}'", definition.getName());
        return Tool.builder()
                .name(definition.getName())
                .description(definition.getDescription())
                .inputSchema(definition.getInputSchema())
                .approvalMode(component.getApprovalMode())
                .maxInvocations(component.getMaxInvocations())
                .maxInvocationExceptions(component.getMaxInvocationExceptions())
                .implementation(component::execute)
                .build();
    }
}
