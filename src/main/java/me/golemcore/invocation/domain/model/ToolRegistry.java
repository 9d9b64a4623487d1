package me.golemcore.invocation.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable name index of the tools in effect for one round. Later tools with
 * the same name replace earlier ones.
 */
public final class ToolRegistry {

    private static final ToolRegistry EMPTY = new ToolRegistry(Map.of());

    private final Map<String, Tool> toolsByName;

    private ToolRegistry(Map<String, Tool> toolsByName) {
        this.toolsByName = Collections.unmodifiableMap(toolsByName);
    }

    public static ToolRegistry empty() {
        return EMPTY;
    }

    public static ToolRegistry of(Collection<Tool> tools) {
        Map<String, Tool> index = new LinkedHashMap<>();
        if (tools != null) {
            for (Tool tool : tools) {
                index.put(tool.getName(), tool);
            }
        }
        return new ToolRegistry(index);
    }

    public Optional<Tool> resolve(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(toolsByName.get(name));
    }

    public boolean contains(String name) {
        return name != null && toolsByName.containsKey(name);
    }

    public boolean isEmpty() {
        return toolsByName.isEmpty();
    }

    public List<Tool> getTools() {
        return new ArrayList<>(toolsByName.values());
    }
}
