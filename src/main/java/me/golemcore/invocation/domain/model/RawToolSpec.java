package me.golemcore.invocation.domain.model;

import java.util.Map;

/**
 * Provider-native tool definition (for example a hosted search tool). It is
 * passed to the model untouched and never executed locally.
 */
public record RawToolSpec(Map<String, Object> definition) implements ToolSpec {
}
