package me.golemcore.invocation.domain.model;

/**
 * Anything that may be listed in {@link ChatOptions#getTools()}: a
 * {@link Tool}, a {@code ToolComponent} or a provider-native
 * {@link RawToolSpec}.
 */
public interface ToolSpec {
}
