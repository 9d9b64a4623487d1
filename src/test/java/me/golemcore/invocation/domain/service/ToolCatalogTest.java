package me.golemcore.invocation.domain.service;

import me.golemcore.invocation.domain.component.ToolComponent;
import me.golemcore.invocation.domain.model.ApprovalMode;
import me.golemcore.invocation.domain.model.RawToolSpec;
import me.golemcore.invocation.domain.model.Tool;
import me.golemcore.invocation.domain.model.ToolDefinition;
import me.golemcore.invocation.domain.model.ToolException;
import me.golemcore.invocation.domain.model.ToolFailureKind;
import me.golemcore.invocation.domain.model.ToolRegistry;
import me.golemcore.invocation.domain.model.ToolSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolCatalogTest {

    private static final String TOOL_NAME = "lookup";

    private ToolCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new ToolCatalog();
    }

    private static ToolComponent component(String name, boolean enabled) {
        ToolComponent component = mock(ToolComponent.class);
        when(component.getDefinition()).thenReturn(ToolDefinition.simple(name, "Component tool"));
        when(component.getToolName()).thenReturn(name);
        when(component.isEnabled()).thenReturn(enabled);
        when(component.getApprovalMode()).thenReturn(ApprovalMode.ALWAYS_REQUIRE);
        when(component.getMaxInvocations()).thenReturn(2);
        when(component.getMaxInvocationExceptions()).thenReturn(1);
        when(component.execute(any())).thenReturn(CompletableFuture.completedFuture("done"));
        return component;
    }

    @Test
    void shouldWrapComponentOnceAcrossRegistryBuilds() {
        ToolComponent component = component(TOOL_NAME, true);

        Tool first = catalog.buildRegistry(List.of(component)).resolve(TOOL_NAME).orElseThrow();
        Tool second = catalog.buildRegistry(List.of(component)).resolve(TOOL_NAME).orElseThrow();

        assertSame(first, second);
        assertEquals(ApprovalMode.ALWAYS_REQUIRE, first.getApprovalMode());
        assertEquals(2, first.getMaxInvocations());
        assertEquals(1, first.getMaxInvocationExceptions());
    }

    @Test
    void shouldDelegateInvocationToComponent() {
        ToolComponent component = component(TOOL_NAME, true);
        Tool tool = catalog.wrap(component);

        assertEquals("done", tool.invoke(Map.of("q", "x")).join());
        verify(component).execute(Map.of("q", "x"));
    }

    @Test
    void shouldApplyComponentExceptionLimit() {
        ToolComponent component = component(TOOL_NAME, true);
        when(component.execute(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));
        Tool tool = catalog.wrap(component);

        assertTrue(tool.invoke(Map.of()).isCompletedExceptionally());
        CompletableFuture<Object> limited = tool.invoke(Map.of());

        CompletionException error = assertThrows(CompletionException.class, limited::join);
        ToolException cause = assertInstanceOf(ToolException.class, error.getCause());
        assertEquals(ToolFailureKind.EXCEPTION_LIMIT_EXCEEDED, cause.getKind());
        verify(component, times(1)).execute(any());
    }

    @Test
    void shouldSkipRawSpecsAndDisabledComponents() {
        List<ToolSpec> specs = List.of(
                new RawToolSpec(Map.of("type", "web_search")),
                component("disabled", false));

        ToolRegistry registry = catalog.buildRegistry(specs);

        assertTrue(registry.isEmpty());
    }

    @Test
    void shouldLetLaterToolsOverrideEarlierOnes() {
        Tool earlier = Tool.declarationOnly(TOOL_NAME, "first", null);
        Tool later = Tool.declarationOnly(TOOL_NAME, "second", null);

        ToolRegistry registry = catalog.buildRegistry(List.of(earlier, later));

        assertSame(later, registry.resolve(TOOL_NAME).orElseThrow());
        assertEquals(1, registry.getTools().size());
        assertFalse(registry.resolve("other").isPresent());
    }
}
