package me.golemcore.invocation.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FunctionInvocationConfigurationTest {

    @Test
    void shouldApplyDefaults() {
        FunctionInvocationConfiguration configuration = FunctionInvocationConfiguration.defaults();

        assertTrue(configuration.isEnabled());
        assertEquals(40, configuration.getMaxIterations());
        assertEquals(3, configuration.getMaxConsecutiveErrorsPerRequest());
        assertFalse(configuration.isTerminateOnUnknownCalls());
        assertFalse(configuration.isIncludeDetailedErrors());
        assertTrue(configuration.getAdditionalTools().isEmpty());
    }

    @Test
    void shouldRejectInvalidLimits() {
        assertThrows(IllegalArgumentException.class,
                () -> FunctionInvocationConfiguration.builder().maxIterations(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> FunctionInvocationConfiguration.builder().maxConsecutiveErrorsPerRequest(-1).build());
    }

    @Test
    void shouldAllowZeroConsecutiveErrors() {
        FunctionInvocationConfiguration configuration = FunctionInvocationConfiguration.builder()
                .maxConsecutiveErrorsPerRequest(0)
                .build();

        assertEquals(0, configuration.getMaxConsecutiveErrorsPerRequest());
    }

    @Test
    void shouldRecognizeAdditionalTools() {
        FunctionInvocationConfiguration configuration = FunctionInvocationConfiguration.builder()
                .additionalTools(List.of(Tool.declarationOnly("web_search", "Hosted search", null)))
                .build();

        assertTrue(configuration.isAdditionalTool("web_search"));
        assertFalse(configuration.isAdditionalTool("get_weather"));
        assertFalse(configuration.isAdditionalTool(null));
    }
}
