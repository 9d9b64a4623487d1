package me.golemcore.invocation.domain.model;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * The callable behind a {@link Tool}.
 */
@FunctionalInterface
public interface ToolImplementation {

    CompletableFuture<Object> invoke(Map<String, Object> arguments);

    /**
     * Adapts a blocking function by running it on the common pool.
     */
    static ToolImplementation of(Function<Map<String, Object>, Object> function) {
        return arguments -> CompletableFuture.supplyAsync(() -> function.apply(arguments));
    }
}
