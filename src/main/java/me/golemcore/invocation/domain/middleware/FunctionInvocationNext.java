package me.golemcore.invocation.domain.middleware;

import java.util.concurrent.CompletableFuture;

/**
 * The remainder of the middleware chain, ending with the tool itself.
 */
@FunctionalInterface
public interface FunctionInvocationNext {

    CompletableFuture<Object> proceed(FunctionInvocationContext context);
}
