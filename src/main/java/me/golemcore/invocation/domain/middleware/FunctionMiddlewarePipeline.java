package me.golemcore.invocation.domain.middleware;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Chains middlewares around a final invocation step, first middleware outermost.
 */
@Slf4j
public class FunctionMiddlewarePipeline {

    private final List<FunctionMiddleware> middlewares;

    public FunctionMiddlewarePipeline(List<FunctionMiddleware> middlewares) {
        this.middlewares = middlewares != null ? List.copyOf(middlewares) : List.of();
        log.debug("[Middleware] Pipeline created with {} middleware(s)", this.middlewares.size());
    }

    public static FunctionMiddlewarePipeline empty() {
        return new FunctionMiddlewarePipeline(List.of());
    }

    public boolean hasMiddlewares() {
        return !middlewares.isEmpty();
    }

    public CompletableFuture<Object> execute(FunctionInvocationContext context, FunctionInvocationNext finalStep) {
        return proceed(0, context, finalStep);
    }

    private CompletableFuture<Object> proceed(int index, FunctionInvocationContext context,
            FunctionInvocationNext finalStep) {
        if (index >= middlewares.size()) {
            return finalStep.proceed(context);
        }
        FunctionMiddleware middleware = middlewares.get(index);
        try {
            CompletableFuture<Object> result = middleware.invoke(context,
                    nextContext -> proceed(index + 1, nextContext, finalStep));
            return result != null ? result : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
