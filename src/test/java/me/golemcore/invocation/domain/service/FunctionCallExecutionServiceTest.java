package me.golemcore.invocation.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.invocation.domain.middleware.FunctionMiddleware;
import me.golemcore.invocation.domain.middleware.FunctionMiddlewarePipeline;
import me.golemcore.invocation.domain.model.Content;
import me.golemcore.invocation.domain.model.FunctionApprovalRequestContent;
import me.golemcore.invocation.domain.model.FunctionApprovalResponseContent;
import me.golemcore.invocation.domain.model.FunctionCallContent;
import me.golemcore.invocation.domain.model.FunctionInvocationConfiguration;
import me.golemcore.invocation.domain.model.FunctionResultContent;
import me.golemcore.invocation.domain.model.Tool;
import me.golemcore.invocation.domain.model.ToolFailureKind;
import me.golemcore.invocation.domain.model.ToolRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FunctionCallExecutionServiceTest {

    private static final Map<String, Object> CITY_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of("city", Map.of("type", "string"), "units", Map.of("type", "string")),
            "required", List.of("city"));

    private ExecutorService executor;
    private ToolArgumentValidator validator;
    private FunctionCallExecutionService service;
    private FunctionInvocationConfiguration defaults;
    private FunctionInvocationConfiguration detailed;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        validator = new ToolArgumentValidator(new ObjectMapper());
        service = new FunctionCallExecutionService(validator, FunctionMiddlewarePipeline.empty());
        defaults = FunctionInvocationConfiguration.defaults();
        detailed = FunctionInvocationConfiguration.builder().includeDetailedErrors(true).build();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Tool tool(String name, Object result) {
        return Tool.builder()
                .name(name)
                .inputSchema(CITY_SCHEMA)
                .implementation(args -> CompletableFuture.completedFuture(result))
                .build();
    }

    private static Tool failingTool(String name, RuntimeException error) {
        return Tool.builder()
                .name(name)
                .inputSchema(CITY_SCHEMA)
                .implementation(args -> CompletableFuture.failedFuture(error))
                .build();
    }

    private static FunctionCallContent call(String callId, String name, String arguments) {
        return FunctionCallContent.of(callId, name, arguments);
    }

    private FunctionCallBatchResult run(List<? extends Content> calls, ToolRegistry registry,
            FunctionInvocationConfiguration configuration) {
        return service.executeBatch(calls, registry, null, configuration, 0).join();
    }

    private static FunctionResultContent result(FunctionCallBatchResult batch, int index) {
        return assertInstanceOf(FunctionResultContent.class, batch.results().get(index));
    }

    @Test
    void shouldKeepResultOrderWhenLaterCallFinishesFirst() {
        Tool slow = Tool.builder()
                .name("slow")
                .implementation(args -> CompletableFuture.supplyAsync(() -> {
                    sleep(150);
                    return "slow result";
                }, executor))
                .build();
        Tool fast = Tool.builder()
                .name("fast")
                .implementation(args -> CompletableFuture.completedFuture("fast result"))
                .build();

        FunctionCallBatchResult batch = run(List.of(call("c1", "slow", "{}"), call("c2", "fast", "{}")),
                ToolRegistry.of(List.of(slow, fast)), defaults);

        assertEquals("c1", result(batch, 0).getCallId());
        assertEquals("slow result", result(batch, 0).getResult());
        assertEquals("c2", result(batch, 1).getCallId());
        assertEquals("fast result", result(batch, 1).getResult());
        assertFalse(batch.hasErrors());
    }

    @Test
    void shouldRunCallsOfOneBatchConcurrently() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        Tool rendezvous = Tool.builder()
                .name("rendezvous")
                .implementation(args -> CompletableFuture.supplyAsync(() -> {
                    bothStarted.countDown();
                    try {
                        return bothStarted.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return false;
                    }
                }, executor))
                .build();

        FunctionCallBatchResult batch = run(
                List.of(call("c1", "rendezvous", "{}"), call("c2", "rendezvous", "{}")),
                ToolRegistry.of(List.of(rendezvous)), defaults);

        assertEquals(Boolean.TRUE, result(batch, 0).getResult());
        assertEquals(Boolean.TRUE, result(batch, 1).getResult());
    }

    @Test
    void shouldReportUnknownFunctionWithoutAbortingSiblings() {
        FunctionCallBatchResult batch = run(
                List.of(call("c1", "missing", "{}"), call("c2", "weather", "{\"city\":\"Oslo\"}")),
                ToolRegistry.of(List.of(tool("weather", "rain"))), defaults);

        FunctionResultContent unknown = result(batch, 0);
        assertEquals("Error: Requested function \"missing\" not found.", unknown.getResult());
        assertEquals(ToolFailureKind.UNKNOWN_TOOL, unknown.getError().kind());
        assertEquals("rain", result(batch, 1).getResult());
        assertTrue(batch.hasErrors());
    }

    @Test
    void shouldReportArgumentValidationFailure() {
        ToolRegistry registry = ToolRegistry.of(List.of(tool("weather", "rain")));

        FunctionResultContent plain = result(run(List.of(call("c1", "weather", "{\"city\":7}")), registry, defaults),
                0);
        FunctionResultContent verbose = result(run(List.of(call("c1", "weather", "{}")), registry, detailed), 0);

        assertEquals("Error: Argument parsing failed.", plain.getResult());
        assertEquals(ToolFailureKind.ARGUMENT_VALIDATION_FAILED, plain.getError().kind());
        assertTrue(((String) verbose.getResult()).startsWith("Error: Argument parsing failed. Exception: "));
    }

    @Test
    void shouldReportFunctionFailureWithOptionalDetail() {
        ToolRegistry registry = ToolRegistry.of(List.of(failingTool("weather", new IllegalStateException("boom"))));
        List<FunctionCallContent> calls = List.of(call("c1", "weather", "{\"city\":\"Oslo\"}"));

        FunctionResultContent plain = result(run(calls, registry, defaults), 0);
        FunctionResultContent verbose = result(run(calls, registry, detailed), 0);

        assertEquals("Error: Function failed.", plain.getResult());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, plain.getError().kind());
        assertInstanceOf(IllegalStateException.class, plain.getError().cause());
        assertEquals("Error: Function failed. Exception: boom", verbose.getResult());
    }

    @Test
    void shouldKeepFailureKindOfToolLimits() {
        Tool declared = Tool.declarationOnly("weather", "Declared", CITY_SCHEMA);

        FunctionResultContent failed = result(run(List.of(call("c1", "weather", "{\"city\":\"Oslo\"}")),
                ToolRegistry.of(List.of(declared)), defaults), 0);

        assertEquals(ToolFailureKind.DECLARATION_ONLY, failed.getError().kind());
        assertEquals("Error: Function failed.", failed.getResult());
    }

    @Test
    void shouldMergeOnlyDeclaredAdditionalArgumentsUnderModelArguments() {
        AtomicReference<Map<String, Object>> received = new AtomicReference<>();
        Tool weather = Tool.builder()
                .name("weather")
                .inputSchema(CITY_SCHEMA)
                .implementation(args -> {
                    received.set(args);
                    return CompletableFuture.completedFuture("ok");
                })
                .build();
        Map<String, Object> additional = Map.of("units", "metric", "city", "Default", "session", "s-1");

        service.executeBatch(List.of(call("c1", "weather", "{\"city\":\"Oslo\"}")),
                ToolRegistry.of(List.of(weather)), additional, defaults, 0).join();

        assertEquals(Map.of("city", "Oslo", "units", "metric"), received.get());
    }

    @Test
    void shouldReportUnserializableAdditionalArgumentAsValidationFailure() {
        Tool open = Tool.builder()
                .name("open")
                .inputSchema(Map.of("type", "object"))
                .implementation(args -> CompletableFuture.completedFuture("ok"))
                .build();
        Map<String, Object> additional = Map.of("ctx", new Object());

        FunctionCallBatchResult batch = service.executeBatch(
                List.of(call("c1", "open", "{}"), call("c2", "weather", "{\"city\":\"Oslo\"}")),
                ToolRegistry.of(List.of(open, tool("weather", "sunny"))), additional, defaults, 0).join();

        FunctionResultContent failed = result(batch, 0);
        assertEquals("c1", failed.getCallId());
        assertEquals(ToolFailureKind.ARGUMENT_VALIDATION_FAILED, failed.getError().kind());
        assertEquals("Error: Argument parsing failed.", failed.getResult());
        assertEquals(0, open.getInvocationCount());
        assertEquals("sunny", result(batch, 1).getResult());
    }

    @Test
    void shouldTurnSynchronousFailureIntoResultWithoutAbortingSiblings() {
        ToolArgumentValidator broken = mock(ToolArgumentValidator.class);
        when(broken.validate(any(), any())).thenThrow(new IllegalStateException("validator down"));
        FunctionCallExecutionService brokenService = new FunctionCallExecutionService(broken,
                FunctionMiddlewarePipeline.empty());

        FunctionCallBatchResult batch = brokenService.executeBatch(
                List.of(call("c1", "weather", "{\"city\":\"Oslo\"}"), call("c2", "missing", "{}")),
                ToolRegistry.of(List.of(tool("weather", "sunny"))), null, detailed, 0).join();

        FunctionResultContent failed = result(batch, 0);
        assertEquals("c1", failed.getCallId());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, failed.getError().kind());
        assertEquals("Error: Function failed. Exception: validator down", failed.getResult());
        assertEquals(ToolFailureKind.UNKNOWN_TOOL, result(batch, 1).getError().kind());
    }

    @Test
    void shouldExecuteApprovedResponseAndPassThroughHostedOnes() {
        FunctionCallContent localCall = call("c1", "weather", "{\"city\":\"Oslo\"}");
        FunctionCallContent hostedCall = call("c2", "hosted_search", "{}");
        FunctionApprovalResponseContent local = FunctionApprovalRequestContent.forCall(localCall).createResponse(true);
        FunctionApprovalResponseContent hosted = FunctionApprovalRequestContent.forCall(hostedCall)
                .createResponse(true);

        FunctionCallBatchResult batch = run(List.of(local, hosted), ToolRegistry.of(List.of(tool("weather", "sun"))),
                defaults);

        assertEquals("sun", result(batch, 0).getResult());
        assertSame(hosted, batch.results().get(1));
    }

    @Test
    void shouldReportTerminationRequestedByMiddleware() {
        FunctionMiddleware stopAfterCall = (context, next) -> {
            context.terminate();
            return next.proceed(context);
        };
        FunctionCallExecutionService withMiddleware = new FunctionCallExecutionService(validator,
                new FunctionMiddlewarePipeline(List.of(stopAfterCall)));

        FunctionCallBatchResult batch = withMiddleware.executeBatch(
                List.of(call("c1", "weather", "{\"city\":\"Oslo\"}")),
                ToolRegistry.of(List.of(tool("weather", "sun"))), null, defaults, 0).join();

        assertTrue(batch.terminate());
        assertEquals("sun", result(batch, 0).getResult());
        assertNull(result(batch, 0).getError());
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
