package me.golemcore.toolloop.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.toolloop.domain.component.ToolComponent;
import me.golemcore.toolloop.domain.model.CancellationToken;
import me.golemcore.toolloop.domain.model.Message;
import me.golemcore.toolloop.domain.model.ToolCallResult;
import me.golemcore.toolloop.domain.model.ToolDefinition;
import me.golemcore.toolloop.domain.model.ToolFailureKind;
import me.golemcore.toolloop.domain.model.ToolResult;
import me.golemcore.toolloop.domain.service.ToolCallExecutionService;
import me.golemcore.toolloop.domain.service.ToolRegistry;
import me.golemcore.toolloop.infrastructure.config.ToolLoopProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultToolExecutorTest {

    private ExecutorService executorService;
    private ExecutorService toolInvoker;
    private ToolLoopProperties.ToolsProperties settings;

    @BeforeEach
    void setUp() {
        executorService = Executors.newFixedThreadPool(4);
        toolInvoker = Executors.newCachedThreadPool();
        settings = new ToolLoopProperties.ToolsProperties();
        settings.setTimeout(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
        toolInvoker.shutdownNow();
    }

    @Test
    void shouldReturnEmptyListForEmptyBatch() {
        DefaultToolExecutor executor = executorWith();

        assertTrue(executor.execute(List.of(), CancellationToken.none()).isEmpty());
        assertTrue(executor.execute(null, CancellationToken.none()).isEmpty());
    }

    @Test
    void shouldReturnResultsInRequestOrderRegardlessOfCompletionOrder() {
        CountDownLatch fastDone = new CountDownLatch(1);
        DefaultToolExecutor executor = executorWith(
                tool("slow", args -> {
                    await(fastDone);
                    return ToolResult.success("slow result");
                }),
                tool("fast", args -> {
                    fastDone.countDown();
                    return ToolResult.success("fast result");
                }));

        List<ToolCallResult> results = executor.execute(List.of(call("c1", "slow"), call("c2", "fast")),
                CancellationToken.none());

        assertEquals(List.of("c1", "c2"), results.stream().map(ToolCallResult::toolCallId).toList());
        assertEquals("slow result", results.get(0).messageContent());
        assertEquals("fast result", results.get(1).messageContent());
    }

    @Test
    void shouldRunCallsOfOneBatchConcurrently() {
        CountDownLatch bothRunning = new CountDownLatch(2);
        Function<Map<String, Object>, ToolResult> rendezvous = args -> {
            bothRunning.countDown();
            return await(bothRunning) ? ToolResult.success("met") : ToolResult.failure("ran alone");
        };
        DefaultToolExecutor executor = executorWith(tool("left", rendezvous), tool("right", rendezvous));

        List<ToolCallResult> results = executor.execute(List.of(call("c1", "left"), call("c2", "right")),
                CancellationToken.none());

        assertTrue(results.stream().allMatch(ToolCallResult::isSuccess), results::toString);
    }

    @Test
    void shouldIsolateFailuresWithinBatch() {
        DefaultToolExecutor executor = executorWith(
                tool("ok", args -> ToolResult.success("fine")),
                tool("broken", args -> {
                    throw new IllegalStateException("boom");
                }));

        List<ToolCallResult> results = executor.execute(
                List.of(call("c1", "broken"), call("c2", "ok"), call("c3", "missing")), CancellationToken.none());

        assertEquals(3, results.size());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, results.get(0).failureKind());
        assertTrue(results.get(1).isSuccess());
        assertEquals(ToolFailureKind.UNKNOWN_TOOL, results.get(2).failureKind());
    }

    @Test
    void shouldResolveUnfinishedCallsAsCancelledWhenTokenFires() {
        CountDownLatch signalled = new CountDownLatch(1);
        ToolComponent hanging = new StubTool("hanging") {
            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters,
                    CancellationToken cancellationToken) {
                cancellationToken.onCancel(signalled::countDown);
                return new CompletableFuture<>();
            }
        };
        DefaultToolExecutor executor = executorWith(hanging, tool("ok", args -> ToolResult.success("fine")));
        CancellationToken token = CancellationToken.create();
        CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS).execute(() -> token.cancel("user stop"));

        long started = System.nanoTime();
        List<ToolCallResult> results = executor.execute(List.of(call("c1", "hanging"), call("c2", "ok")), token);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertTrue(elapsedMs < 4000, "batch should not wait for the per-tool timeout");
        assertEquals(ToolFailureKind.CANCELLED, results.get(0).failureKind());
        assertTrue(results.get(0).messageContent().contains("user stop"));
        assertTrue(results.get(1).isSuccess());
        assertTrue(await(signalled), "tool should observe the cancellation");
    }

    @Test
    void shouldNotStartCallsWhenAlreadyCancelled() {
        AtomicBoolean ran = new AtomicBoolean();
        DefaultToolExecutor executor = executorWith(tool("ok", args -> {
            ran.set(true);
            return ToolResult.success("fine");
        }));
        CancellationToken token = CancellationToken.create();
        token.cancel();

        List<ToolCallResult> results = executor.execute(List.of(call("c1", "ok")), token);

        assertEquals(ToolFailureKind.CANCELLED, results.get(0).failureKind());
        assertFalse(ran.get());
    }

    @Test
    void shouldTimeOutBlockingToolWithoutHoldingBackTheBatch() {
        settings.setTimeout(Duration.ofMillis(200));
        CountDownLatch never = new CountDownLatch(1);
        DefaultToolExecutor executor = executorWith(
                tool("stuck", args -> {
                    await(never);
                    return ToolResult.success("late");
                }),
                tool("ok", args -> ToolResult.success("fine")));

        long started = System.nanoTime();
        List<ToolCallResult> results = executor.execute(List.of(call("c1", "stuck"), call("c2", "ok")),
                CancellationToken.none());
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertEquals(ToolFailureKind.EXECUTION_FAILED, results.get(0).failureKind());
        assertTrue(results.get(0).messageContent().contains("timed out"));
        assertTrue(results.get(1).isSuccess());
        assertTrue(elapsedMillis < 1500, "returned after " + elapsedMillis + " ms");
    }

    @Test
    void shouldReportRejectedExecutionAsFailure() {
        ToolCallExecutionService service = new ToolCallExecutionService(
                ToolRegistry.of(tool("ok", args -> ToolResult.success("fine"))), settings, new ObjectMapper(),
                toolInvoker);
        DefaultToolExecutor executor = new DefaultToolExecutor(service, runnable -> {
            throw new RejectedExecutionException("queue full");
        });

        List<ToolCallResult> results = executor.execute(List.of(call("c1", "ok")), CancellationToken.none());

        assertEquals(ToolFailureKind.EXECUTION_FAILED, results.get(0).failureKind());
        assertTrue(results.get(0).synthetic());
        assertTrue(results.get(0).messageContent().contains("queue full"));
    }

    private DefaultToolExecutor executorWith(ToolComponent... tools) {
        ToolCallExecutionService service = new ToolCallExecutionService(ToolRegistry.of(tools), settings,
                new ObjectMapper(), toolInvoker);
        return new DefaultToolExecutor(service, executorService);
    }

    private static Message.ToolCall call(String id, String name) {
        return Message.ToolCall.builder()
                .id(id)
                .name(name)
                .arguments(Map.of())
                .build();
    }

    private static boolean await(CountDownLatch latch) {
        try {
            return latch.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static ToolComponent tool(String name, Function<Map<String, Object>, ToolResult> body) {
        return new StubTool(name) {
            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters,
                    CancellationToken cancellationToken) {
                return CompletableFuture.completedFuture(body.apply(parameters));
            }
        };
    }

    private abstract static class StubTool implements ToolComponent {
        private final String name;

        StubTool(String name) {
            this.name = name;
        }

        @Override
        public ToolDefinition getDefinition() {
            return ToolDefinition.simple(name, "Stub tool " + name);
        }
    }
}
