package me.golemcore.toolloop.domain.system.toolloop;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolloop.domain.model.CancellationToken;
import me.golemcore.toolloop.domain.model.Message;
import me.golemcore.toolloop.domain.model.ToolCallResult;
import me.golemcore.toolloop.domain.model.ToolFailureKind;
import me.golemcore.toolloop.domain.service.ToolCallExecutionService;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

/**
 * Default ToolExecutorPort implementation based on
 * {@link ToolCallExecutionService}.
 *
 * <p>
 * Calls of one batch run concurrently on the supplied executor and are joined
 * before returning; results come back in request order whatever the completion
 * order. Once the cancellation token fires, every call still unresolved
 * completes at once with a {@link ToolFailureKind#CANCELLED} result, and calls
 * that have not started yet never start.
 */
@Slf4j
public class DefaultToolExecutor implements ToolExecutorPort {

    private final ToolCallExecutionService toolCallExecutionService;
    private final Executor executor;

    public DefaultToolExecutor(ToolCallExecutionService toolCallExecutionService, Executor executor) {
        this.toolCallExecutionService = toolCallExecutionService;
        this.executor = executor;
    }

    @Override
    public List<ToolCallResult> execute(List<Message.ToolCall> toolCalls, CancellationToken cancellationToken) {
        if (toolCalls == null || toolCalls.isEmpty()) {
            return List.of();
        }

        List<CompletableFuture<ToolCallResult>> futures = new ArrayList<>(toolCalls.size());
        for (Message.ToolCall toolCall : toolCalls) {
            futures.add(submit(toolCall, cancellationToken));
        }

        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

        List<ToolCallResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<ToolCallResult> future : futures) {
            results.add(future.join());
        }
        log.debug("[Tools] Batch of {} calls completed ({} failed)", results.size(),
                results.stream().filter(result -> !result.isSuccess()).count());
        return results;
    }

    private CompletableFuture<ToolCallResult> submit(Message.ToolCall toolCall, CancellationToken cancellationToken) {
        CompletableFuture<ToolCallResult> call;
        try {
            call = CompletableFuture.supplyAsync(
                    () -> toolCallExecutionService.execute(toolCall, cancellationToken), executor);
        } catch (RejectedExecutionException e) {
            log.error("[Tools] Executor rejected '{}' (id={})", toolCall.getName(), toolCall.getId(), e);
            return CompletableFuture.completedFuture(ToolCallResult.synthetic(toolCall,
                    ToolFailureKind.EXECUTION_FAILED, "Tool execution rejected: " + e.getMessage()));
        }

        CompletableFuture<ToolCallResult> cancelled = cancellationToken.whenCancelled()
                .thenApply(reason -> ToolCallResult.synthetic(toolCall, ToolFailureKind.CANCELLED,
                        "Cancelled: " + reason));

        return call
                .exceptionally(error -> ToolCallResult.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                        "Tool execution failed: " + error.getMessage()))
                .applyToEither(cancelled, Function.identity());
    }
}
