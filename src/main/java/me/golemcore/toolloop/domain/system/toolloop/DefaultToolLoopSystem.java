package me.golemcore.toolloop.domain.system.toolloop;

import me.golemcore.toolloop.domain.model.CancellationToken;
import me.golemcore.toolloop.domain.model.Conversation;
import me.golemcore.toolloop.domain.model.LlmRequest;
import me.golemcore.toolloop.domain.model.LlmResponse;
import me.golemcore.toolloop.domain.model.LlmUsage;
import me.golemcore.toolloop.domain.model.Message;
import me.golemcore.toolloop.domain.model.ToolCallResult;
import me.golemcore.toolloop.domain.model.ToolDefinition;
import me.golemcore.toolloop.domain.model.ToolLoopEvent;
import me.golemcore.toolloop.domain.model.ToolLoopEventType;
import me.golemcore.toolloop.domain.service.ToolRegistry;
import me.golemcore.toolloop.domain.system.LlmErrorClassifier;
import me.golemcore.toolloop.infrastructure.config.ToolLoopProperties;
import me.golemcore.toolloop.port.outbound.LlmPort;
import me.golemcore.toolloop.port.outbound.ToolLoopEventPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * Tool loop orchestrator.
 *
 * <p>
 * AWAITING_MODEL: query the model with the whole conversation. A reply without
 * tool calls is the final answer (DONE). A reply with tool calls is appended and
 * the batch is dispatched (AWAITING_TOOLS); its results are appended in request
 * order and the model is queried again. Model failures, cancellation and the
 * round cap end the run in FAILED.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    static final String ROUND_LIMIT_EXCEEDED_CODE = "toolloop.round_limit_exceeded";
    static final String TOOLS_CANCELLED_CODE = "toolloop.tools.cancelled";

    private static final LlmResponse INTERRUPTED = LlmResponse.builder().build();

    private final LlmPort llmPort;
    private final ToolExecutorPort toolExecutor;
    private final HistoryWriter historyWriter;
    private final ToolRegistry toolRegistry;
    private final ToolLoopEventPort eventPort;
    private final ToolLoopProperties settings;
    private final Clock clock;

    public DefaultToolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutor, HistoryWriter historyWriter,
            ToolRegistry toolRegistry, ToolLoopEventPort eventPort, ToolLoopProperties settings) {
        this(llmPort, toolExecutor, historyWriter, toolRegistry, eventPort, settings, Clock.systemUTC());
    }

    // Visible for testing
    public DefaultToolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutor, HistoryWriter historyWriter,
            ToolRegistry toolRegistry, ToolLoopEventPort eventPort, ToolLoopProperties settings, Clock clock) {
        this.llmPort = llmPort;
        this.toolExecutor = toolExecutor;
        this.historyWriter = historyWriter;
        this.toolRegistry = toolRegistry != null ? toolRegistry : ToolRegistry.empty();
        this.eventPort = eventPort != null ? eventPort : ToolLoopEventPort.noop();
        this.settings = settings != null ? settings : new ToolLoopProperties();
        this.clock = clock;
    }

    @Override
    public ToolLoopResult run(ToolLoopInvocation invocation) {
        Objects.requireNonNull(invocation, "invocation");
        if (invocation.getInputMessages().isEmpty()) {
            throw new IllegalArgumentException("Tool loop invocation has no input messages");
        }
        Integer maxToolRounds = invocation.getMaxToolRounds() != null ? invocation.getMaxToolRounds()
                : settings.getMaxToolRounds();
        if (maxToolRounds != null && maxToolRounds < 0) {
            throw new IllegalArgumentException("maxToolRounds must not be negative: " + maxToolRounds);
        }

        Run run = new Run(
                invocation.getInvocationId() != null ? invocation.getInvocationId() : UUID.randomUUID().toString(),
                new Conversation(invocation.getSystemMessages(), invocation.getInputMessages()),
                deriveToken(invocation),
                invocation.getTools() != null ? List.copyOf(invocation.getTools()) : toolRegistry.getDefinitions(),
                invocation.getModel(),
                maxToolRounds);

        log.debug("[ToolLoop] Invocation {} started: {} messages, {} tools, maxToolRounds={}", run.invocationId,
                run.conversation.size(), run.tools.size(), maxToolRounds != null ? maxToolRounds : "unbounded");
        Map<String, Object> started = new LinkedHashMap<>();
        started.put("messages", run.conversation.size());
        started.put("tools", run.tools.size());
        if (maxToolRounds != null) {
            started.put("maxToolRounds", maxToolRounds);
        }
        try {
            publish(run, ToolLoopEventType.LOOP_STARTED, started);
            while (true) {
                ToolLoopResult outcome = awaitModel(run);
                if (outcome != null) {
                    return outcome;
                }
                outcome = awaitTools(run);
                if (outcome != null) {
                    return outcome;
                }
            }
        } finally {
            run.token.release();
        }
    }

    // ==================== AWAITING_MODEL ====================

    private ToolLoopResult awaitModel(Run run) {
        if (run.token.isCancellationRequested()) {
            return fail(run, ToolLoopFailure.of(ToolLoopFailureKind.CANCELLED, ToolLoopState.AWAITING_MODEL,
                    LlmErrorClassifier.REQUEST_ABORTED, "Cancelled: " + run.token.getReason()));
        }

        LlmRequest request = LlmRequest.builder()
                .model(run.model)
                .messages(run.conversation.snapshot())
                .tools(run.tools)
                .invocationId(run.invocationId)
                .build();
        run.llmCalls++;
        log.debug("[ToolLoop] Querying model (invocation={}, call={}, messages={})", run.invocationId,
                run.llmCalls, request.getMessages().size());
        publish(run, ToolLoopEventType.MODEL_QUERIED, Map.of("messages", request.getMessages().size()));

        LlmResponse response;
        try {
            response = queryModel(request, run.token);
        } catch (CancellationException e) {
            return fail(run, new ToolLoopFailure(ToolLoopFailureKind.CANCELLED, ToolLoopState.AWAITING_MODEL,
                    LlmErrorClassifier.REQUEST_ABORTED, "Cancelled: " + cancellationReason(run.token, e), e));
        } catch (RuntimeException e) {
            Throwable cause = unwrap(e);
            if (run.token.isCancellationRequested()) {
                return fail(run, new ToolLoopFailure(ToolLoopFailureKind.CANCELLED, ToolLoopState.AWAITING_MODEL,
                        LlmErrorClassifier.REQUEST_ABORTED, "Cancelled: " + run.token.getReason(), cause));
            }
            String code = LlmErrorClassifier.classifyFromThrowable(cause);
            return fail(run, new ToolLoopFailure(ToolLoopFailureKind.MODEL_REQUEST_FAILED,
                    ToolLoopState.AWAITING_MODEL, code,
                    LlmErrorClassifier.withCode(code, "Model request failed: " + describe(cause)), cause));
        }

        if (response == null) {
            return fail(run, ToolLoopFailure.of(ToolLoopFailureKind.MODEL_REQUEST_FAILED,
                    ToolLoopState.AWAITING_MODEL, LlmErrorClassifier.NO_ASSISTANT_MESSAGE,
                    LlmErrorClassifier.withCode(LlmErrorClassifier.NO_ASSISTANT_MESSAGE,
                            "Model returned no assistant message")));
        }
        if (response.getUsage() != null) {
            run.usage = run.usage.plus(response.getUsage());
        }

        int requested = response.hasToolCalls() ? response.getToolCalls().size() : 0;
        Map<String, Object> responded = new LinkedHashMap<>();
        responded.put("toolCalls", requested);
        if (response.getFinishReason() != null) {
            responded.put("finishReason", response.getFinishReason());
        }
        publish(run, ToolLoopEventType.MODEL_RESPONDED, responded);

        if (!response.hasToolCalls()) {
            Message finalMessage = historyWriter.appendFinalAssistantAnswer(run.conversation, response);
            return finish(run, finalMessage);
        }

        String malformed = validateToolCalls(response.getToolCalls());
        if (malformed != null) {
            log.warn("[ToolLoop] Malformed tool calls from model (invocation={}): {}", run.invocationId, malformed);
            return fail(run, ToolLoopFailure.of(ToolLoopFailureKind.MODEL_REQUEST_FAILED,
                    ToolLoopState.AWAITING_MODEL, LlmErrorClassifier.MALFORMED_TOOL_CALLS,
                    LlmErrorClassifier.withCode(LlmErrorClassifier.MALFORMED_TOOL_CALLS, malformed)));
        }

        if (run.maxToolRounds != null && run.toolRounds >= run.maxToolRounds) {
            return fail(run, ToolLoopFailure.of(ToolLoopFailureKind.ROUND_LIMIT_EXCEEDED,
                    ToolLoopState.AWAITING_MODEL, ROUND_LIMIT_EXCEEDED_CODE,
                    "Model requested " + requested + " more tool call(s) after reaching max tool rounds ("
                            + run.maxToolRounds + ")"));
        }

        historyWriter.appendAssistantToolCalls(run.conversation, response);
        run.pendingToolCalls = List.copyOf(response.getToolCalls());
        return null;
    }

    private LlmResponse queryModel(LlmRequest request, CancellationToken token) {
        CompletableFuture<LlmResponse> future = llmPort.chat(request, token);
        if (future == null) {
            return null;
        }
        LlmResponse response = future
                .applyToEither(token.whenCancelled().thenApply(reason -> INTERRUPTED), Function.identity())
                .join();
        if (response == INTERRUPTED) {
            future.cancel(true);
            throw new CancellationException(token.getReason());
        }
        return response;
    }

    private static String validateToolCalls(List<Message.ToolCall> toolCalls) {
        Set<String> ids = new HashSet<>();
        for (Message.ToolCall toolCall : toolCalls) {
            if (toolCall == null) {
                return "tool call must not be null";
            }
            String id = toolCall.getId();
            if (id == null || id.isBlank()) {
                return "tool call '" + toolCall.getName() + "' has no id";
            }
            if (!ids.add(id)) {
                return "duplicate tool call id '" + id + "'";
            }
        }
        return null;
    }

    // ==================== AWAITING_TOOLS ====================

    private ToolLoopResult awaitTools(Run run) {
        run.toolRounds++;
        List<Message.ToolCall> toolCalls = run.pendingToolCalls;
        run.pendingToolCalls = List.of();

        log.debug("[ToolLoop] Dispatching {} tool call(s) (invocation={}, round={})", toolCalls.size(),
                run.invocationId, run.toolRounds);
        publish(run, ToolLoopEventType.TOOL_BATCH_DISPATCHED, Map.of(
                "calls", toolCalls.size(),
                "tools", toolCalls.stream().map(Message.ToolCall::getName).map(String::valueOf).toList()));

        List<ToolCallResult> results;
        try {
            results = toolExecutor.execute(toolCalls, run.token);
        } catch (RuntimeException e) {
            log.error("[ToolLoop] Tool executor failed (invocation={}, round={})", run.invocationId,
                    run.toolRounds, e);
            results = List.of();
        }
        List<Message> appended = historyWriter.appendToolResults(run.conversation, toolCalls, results);
        run.toolExecutions += toolCalls.size();

        long failed = appended.stream().filter(Message::isToolError).count();
        publish(run, ToolLoopEventType.TOOL_BATCH_COMPLETED, Map.of("calls", toolCalls.size(), "failed", failed));
        log.debug("[ToolLoop] Tool round {} completed: {} call(s), {} failed (invocation={})", run.toolRounds,
                toolCalls.size(), failed, run.invocationId);

        if (run.token.isCancellationRequested()) {
            return fail(run, ToolLoopFailure.of(ToolLoopFailureKind.CANCELLED, ToolLoopState.AWAITING_TOOLS,
                    TOOLS_CANCELLED_CODE, "Cancelled: " + run.token.getReason()));
        }
        return null;
    }

    // ==================== Terminal states ====================

    private ToolLoopResult finish(Run run, Message finalMessage) {
        log.info("[ToolLoop] Invocation {} done: {} LLM call(s), {} tool round(s), {} tool execution(s)",
                run.invocationId, run.llmCalls, run.toolRounds, run.toolExecutions);
        publish(run, ToolLoopEventType.LOOP_FINISHED, Map.of(
                "llmCalls", run.llmCalls,
                "toolRounds", run.toolRounds,
                "toolExecutions", run.toolExecutions));
        return new ToolLoopResult(ToolLoopState.DONE, run.conversation.snapshot(), finalMessage, null, run.llmCalls,
                run.toolRounds, run.toolExecutions, run.usage);
    }

    private ToolLoopResult fail(Run run, ToolLoopFailure failure) {
        log.info("[ToolLoop] Invocation {} failed in {}: {} ({})", run.invocationId, failure.phase(),
                failure.kind(), failure.message());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("kind", failure.kind().name());
        payload.put("phase", failure.phase().name());
        if (failure.errorCode() != null) {
            payload.put("errorCode", failure.errorCode());
        }
        publish(run, ToolLoopEventType.LOOP_FAILED, payload);
        return new ToolLoopResult(ToolLoopState.FAILED, run.conversation.snapshot(), null, failure, run.llmCalls,
                run.toolRounds, run.toolExecutions, run.usage);
    }

    // ==================== Helpers ====================

    private CancellationToken deriveToken(ToolLoopInvocation invocation) {
        CancellationToken callerToken = invocation.getCancellationToken() != null
                ? invocation.getCancellationToken()
                : CancellationToken.none();
        Duration deadline = invocation.getDeadline() != null ? invocation.getDeadline() : settings.getDeadline();
        return deadline != null ? callerToken.withTimeout(deadline) : callerToken.child();
    }

    private void publish(Run run, ToolLoopEventType type, Map<String, Object> payload) {
        ToolLoopEvent event = ToolLoopEvent.builder()
                .type(type)
                .timestamp(clock.instant())
                .invocationId(run.invocationId)
                .round(run.toolRounds)
                .payload(payload)
                .build();
        try {
            eventPort.publish(event);
        } catch (RuntimeException e) {
            log.warn("[ToolLoop] Event observer failed on {} (invocation={}): {}", type, run.invocationId,
                    e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cursor = error;
        while ((cursor instanceof CompletionException || cursor instanceof ExecutionException)
                && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        return cursor;
    }

    private static String cancellationReason(CancellationToken token, CancellationException e) {
        if (token.getReason() != null) {
            return token.getReason();
        }
        return e.getMessage() != null ? e.getMessage() : "cancelled";
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }

    /**
     * Mutable state of a single invocation. Never shared between threads.
     */
    private static final class Run {
        private final String invocationId;
        private final Conversation conversation;
        private final CancellationToken token;
        private final List<ToolDefinition> tools;
        private final String model;
        private final Integer maxToolRounds;

        private List<Message.ToolCall> pendingToolCalls = List.of();
        private int llmCalls;
        private int toolRounds;
        private int toolExecutions;
        private LlmUsage usage = LlmUsage.of(0, 0);

        private Run(String invocationId, Conversation conversation, CancellationToken token,
                List<ToolDefinition> tools, String model, Integer maxToolRounds) {
            this.invocationId = invocationId;
            this.conversation = conversation;
            this.token = token;
            this.tools = tools;
            this.model = model;
            this.maxToolRounds = maxToolRounds;
        }
    }
}
