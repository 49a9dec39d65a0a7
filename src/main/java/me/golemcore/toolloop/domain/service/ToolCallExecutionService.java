package me.golemcore.toolloop.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolloop.domain.component.ToolComponent;
import me.golemcore.toolloop.domain.model.CancellationToken;
import me.golemcore.toolloop.domain.model.Message;
import me.golemcore.toolloop.domain.model.ToolCallResult;
import me.golemcore.toolloop.domain.model.ToolFailureKind;
import me.golemcore.toolloop.domain.model.ToolResult;
import me.golemcore.toolloop.infrastructure.config.ToolLoopProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

/**
 * Pure tool-call execution service: resolves the tool, validates arguments,
 * runs it under the caller's cancellation token and the per-tool timeout, then
 * renders and truncates the tool message.
 *
 * <p>
 * Never throws for a tool-level problem: unknown tools, invalid arguments,
 * failures and cancellation all come back as a failed {@link ToolCallResult}.
 * Does NOT mutate conversation history.
 *
 * <p>
 * {@link ToolComponent#execute} is started on {@code toolInvoker}, so the
 * per-tool timeout also covers tools that block before returning their future.
 */
@Slf4j
public class ToolCallExecutionService {

    private static final ToolResult INTERRUPTED = ToolResult.failure(ToolFailureKind.CANCELLED, "interrupted");

    private final ToolRegistry toolRegistry;
    private final ToolLoopProperties.ToolsProperties settings;
    private final ObjectMapper objectMapper;
    private final Executor toolInvoker;

    public ToolCallExecutionService(ToolRegistry toolRegistry, ToolLoopProperties.ToolsProperties settings,
            ObjectMapper objectMapper, Executor toolInvoker) {
        this.toolRegistry = toolRegistry;
        this.settings = settings != null ? settings : new ToolLoopProperties.ToolsProperties();
        this.objectMapper = objectMapper;
        this.toolInvoker = toolInvoker;
    }

    public ToolCallResult execute(Message.ToolCall toolCall, CancellationToken cancellationToken) {
        if (cancellationToken.isCancellationRequested()) {
            return ToolCallResult.synthetic(toolCall, ToolFailureKind.CANCELLED,
                    "Cancelled before start: " + cancellationToken.getReason());
        }

        String toolName = sanitizeToolName(toolCall.getName());
        Optional<ToolComponent> resolved = toolRegistry.find(toolName);
        if (resolved.isEmpty()) {
            String available = String.join(", ", toolRegistry.getToolNames());
            log.warn("[Tools] Unknown tool requested: '{}' (id={})", toolCall.getName(), toolCall.getId());
            return ToolCallResult.synthetic(toolCall, ToolFailureKind.UNKNOWN_TOOL,
                    "Unknown tool: " + toolName + ". Available tools: " + available);
        }
        ToolComponent tool = resolved.get();

        if (toolCall.hasUnparseableArguments()) {
            log.warn("[Tools] Unparseable arguments for '{}' (id={})", toolName, toolCall.getId());
            return ToolCallResult.synthetic(toolCall, ToolFailureKind.INVALID_ARGUMENTS,
                    "Invalid arguments: not a JSON object: " + toolCall.getRawArguments());
        }

        Map<String, Object> arguments = toolCall.getArguments() != null ? toolCall.getArguments() : Map.of();
        List<String> violations = ToolArgumentValidator.validate(tool.getDefinition().getInputSchema(), arguments);
        if (!violations.isEmpty()) {
            log.warn("[Tools] Invalid arguments for '{}' (id={}): {}", toolName, toolCall.getId(), violations);
            return ToolCallResult.synthetic(toolCall, ToolFailureKind.INVALID_ARGUMENTS,
                    "Invalid arguments: " + String.join("; ", violations));
        }

        log.debug("[Tools] Executing '{}' (id={})", toolName, toolCall.getId());
        ToolResult result = runTool(tool, toolCall, arguments, cancellationToken);

        String content = buildToolMessageContent(tool, result);
        content = truncateToolResult(content, toolName);
        return new ToolCallResult(toolCall.getId(), toolName, result, content, false);
    }

    private ToolResult runTool(ToolComponent tool, Message.ToolCall toolCall, Map<String, Object> arguments,
            CancellationToken cancellationToken) {
        Duration timeout = settings.getTimeout();
        CancellationToken callToken = cancellationToken.withTimeout(timeout);
        try {
            return awaitTool(tool, toolCall, arguments, cancellationToken, callToken, timeout);
        } finally {
            callToken.release();
        }
    }

    private ToolResult awaitTool(ToolComponent tool, Message.ToolCall toolCall, Map<String, Object> arguments,
            CancellationToken cancellationToken, CancellationToken callToken, Duration timeout) {
        CompletableFuture<ToolResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> tool.execute(arguments, callToken), toolInvoker)
                    .thenCompose(started -> started != null
                            ? started
                            : CompletableFuture.<ToolResult>completedFuture(null));
        } catch (RejectedExecutionException e) {
            return failureFromException(toolCall, e);
        }

        ToolResult result;
        try {
            result = future
                    .applyToEither(callToken.whenCancelled().thenApply(reason -> INTERRUPTED), Function.identity())
                    .join();
        } catch (CompletionException | CancellationException e) {
            return failureFromException(toolCall, e);
        }

        if (result == INTERRUPTED) {
            future.cancel(true);
            if (cancellationToken.isCancellationRequested()) {
                log.debug("[Tools] '{}' cancelled (id={})", toolCall.getName(), toolCall.getId());
                return ToolResult.failure(ToolFailureKind.CANCELLED, "Cancelled: " + cancellationToken.getReason());
            }
            log.warn("[Tools] '{}' timed out after {} (id={})", toolCall.getName(), timeout, toolCall.getId());
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool timed out after " + timeout);
        }
        if (result == null) {
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result");
        }
        if (!result.isSuccess() && result.getFailureKind() == null) {
            result.setFailureKind(ToolFailureKind.EXECUTION_FAILED);
        }
        return result;
    }

    private ToolResult failureFromException(Message.ToolCall toolCall, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof CancellationException) {
            return ToolResult.failure(ToolFailureKind.CANCELLED, "Cancelled: " + safeCauseMessage(cause));
        }
        if (cause instanceof IllegalArgumentException) {
            log.warn("[Tools] '{}' rejected its arguments: {}", toolCall.getName(), cause.getMessage());
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    "Invalid arguments: " + safeCauseMessage(cause));
        }
        log.error("Tool execution failed: {}", toolCall.getName(), cause);
        return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                "Tool execution failed: " + safeCauseMessage(cause));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cursor = error;
        while ((cursor instanceof CompletionException || cursor instanceof ExecutionException)
                && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        return cursor;
    }

    static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Strip special tokens and garbage from tool names. Some models (e.g. gpt-oss)
     * leak special tokens like {@code <|channel|>} into tool call names.
     */
    private String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    private String buildToolMessageContent(ToolComponent tool, ToolResult result) {
        String content = tool.renderResult(result);
        if (content == null && result.getData() != null) {
            try {
                content = objectMapper.writeValueAsString(result.getData());
            } catch (JsonProcessingException e) {
                log.warn("[Tools] Failed to serialize structured result of '{}': {}", tool.getToolName(),
                        e.getOriginalMessage());
                content = String.valueOf(result.getData());
            }
        }
        return content != null ? content : "";
    }

    /**
     * Truncate tool result content that exceeds the configured max length.
     */
    public String truncateToolResult(String content, String toolName) {
        if (content == null) {
            return null;
        }
        int maxChars = settings.getMaxResultChars();
        if (maxChars <= 0 || content.length() <= maxChars) {
            return content;
        }

        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxChars + " chars. The full result is too large for the context window."
                + " Try a more specific query, use filtering/pagination, or process the data in smaller chunks.]";
        int cutPoint = Math.max(0, maxChars - suffix.length());
        log.warn("[Tools] Truncating '{}' result: {} chars -> ~{} chars",
                toolName, content.length(), cutPoint + suffix.length());
        return content.substring(0, cutPoint) + suffix;
    }
}
