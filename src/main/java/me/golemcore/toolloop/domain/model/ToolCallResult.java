package me.golemcore.toolloop.domain.model;

/**
 * Result of a single tool call (real or synthetic).
 *
 * @param toolCallId
 *            tool_call_id as provided by the LLM
 * @param toolName
 *            tool name (as used in history)
 * @param toolResult
 *            raw ToolResult (success/failure + structured data)
 * @param messageContent
 *            content to write into the "tool" message (possibly truncated)
 * @param synthetic
 *            whether this result was produced without executing the tool
 */
public record ToolCallResult(
        String toolCallId,
        String toolName,
        ToolResult toolResult,
        String messageContent,
        boolean synthetic) {

    /**
     * Creates a failed result for a call that was never executed.
     */
    public static ToolCallResult synthetic(Message.ToolCall toolCall, ToolFailureKind kind, String reason) {
        return new ToolCallResult(toolCall.getId(), toolCall.getName(), ToolResult.failure(kind, reason),
                "Error: " + reason, true);
    }

    public boolean isSuccess() {
        return toolResult != null && toolResult.isSuccess();
    }

    public ToolFailureKind failureKind() {
        return toolResult != null && !toolResult.isSuccess() ? toolResult.getFailureKind() : null;
    }
}
