package me.golemcore.toolloop.domain.model;

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages. All
 * kinds are recovered into a tool message for the LLM; none of them stops the
 * batch.
 */
public enum ToolFailureKind {

    /**
     * The requested tool name is not registered (or the tool is disabled).
     */
    UNKNOWN_TOOL,

    /**
     * The arguments could not be parsed or do not satisfy the tool's input schema.
     */
    INVALID_ARGUMENTS,

    /**
     * Tool execution failed during runtime (exceptions, timeouts, non-zero exit,
     * etc.).
     */
    EXECUTION_FAILED,

    /**
     * The invocation's cancellation token fired before the tool completed.
     */
    CANCELLED
}
