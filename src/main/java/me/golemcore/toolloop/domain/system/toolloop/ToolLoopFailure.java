package me.golemcore.toolloop.domain.system.toolloop;

/**
 * Loop-level failure.
 *
 * @param kind
 *            failure classification
 * @param phase
 *            state the loop was in when it failed
 * @param errorCode
 *            stable machine-readable code, e.g.
 *            {@code llm.malformed_tool_calls}
 * @param message
 *            human-readable diagnostic
 * @param cause
 *            underlying throwable, if any
 */
public record ToolLoopFailure(ToolLoopFailureKind kind, ToolLoopState phase, String errorCode, String message,
        Throwable cause) {

    public static ToolLoopFailure of(ToolLoopFailureKind kind, ToolLoopState phase, String errorCode,
            String message) {
        return new ToolLoopFailure(kind, phase, errorCode, message, null);
    }
}
