package me.golemcore.toolloop.domain.system.toolloop;

/**
 * Why a tool loop invocation ended in {@link ToolLoopState#FAILED}.
 */
public enum ToolLoopFailureKind {
    /** The model call failed, returned nothing, or returned malformed tool calls. */
    MODEL_REQUEST_FAILED,
    /** The caller token fired or the invocation deadline passed. */
    CANCELLED,
    /** The model asked for another tool round after the configured cap. */
    ROUND_LIMIT_EXCEEDED
}
