package me.golemcore.toolloop.domain.model;

/**
 * Stable event types emitted by the tool loop at each phase transition.
 */
public enum ToolLoopEventType {
    LOOP_STARTED, MODEL_QUERIED, MODEL_RESPONDED, TOOL_BATCH_DISPATCHED, TOOL_BATCH_COMPLETED, LOOP_FINISHED, LOOP_FAILED
}
