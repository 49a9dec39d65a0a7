package me.golemcore.toolloop.domain.system.toolloop;

/**
 * Phase of a tool loop invocation. {@link #DONE} and {@link #FAILED} are
 * terminal.
 */
public enum ToolLoopState {
    AWAITING_MODEL, AWAITING_TOOLS, DONE, FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
