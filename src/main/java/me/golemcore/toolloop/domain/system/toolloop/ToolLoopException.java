package me.golemcore.toolloop.domain.system.toolloop;

/**
 * Thrown by {@link ToolLoopResult#requireFinalMessage()} when the invocation
 * did not produce a final answer.
 */
public class ToolLoopException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient ToolLoopFailure failure;

    public ToolLoopException(ToolLoopFailure failure) {
        super(buildMessage(failure), failure != null ? failure.cause() : null);
        this.failure = failure;
    }

    public ToolLoopFailure getFailure() {
        return failure;
    }

    private static String buildMessage(ToolLoopFailure failure) {
        if (failure == null) {
            return "Tool loop failed";
        }
        String code = failure.errorCode() != null ? " [" + failure.errorCode() + "]" : "";
        return "Tool loop failed: " + failure.kind() + code + " in " + failure.phase() + ": " + failure.message();
    }
}
