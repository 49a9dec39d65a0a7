package me.golemcore.toolloop.domain.system.toolloop;

import me.golemcore.toolloop.domain.model.LlmUsage;
import me.golemcore.toolloop.domain.model.Message;

import java.util.List;

/**
 * Outcome of one tool loop run. {@code conversation} is the full transcript
 * (system and input messages included) as it stood when the loop stopped.
 */
public record ToolLoopResult(ToolLoopState state, List<Message> conversation, Message finalMessage,
        ToolLoopFailure failure, int llmCalls, int toolRounds, int toolExecutions, LlmUsage usage) {

    public boolean isDone() {
        return state == ToolLoopState.DONE;
    }

    /**
     * Returns the final assistant message, or throws {@link ToolLoopException}
     * carrying the failure.
     */
    public Message requireFinalMessage() {
        if (!isDone() || finalMessage == null) {
            throw new ToolLoopException(failure);
        }
        return finalMessage;
    }
}
