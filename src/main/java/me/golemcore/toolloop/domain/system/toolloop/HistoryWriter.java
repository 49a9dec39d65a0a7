package me.golemcore.toolloop.domain.system.toolloop;

import me.golemcore.toolloop.domain.model.Conversation;
import me.golemcore.toolloop.domain.model.LlmResponse;
import me.golemcore.toolloop.domain.model.Message;
import me.golemcore.toolloop.domain.model.ToolCallResult;

import java.util.List;

/**
 * Single point of mutation for the conversation during an invocation.
 *
 * <p>
 * ToolLoopSystem should not write messages directly.
 */
public interface HistoryWriter {

    Message appendAssistantToolCalls(Conversation conversation, LlmResponse llmResponse);

    /**
     * Appends one tool message per tool call, in tool call order, whatever the
     * order of {@code results}.
     */
    List<Message> appendToolResults(Conversation conversation, List<Message.ToolCall> toolCalls,
            List<ToolCallResult> results);

    Message appendFinalAssistantAnswer(Conversation conversation, LlmResponse llmResponse);
}
