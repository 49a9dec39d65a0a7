package me.golemcore.toolloop.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Assistant turn returned by an LLM provider: either final text, or one or more
 * tool calls (optionally with accompanying text).
 */
@Data
@Builder
public class LlmResponse {

    private String content;
    private List<Message.ToolCall> toolCalls;
    private LlmUsage usage;
    private String model;
    private String finishReason;

    /**
     * Checks if the model requested at least one tool call.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
