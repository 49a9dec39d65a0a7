package me.golemcore.toolloop.domain.system.toolloop;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolloop.domain.model.Conversation;
import me.golemcore.toolloop.domain.model.LlmResponse;
import me.golemcore.toolloop.domain.model.Message;
import me.golemcore.toolloop.domain.model.ToolCallResult;
import me.golemcore.toolloop.domain.model.ToolFailureKind;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Default implementation that appends timestamped messages to the invocation's
 * conversation.
 */
@Slf4j
public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Message appendAssistantToolCalls(Conversation conversation, LlmResponse llmResponse) {
        Message assistant = Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(llmResponse.getContent())
                .toolCalls(List.copyOf(llmResponse.getToolCalls()))
                .metadata(buildAssistantMetadata(llmResponse))
                .timestamp(now())
                .build();

        conversation.append(assistant);
        return assistant;
    }

    @Override
    public List<Message> appendToolResults(Conversation conversation, List<Message.ToolCall> toolCalls,
            List<ToolCallResult> results) {
        Map<String, ToolCallResult> resultsById = new HashMap<>();
        if (results != null) {
            for (ToolCallResult result : results) {
                if (result != null && result.toolCallId() != null) {
                    resultsById.putIfAbsent(result.toolCallId(), result);
                }
            }
        }

        List<Message> appended = new ArrayList<>(toolCalls.size());
        for (Message.ToolCall toolCall : toolCalls) {
            ToolCallResult result = resultsById.get(toolCall.getId());
            if (result == null) {
                log.warn("[ToolLoop] No result returned for tool call '{}' (id={})", toolCall.getName(),
                        toolCall.getId());
                result = ToolCallResult.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                        "Tool executor returned no result for this call");
            }
            Message toolMsg = buildToolMessage(result);
            conversation.append(toolMsg);
            appended.add(toolMsg);
        }
        return appended;
    }

    @Override
    public Message appendFinalAssistantAnswer(Conversation conversation, LlmResponse llmResponse) {
        Message assistant = Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(llmResponse.getContent() != null ? llmResponse.getContent() : "")
                .metadata(buildAssistantMetadata(llmResponse))
                .timestamp(now())
                .build();

        conversation.append(assistant);
        return assistant;
    }

    private Message buildToolMessage(ToolCallResult result) {
        Message toolMsg = Message.toolResult(result);
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (result.synthetic()) {
            metadata.put("synthetic", true);
        }
        toolMsg.setMetadata(metadata);
        toolMsg.setTimestamp(now());
        return toolMsg;
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }

    private Map<String, Object> buildAssistantMetadata(LlmResponse llmResponse) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (llmResponse == null) {
            return metadata;
        }

        String model = llmResponse.getModel();
        if (model != null && !model.isBlank()) {
            metadata.put("model", model);
        }
        String finishReason = llmResponse.getFinishReason();
        if (finishReason != null && !finishReason.isBlank()) {
            metadata.put("finishReason", finishReason);
        }
        return metadata;
    }
}
