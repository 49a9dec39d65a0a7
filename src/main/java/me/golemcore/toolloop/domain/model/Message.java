package me.golemcore.toolloop.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Represents a single turn of a tool loop conversation. Supports the four roles
 * a tool-calling transcript needs (system, user, assistant, tool): assistant
 * turns may carry tool calls, tool turns carry the result of exactly one call.
 */
@Data
@Builder
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private String id;
    private String role; // system, user, assistant, tool
    private String content;
    private String source; // Origin of a user message (caller, channel, agent name)

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool response messages
    private String toolName; // Tool name for tool response messages
    private ToolFailureKind failureKind; // Set when the tool response is an error

    private Map<String, Object> metadata;
    private Instant timestamp;

    /**
     * Creates a system message.
     */
    public static Message system(String text) {
        return Message.builder()
                .id(newId())
                .role(ROLE_SYSTEM)
                .content(text)
                .timestamp(Instant.now())
                .build();
    }

    /**
     * Creates a user message with the given source.
     */
    public static Message user(String text, String source) {
        return Message.builder()
                .id(newId())
                .role(ROLE_USER)
                .content(text)
                .source(source)
                .timestamp(Instant.now())
                .build();
    }

    /**
     * Creates a user message without a source.
     */
    public static Message user(String text) {
        return user(text, null);
    }

    /**
     * Creates a terminal assistant message (no tool calls).
     */
    public static Message assistant(String text) {
        return Message.builder()
                .id(newId())
                .role(ROLE_ASSISTANT)
                .content(text)
                .timestamp(Instant.now())
                .build();
    }

    /**
     * Creates an assistant message requesting the given tool calls.
     */
    public static Message assistantToolCalls(String text, List<ToolCall> toolCalls) {
        return Message.builder()
                .id(newId())
                .role(ROLE_ASSISTANT)
                .content(text)
                .toolCalls(List.copyOf(toolCalls))
                .timestamp(Instant.now())
                .build();
    }

    /**
     * Creates the tool message answering a single tool call.
     */
    public static Message toolResult(ToolCallResult result) {
        ToolResult toolResult = result.toolResult();
        boolean failed = toolResult != null && !toolResult.isSuccess();
        return Message.builder()
                .id(newId())
                .role(ROLE_TOOL)
                .toolCallId(result.toolCallId())
                .toolName(result.toolName())
                .content(result.messageContent())
                .failureKind(failed ? toolResult.getFailureKind() : null)
                .timestamp(Instant.now())
                .build();
    }

    /**
     * Checks if this message is from the user.
     */
    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    /**
     * Checks if this message is from the assistant.
     */
    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    /**
     * Checks if this is a system message.
     */
    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    /**
     * Checks if this is a tool result message.
     */
    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    /**
     * Checks if this message contains tool calls from the LLM.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * Checks if this is a tool message reporting a failure.
     */
    public boolean isToolError() {
        return isToolMessage() && failureKind != null;
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Represents a function call requested by the LLM. Contains the tool name, ID
     * for correlation, and parsed arguments. {@code rawArguments} keeps the
     * provider's argument text when it could not be parsed into a map.
     */
    @Data
    @Builder
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
        private String rawArguments;

        /**
         * Checks whether the provider supplied arguments that could not be parsed.
         */
        public boolean hasUnparseableArguments() {
            return arguments == null && rawArguments != null && !rawArguments.isBlank();
        }
    }
}
