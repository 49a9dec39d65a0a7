
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

package me.golemcore.toolloop.adapter.outbound.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolloop.domain.model.CancellationToken;
import me.golemcore.toolloop.domain.model.LlmRequest;
import me.golemcore.toolloop.domain.model.LlmResponse;
import me.golemcore.toolloop.domain.model.LlmUsage;
import me.golemcore.toolloop.domain.model.Message;
import me.golemcore.toolloop.domain.model.ToolDefinition;
import me.golemcore.toolloop.infrastructure.config.ToolLoopProperties;
import me.golemcore.toolloop.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Talks to any OpenAI-compatible chat completions endpoint with function
 * calling. The chat model is built lazily from {@code toolloop.llm.*}; a request
 * naming a different model gets a one-off model instance.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 *
 * <p>
 * Retries are delegated to langchain4j ({@code toolloop.llm.max-retries}); the
 * adapter itself never retries.
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final String SCHEMA_KEY_DESCRIPTION = "description";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ToolLoopProperties.LlmProperties settings;
    private final ObjectMapper objectMapper;

    private ChatModel chatModel;

    public Langchain4jAdapter(ToolLoopProperties properties, ObjectMapper objectMapper) {
        this.settings = properties.getLlm();
        this.objectMapper = objectMapper;
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public boolean isAvailable() {
        return settings.getApiKey() != null && !settings.getApiKey().isBlank();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request, CancellationToken cancellationToken) {
        return CompletableFuture.supplyAsync(() -> {
            cancellationToken.throwIfCancellationRequested();
            ChatModel model = getModelForRequest(request);
            String modelName = resolveModelName(request);

            List<ChatMessage> messages = convertMessages(request);
            List<ToolSpecification> tools = convertTools(request);
            ChatRequest.Builder chatRequest = ChatRequest.builder().messages(messages);
            if (!tools.isEmpty()) {
                chatRequest.toolSpecifications(tools);
            }

            log.debug("[LLM] Calling {} with {} messages, {} tools (invocation={})", modelName, messages.size(),
                    tools.size(), request.getInvocationId());
            ChatResponse response = model.chat(chatRequest.build());
            cancellationToken.throwIfCancellationRequested();
            return convertResponse(response, modelName);
        });
    }

    private synchronized ChatModel getDefaultModel() {
        if (chatModel == null) {
            chatModel = createModel(settings.getModel());
            log.info("[LLM] Langchain4j adapter initialized with model: {}", settings.getModel());
        }
        return chatModel;
    }

    private ChatModel getModelForRequest(LlmRequest request) {
        String requestModel = request.getModel();
        if (requestModel != null && !requestModel.isBlank() && !requestModel.equals(settings.getModel())) {
            log.trace("[LLM] Creating one-off model for request: {}", requestModel);
            return createModel(requestModel);
        }
        return getDefaultModel();
    }

    private String resolveModelName(LlmRequest request) {
        String requestModel = request.getModel();
        return requestModel != null && !requestModel.isBlank() ? requestModel : settings.getModel();
    }

    private ChatModel createModel(String modelName) {
        if (!isAvailable()) {
            throw new IllegalStateException("LLM provider not configured. Set toolloop.llm.api-key");
        }
        var builder = OpenAiChatModel.builder()
                .apiKey(settings.getApiKey())
                .modelName(modelName)
                .maxRetries(settings.getMaxRetries())
                .timeout(settings.getTimeout());

        if (settings.getBaseUrl() != null && !settings.getBaseUrl().isBlank()) {
            builder.baseUrl(settings.getBaseUrl());
        }
        if (settings.getTemperature() != null) {
            builder.temperature(settings.getTemperature());
        }
        return builder.build();
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        for (Message msg : request.getMessages()) {
            switch (msg.getRole()) {
            case Message.ROLE_SYSTEM -> {
                if (msg.getContent() != null && !msg.getContent().isBlank()) {
                    messages.add(SystemMessage.from(msg.getContent()));
                }
            }
            case Message.ROLE_USER -> messages.add(UserMessage.from(nonNull(msg.getContent())));
            case Message.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(toolCallArgumentsJson(tc))
                                    .build())
                            .toList();
                    if (msg.getContent() != null && !msg.getContent().isBlank()) {
                        messages.add(AiMessage.from(msg.getContent(), toolRequests));
                    } else {
                        messages.add(AiMessage.from(toolRequests));
                    }
                } else {
                    messages.add(AiMessage.from(nonNull(msg.getContent())));
                }
            }
            case Message.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    nonNull(msg.getContent())));
            default -> {
                log.warn("[LLM] Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(nonNull(msg.getContent())));
            }
            }
        }
        return messages;
    }

    List<ToolSpecification> convertTools(LlmRequest request) {
        if (request.getTools() == null || request.getTools().isEmpty()) {
            return Collections.emptyList();
        }
        return request.getTools().stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null && schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> properties) {
            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            for (Map.Entry<?, ?> entry : properties.entrySet()) {
                schemaBuilder.addProperty(String.valueOf(entry.getKey()),
                        toJsonSchemaElement((Map<String, Object>) entry.getValue()));
            }
            if (schema.get("required") instanceof List<?> required && !required.isEmpty()) {
                schemaBuilder.required(required.stream().map(String::valueOf).toList());
            }
            builder.parameters(schemaBuilder.build());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String description = paramSchema.get(SCHEMA_KEY_DESCRIPTION) instanceof String text && !text.isBlank()
                ? text
                : null;

        // Enum values take priority
        if (paramSchema.get("enum") instanceof Collection<?> enumValues && !enumValues.isEmpty()) {
            return JsonEnumSchema.builder()
                    .enumValues(enumValues.stream().map(String::valueOf).toList())
                    .description(description)
                    .build();
        }

        String type = paramSchema.get("type") instanceof String value ? value : "string";
        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (paramSchema.get("items") instanceof Map<?, ?> items) {
                builder.items(toJsonSchemaElement((Map<String, Object>) items));
            }
            yield builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            if (paramSchema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                for (Map.Entry<?, ?> entry : nested.entrySet()) {
                    builder.addProperty(String.valueOf(entry.getKey()),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            yield builder.build();
        }
        // Unknown types fall back to string
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    LlmResponse convertResponse(ChatResponse response, String modelName) {
        AiMessage aiMessage = response.aiMessage();

        List<Message.ToolCall> toolCalls = null;
        if (aiMessage != null && aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(this::convertToolCall)
                    .toList();
            log.trace("[LLM] Parsed {} tool calls from response", toolCalls.size());
        }

        LlmUsage usage = null;
        TokenUsage tokenUsage = response.tokenUsage();
        if (tokenUsage != null) {
            usage = LlmUsage.builder()
                    .inputTokens(orZero(tokenUsage.inputTokenCount()))
                    .outputTokens(orZero(tokenUsage.outputTokenCount()))
                    .totalTokens(orZero(tokenUsage.totalTokenCount()))
                    .build();
        }

        return LlmResponse.builder()
                .content(aiMessage != null ? aiMessage.text() : null)
                .toolCalls(toolCalls)
                .usage(usage)
                .model(modelName)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private Message.ToolCall convertToolCall(ToolExecutionRequest request) {
        String rawArguments = request.arguments();
        return Message.ToolCall.builder()
                .id(request.id())
                .name(request.name())
                .arguments(parseJsonArgs(rawArguments))
                .rawArguments(rawArguments)
                .build();
    }

    private String toolCallArgumentsJson(Message.ToolCall toolCall) {
        if (toolCall.hasUnparseableArguments()) {
            return toolCall.getRawArguments();
        }
        return convertArgsToJson(toolCall.getArguments());
    }

    String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getOriginalMessage());
            return "{}";
        }
    }

    /**
     * Parses tool arguments. Returns null when the text is not a JSON object, so
     * the caller keeps the raw text and reports invalid arguments to the model.
     */
    Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String nonNull(String text) {
        return text != null ? text : "";
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
