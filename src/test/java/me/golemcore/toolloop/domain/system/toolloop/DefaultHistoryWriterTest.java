package me.golemcore.toolloop.domain.system.toolloop;

import me.golemcore.toolloop.domain.model.Conversation;
import me.golemcore.toolloop.domain.model.LlmResponse;
import me.golemcore.toolloop.domain.model.Message;
import me.golemcore.toolloop.domain.model.ToolCallResult;
import me.golemcore.toolloop.domain.model.ToolFailureKind;
import me.golemcore.toolloop.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultHistoryWriterTest {

    private static final String ROLE_ASSISTANT = "assistant";
    private static final String ROLE_TOOL = "tool";
    private static final String TC_ID = "tc-1";
    private static final Instant FIXED_INSTANT = Instant.parse("2026-02-14T00:00:00Z");

    private DefaultHistoryWriter writer;
    private Conversation conversation;

    @BeforeEach
    void setUp() {
        writer = new DefaultHistoryWriter(Clock.fixed(FIXED_INSTANT, ZoneId.of("UTC")));
        conversation = new Conversation(List.of(Message.system("You are helpful")), List.of(Message.user("Hi")));
    }

    // ==================== appendAssistantToolCalls ====================

    @Test
    void shouldAppendAssistantToolCallsWithContent() {
        LlmResponse response = LlmResponse.builder()
                .content("thinking...")
                .toolCalls(List.of(toolCall(TC_ID, "test")))
                .model("gpt-4o")
                .finishReason("TOOL_EXECUTION")
                .build();

        Message msg = writer.appendAssistantToolCalls(conversation, response);

        assertEquals(3, conversation.size());
        assertSame(msg, conversation.last());
        assertEquals(ROLE_ASSISTANT, msg.getRole());
        assertEquals("thinking...", msg.getContent());
        assertEquals(1, msg.getToolCalls().size());
        assertEquals(FIXED_INSTANT, msg.getTimestamp());
        assertEquals("gpt-4o", msg.getMetadata().get("model"));
        assertEquals("TOOL_EXECUTION", msg.getMetadata().get("finishReason"));
    }

    // ==================== appendToolResults ====================

    @Test
    void shouldAppendToolResultsInRequestOrder() {
        List<Message.ToolCall> calls = List.of(toolCall("a", "first"), toolCall("b", "second"));
        List<ToolCallResult> results = List.of(
                new ToolCallResult("b", "second", ToolResult.success("B"), "B", false),
                new ToolCallResult("a", "first", ToolResult.success("A"), "A", false));

        List<Message> appended = writer.appendToolResults(conversation, calls, results);

        assertEquals(List.of("a", "b"), appended.stream().map(Message::getToolCallId).toList());
        assertEquals(List.of("A", "B"), appended.stream().map(Message::getContent).toList());
        assertEquals(4, conversation.size());
        Message first = appended.get(0);
        assertEquals(ROLE_TOOL, first.getRole());
        assertEquals("first", first.getToolName());
        assertEquals(FIXED_INSTANT, first.getTimestamp());
        assertFalse(first.isToolError());
    }

    @Test
    void shouldMarkFailedAndSyntheticResults() {
        Message.ToolCall call = toolCall(TC_ID, "weather");
        ToolCallResult result = ToolCallResult.synthetic(call, ToolFailureKind.UNKNOWN_TOOL, "Unknown tool: weather");

        Message msg = writer.appendToolResults(conversation, List.of(call), List.of(result)).get(0);

        assertTrue(msg.isToolError());
        assertEquals(ToolFailureKind.UNKNOWN_TOOL, msg.getFailureKind());
        assertEquals("Error: Unknown tool: weather", msg.getContent());
        assertEquals(true, msg.getMetadata().get("synthetic"));
    }

    @Test
    void shouldSynthesizeMissingResult() {
        List<Message.ToolCall> calls = List.of(toolCall("a", "first"), toolCall("b", "second"));
        List<ToolCallResult> results = List.of(
                new ToolCallResult("a", "first", ToolResult.success("A"), "A", false));

        List<Message> appended = writer.appendToolResults(conversation, calls, results);

        assertEquals(2, appended.size());
        Message missing = appended.get(1);
        assertEquals("b", missing.getToolCallId());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, missing.getFailureKind());
        assertTrue(missing.getContent().startsWith("Error: "));
    }

    @Test
    void shouldHandleNullResultList() {
        List<Message> appended = writer.appendToolResults(conversation, List.of(toolCall(TC_ID, "x")), null);

        assertEquals(1, appended.size());
        assertTrue(appended.get(0).isToolError());
    }

    // ==================== appendFinalAssistantAnswer ====================

    @Test
    void shouldAppendFinalAnswer() {
        Message msg = writer.appendFinalAssistantAnswer(conversation,
                LlmResponse.builder().content("All done").build());

        assertSame(msg, conversation.last());
        assertEquals(ROLE_ASSISTANT, msg.getRole());
        assertEquals("All done", msg.getContent());
        assertFalse(msg.hasToolCalls());
        assertTrue(msg.getMetadata().isEmpty());
    }

    @Test
    void shouldAppendEmptyFinalAnswerWhenContentIsNull() {
        Message msg = writer.appendFinalAssistantAnswer(conversation, LlmResponse.builder().build());

        assertEquals("", msg.getContent());
        assertNull(msg.getToolCalls());
    }

    private static Message.ToolCall toolCall(String id, String name) {
        return Message.ToolCall.builder().id(id).name(name).build();
    }
}
