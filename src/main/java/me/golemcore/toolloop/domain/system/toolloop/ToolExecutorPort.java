package me.golemcore.toolloop.domain.system.toolloop;

import me.golemcore.toolloop.domain.model.CancellationToken;
import me.golemcore.toolloop.domain.model.Message;
import me.golemcore.toolloop.domain.model.ToolCallResult;

import java.util.List;

/**
 * Hexagonal outbound port for executing the tool calls of one assistant turn.
 *
 * <p>
 * ToolLoopSystem is the owner of the loop; it hands every batch to this port
 * and never calls a tool directly. Implementations return exactly one result
 * per request (matched by tool call id), never call the LLM, and report
 * per-call problems as failed results instead of throwing.
 */
public interface ToolExecutorPort {

    List<ToolCallResult> execute(List<Message.ToolCall> toolCalls, CancellationToken cancellationToken);
}
