package me.golemcore.toolloop.domain.system.toolloop;

import me.golemcore.toolloop.domain.model.CancellationToken;
import me.golemcore.toolloop.domain.model.Message;
import me.golemcore.toolloop.domain.model.ToolDefinition;

import java.util.List;

/**
 * Executes the LLM -> tools -> LLM loop until the model answers without
 * requesting tools, or the invocation fails.
 *
 * <p>
 * Never throws for model, tool or cancellation problems; those end up in
 * {@link ToolLoopResult#failure()}. Programming errors (no input) throw
 * {@link IllegalArgumentException}.
 */
public interface ToolLoopSystem {

    ToolLoopResult run(ToolLoopInvocation invocation);

    /**
     * Runs a single input message against the given tool schema set.
     */
    default ToolLoopResult run(Message inputMessage, List<Message> systemMessages, List<ToolDefinition> tools,
            CancellationToken cancellationToken, Integer maxToolRounds) {
        if (inputMessage == null) {
            throw new IllegalArgumentException("inputMessage must not be null");
        }
        return run(ToolLoopInvocation.builder()
                .systemMessages(systemMessages != null ? systemMessages : List.of())
                .inputMessage(inputMessage)
                .tools(tools)
                .cancellationToken(cancellationToken)
                .maxToolRounds(maxToolRounds)
                .build());
    }
}
