package me.golemcore.toolloop.domain.system.toolloop;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import me.golemcore.toolloop.domain.model.CancellationToken;
import me.golemcore.toolloop.domain.model.Message;
import me.golemcore.toolloop.domain.model.ToolDefinition;

import java.time.Duration;
import java.util.List;

/**
 * Input of one tool loop run. Unset fields fall back to configuration: tools to
 * the registry's schema set, {@code maxToolRounds} and {@code deadline} to
 * {@code toolloop.*}, the token to {@link CancellationToken#none()}.
 */
@Value
@Builder(toBuilder = true)
public class ToolLoopInvocation {

    String invocationId;

    @Singular
    List<Message> systemMessages;

    @Singular
    List<Message> inputMessages;

    /** Schema set exposed to the model; null means every enabled registered tool. */
    List<ToolDefinition> tools;

    CancellationToken cancellationToken;

    /** Max tool rounds; null uses the configured default, which may be unbounded. */
    Integer maxToolRounds;

    Duration deadline;

    String model;
}
