package me.golemcore.toolloop.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Structured event emitted during a tool loop invocation.
 */
@Builder
public record ToolLoopEvent(
        ToolLoopEventType type,
        Instant timestamp,
        String invocationId,
        int round,
        Map<String, Object> payload) {
}
