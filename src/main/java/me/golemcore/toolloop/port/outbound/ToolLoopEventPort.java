package me.golemcore.toolloop.port.outbound;

import me.golemcore.toolloop.domain.model.ToolLoopEvent;

/**
 * Outbound port for observers of tool loop phase transitions (model queried,
 * tool batch dispatched/completed, loop finished/failed).
 *
 * <p>
 * Observers are not part of the control path: implementations must not block
 * for long, and the loop ignores (but logs) anything they throw.
 */
public interface ToolLoopEventPort {

    void publish(ToolLoopEvent event);

    /**
     * Port that drops every event, for wiring without observers.
     */
    static ToolLoopEventPort noop() {
        return event -> {
        };
    }
}
