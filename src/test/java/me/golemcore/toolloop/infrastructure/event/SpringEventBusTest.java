package me.golemcore.toolloop.infrastructure.event;

import me.golemcore.toolloop.domain.model.ToolLoopEvent;
import me.golemcore.toolloop.domain.model.ToolLoopEventType;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SpringEventBusTest {

    @Test
    void shouldPublishToolLoopEventThroughSpring() {
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        SpringEventBus bus = new SpringEventBus(publisher);
        ToolLoopEvent event = ToolLoopEvent.builder()
                .type(ToolLoopEventType.TOOL_BATCH_DISPATCHED)
                .timestamp(Instant.parse("2026-02-14T00:00:00Z"))
                .invocationId("inv-1")
                .round(1)
                .payload(Map.of("calls", 2))
                .build();

        bus.publish(event);

        verify(publisher).publishEvent(event);
    }
}
