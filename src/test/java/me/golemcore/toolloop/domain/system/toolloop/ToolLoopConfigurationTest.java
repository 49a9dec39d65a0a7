package me.golemcore.toolloop.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.toolloop.domain.component.ToolComponent;
import me.golemcore.toolloop.domain.service.ToolCallExecutionService;
import me.golemcore.toolloop.domain.service.ToolRegistry;
import me.golemcore.toolloop.infrastructure.config.ToolLoopProperties;
import me.golemcore.toolloop.port.outbound.LlmPort;
import me.golemcore.toolloop.port.outbound.ToolLoopEventPort;
import me.golemcore.toolloop.tools.DateTimeTool;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class ToolLoopConfigurationTest {

    private final ToolLoopConfiguration configuration = new ToolLoopConfiguration();

    @Test
    void shouldBuildRegistryFromToolBeans() {
        List<ToolComponent> tools = List.of(new DateTimeTool(Clock.systemUTC()));

        ToolRegistry registry = configuration.toolRegistry(tools);

        assertEquals(1, registry.size());
        assertTrue(registry.find("datetime").isPresent());
    }

    @Test
    void shouldCreateNamedDaemonWorkerPool() throws Exception {
        ToolLoopProperties properties = new ToolLoopProperties();
        properties.getTools().setMaxParallelism(2);

        ExecutorService executorService = configuration.toolExecutorService(properties);
        try {
            Future<Thread> worker = executorService.submit(Thread::currentThread);
            Thread thread = worker.get(5, TimeUnit.SECONDS);
            assertTrue(thread.isDaemon());
            assertTrue(thread.getName().startsWith("toolloop-tool-"));
        } finally {
            executorService.shutdownNow();
        }
    }

    @Test
    void shouldCreateNamedDaemonInvocationPool() throws Exception {
        ExecutorService executorService = configuration.toolInvocationExecutor();
        try {
            Thread thread = executorService.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);
            assertTrue(thread.isDaemon());
            assertTrue(thread.getName().startsWith("toolloop-invoke-"));
        } finally {
            executorService.shutdownNow();
        }
    }

    @Test
    void shouldCreateToolExecutorPort() {
        ToolCallExecutionService executionService = configuration.toolCallExecutionService(ToolRegistry.empty(),
                new ToolLoopProperties(), new ObjectMapper(), mock(ExecutorService.class));

        ToolExecutorPort port = configuration.toolExecutorPort(executionService, mock(ExecutorService.class));

        assertNotNull(port);
        assertInstanceOf(DefaultToolExecutor.class, port);
    }

    @Test
    void shouldCreateHistoryWriter() {
        HistoryWriter historyWriter = configuration.toolLoopHistoryWriter(Clock.systemUTC());

        assertNotNull(historyWriter);
        assertInstanceOf(DefaultHistoryWriter.class, historyWriter);
    }

    @Test
    void shouldCreateDefaultToolLoopSystem() {
        ToolLoopSystem system = configuration.toolLoopSystem(mock(LlmPort.class), mock(ToolExecutorPort.class),
                mock(HistoryWriter.class), ToolRegistry.empty(), ToolLoopEventPort.noop(), new ToolLoopProperties(),
                Clock.systemUTC());

        assertNotNull(system);
        assertInstanceOf(DefaultToolLoopSystem.class, system);
    }
}
