package me.golemcore.toolloop.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.toolloop.domain.component.ToolComponent;
import me.golemcore.toolloop.domain.service.ToolCallExecutionService;
import me.golemcore.toolloop.domain.service.ToolRegistry;
import me.golemcore.toolloop.infrastructure.config.ToolLoopProperties;
import me.golemcore.toolloop.port.outbound.LlmPort;
import me.golemcore.toolloop.port.outbound.ToolLoopEventPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Spring wiring for ToolLoopSystem (domain orchestrator + ports). */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public ToolRegistry toolRegistry(List<ToolComponent> tools) {
        return new ToolRegistry(tools);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService toolExecutorService(ToolLoopProperties properties) {
        int threads = Math.max(1, properties.getTools().getMaxParallelism());
        return Executors.newFixedThreadPool(threads, namedDaemonThreads("toolloop-tool-"));
    }

    /** Starts {@code ToolComponent.execute}; kept apart from the batch pool. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService toolInvocationExecutor() {
        return Executors.newCachedThreadPool(namedDaemonThreads("toolloop-invoke-"));
    }

    @Bean
    public ToolCallExecutionService toolCallExecutionService(ToolRegistry toolRegistry,
            ToolLoopProperties properties, ObjectMapper objectMapper,
            @Qualifier("toolInvocationExecutor") ExecutorService toolInvocationExecutor) {
        return new ToolCallExecutionService(toolRegistry, properties.getTools(), objectMapper,
                toolInvocationExecutor);
    }

    @Bean
    public ToolExecutorPort toolExecutorPort(ToolCallExecutionService toolCallExecutionService,
            @Qualifier("toolExecutorService") ExecutorService toolExecutorService) {
        return new DefaultToolExecutor(toolCallExecutionService, toolExecutorService);
    }

    @Bean
    public HistoryWriter toolLoopHistoryWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutorPort,
            HistoryWriter historyWriter, ToolRegistry toolRegistry, ToolLoopEventPort eventPort,
            ToolLoopProperties properties, Clock clock) {
        return new DefaultToolLoopSystem(llmPort, toolExecutorPort, historyWriter, toolRegistry, eventPort,
                properties, clock);
    }

    static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
