package me.golemcore.toolloop.infrastructure.config;


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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolloop.domain.service.ToolRegistry;
import me.golemcore.toolloop.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans and startup diagnostics.
 *
 * <p>
 * Logs the configured model, provider availability, the registered tools and
 * the tool loop limits once the context is up.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final ToolLoopProperties properties;
    private final ToolRegistry toolRegistry;
    private final LlmPort llmPort;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Tool Loop starting...");
        log.info("Model: {}", properties.getLlm().getModel());
        log.info("LLM Provider: {} (available: {})", llmPort.getProviderId(), llmPort.isAvailable());
        log.info("Tools: {}", toolRegistry.getToolNames());
        log.info("Max tool rounds: {}, deadline: {}, tool timeout: {}, max parallelism: {}",
                properties.getMaxToolRounds() != null ? properties.getMaxToolRounds() : "unbounded",
                properties.getDeadline() != null ? properties.getDeadline() : "none",
                properties.getTools().getTimeout(), properties.getTools().getMaxParallelism());
    }
}
