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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the tool loop.
 *
 * <p>
 * All configuration is organized under the {@code toolloop.*} prefix. This
 * class contains nested configuration classes for:
 * <ul>
 * <li>{@link ToolsProperties} - tool batch execution (timeouts, parallelism,
 * result truncation)</li>
 * <li>{@link LlmProperties} - the OpenAI-compatible model client</li>
 * </ul>
 *
 * <p>
 * Uses Spring Boot's {@link ConfigurationProperties} for type-safe property
 * binding from {@code application.properties}.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "toolloop")
@Data
public class ToolLoopProperties {

    /**
     * Default cap on tool rounds (assistant tool-call turn + results) per
     * invocation. Unset means unbounded.
     */
    private Integer maxToolRounds;

    /**
     * Default wall-clock budget of one invocation. Unset means no deadline.
     */
    private Duration deadline;

    private ToolsProperties tools = new ToolsProperties();
    private LlmProperties llm = new LlmProperties();

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        /** Max time a single tool call may run before it is reported as failed. */
        private Duration timeout = Duration.ofSeconds(30);

        /** Worker threads shared by all tool batches. */
        private int maxParallelism = 8;

        /**
         * Max characters allowed in a single tool result message. Longer results are
         * truncated.
         */
        private int maxResultChars = 100000;
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String baseUrl;
        private String apiKey;
        private String model = "gpt-4o-mini";
        private Double temperature = 0.2;
        private Duration timeout = Duration.ofSeconds(60);
        private int maxRetries = 2;
    }
}
