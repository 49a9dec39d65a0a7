package me.golemcore.toolloop;


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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore tool loop.
 *
 * <p>
 * Runs a tool-calling conversation: the model is queried, the tools it asks for
 * run concurrently, their results are fed back, and the cycle repeats until the
 * model answers without requesting tools.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Domain Layer       → ToolLoopSystem, ToolExecutorPort, ToolRegistry
 * Ports              → LlmPort, ToolLoopEventPort
 * Infrastructure     → Langchain4j LLM adapter, Spring event bus
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code toolloop.*}
 * prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ToolLoopApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolLoopApplication.class, args);
    }

}
