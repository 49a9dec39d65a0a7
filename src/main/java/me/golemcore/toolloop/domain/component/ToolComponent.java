package me.golemcore.toolloop.domain.component;

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

import me.golemcore.toolloop.domain.model.CancellationToken;
import me.golemcore.toolloop.domain.model.ToolDefinition;
import me.golemcore.toolloop.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Executable tool that can be invoked by the LLM. Tools expose their JSON
 * Schema definition to the LLM via function calling, and implement the
 * execution logic.
 *
 * <p>
 * Implementations must be safe to invoke concurrently with other tools and with
 * themselves (distinct arguments). A tool wrapping a stateful resource owns that
 * resource's concurrency discipline; the tool loop adds none.
 */
public interface ToolComponent {

    /**
     * Returns the tool definition with JSON Schema for function calling. The
     * definition includes the tool name, description, and parameter schema, and
     * must be stable for the lifetime of the tool.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with the specified parameters and returns the result.
     * Parameters are validated against the tool's JSON Schema before execution.
     *
     * <p>
     * Long-running tools should observe {@code cancellationToken} and stop early
     * once it fires. A tool reports failure by returning a failed
     * {@link ToolResult}, by throwing, or by completing the future
     * exceptionally; {@link IllegalArgumentException} is reported as invalid
     * arguments.
     *
     * @param parameters
     *            the execution parameters as a map
     * @param cancellationToken
     *            fires when the caller cancels or the tool times out
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters, CancellationToken cancellationToken);

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }

    /**
     * Checks whether this tool is currently enabled. Disabled tools are hidden
     * from the LLM and resolve as unknown.
     *
     * @return true if the tool is enabled, false otherwise
     */
    default boolean isEnabled() {
        return true;
    }

    /**
     * Renders a result of this tool as the text of a tool message. Returns null
     * when a successful result has no text output, in which case the caller
     * serializes the structured data instead.
     *
     * @param result
     *            the tool result
     * @return text sent back to the LLM
     */
    default String renderResult(ToolResult result) {
        if (result == null) {
            return null;
        }
        if (result.isSuccess()) {
            return result.getOutput();
        }
        if (result.getOutput() != null && !result.getOutput().isBlank()) {
            return result.getOutput();
        }
        return "Error: " + result.getError();
    }
}
