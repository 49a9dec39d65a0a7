package me.golemcore.toolloop.port.outbound;

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
import me.golemcore.toolloop.domain.model.LlmRequest;
import me.golemcore.toolloop.domain.model.LlmResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Port for integrating with LLM providers (OpenAI, Anthropic, etc.). Provides
 * chat completion with function calling support.
 *
 * <p>
 * The tool loop treats the provider as an external collaborator: it does not
 * retry failed calls, so any retry policy belongs to the implementation.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "openai", "anthropic").
     */
    String getProviderId();

    /**
     * Executes a chat completion request and returns the assistant turn. Tool
     * call ids in the response must be unique within that response. The returned
     * future may be cancelled by the caller once {@code cancellationToken} fires.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request, CancellationToken cancellationToken);

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
