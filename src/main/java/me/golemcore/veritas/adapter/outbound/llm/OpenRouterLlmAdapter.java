package me.golemcore.veritas.adapter.outbound.llm;

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

import me.golemcore.veritas.domain.model.LlmProviderException;
import me.golemcore.veritas.domain.model.LlmRequest;
import me.golemcore.veritas.domain.model.LlmResponse;
import me.golemcore.veritas.infrastructure.config.VeritasProperties;
import me.golemcore.veritas.infrastructure.http.FeignClientFactory;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * OpenRouter adapter speaking the OpenAI chat completions protocol through
 * Feign + OkHttp. The prompt is sent as a single user message.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code veritas.llm.openrouter.api-url} - base URL, defaults to
 * {@code https://openrouter.ai/api/v1}</li>
 * <li>{@code veritas.llm.openrouter.api-key} - bearer key</li>
 * <li>{@code veritas.llm.openrouter.model} - model id</li>
 * <li>{@code veritas.llm.openrouter.referer} / {@code title} - attribution
 * headers</li>
 * </ul>
 *
 * <p>
 * Provider ID: {@code "openrouter"}
 *
 * @see me.golemcore.veritas.infrastructure.http.FeignClientFactory
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenRouterLlmAdapter implements LlmProviderAdapter {

    private final VeritasProperties properties;
    private final FeignClientFactory feignClientFactory;

    private OpenRouterApi client;
    private volatile boolean initialized = false;

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        VeritasProperties.OpenRouterProperties config = properties.getLlm().getOpenrouter();
        if (config.getApiUrl() != null && !config.getApiUrl().isBlank()) {
            this.client = feignClientFactory.create(OpenRouterApi.class, config.getApiUrl());
            initialized = true;
            log.info("OpenRouter adapter initialized with URL: {}", config.getApiUrl());
        }
    }

    @Override
    public String getProviderId() {
        return "openrouter";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            VeritasProperties.OpenRouterProperties config = properties.getLlm().getOpenrouter();
            if (config.getApiKey() == null || config.getApiKey().isBlank()) {
                throw new LlmProviderException("OPENROUTER_API_KEY secret not found.");
            }
            ensureInitialized();
            if (client == null) {
                throw new LlmProviderException("OpenRouter adapter not available");
            }

            ChatCompletionRequest apiRequest = new ChatCompletionRequest();
            apiRequest.setModel(request.getModel() != null ? request.getModel() : config.getModel());
            ApiMessage message = new ApiMessage();
            message.setRole("user");
            message.setContent(request.getPrompt());
            apiRequest.setMessages(List.of(message));

            ChatCompletionResponse apiResponse;
            try {
                apiResponse = client.chatCompletion(config.getApiKey(), config.getReferer(), config.getTitle(),
                        apiRequest);
            } catch (FeignException e) {
                log.error("[LLM] OpenRouter call failed with status {}", e.status());
                throw new LlmProviderException("OpenRouter error: " + e.status() + " " + e.contentUTF8(), e);
            } catch (RuntimeException e) {
                log.error("[LLM] OpenRouter call failed", e);
                throw new LlmProviderException("OpenRouter call failed: " + e.getMessage(), e);
            }
            return convertResponse(apiResponse);
        });
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getOpenrouter().getModel();
    }

    @Override
    public boolean isAvailable() {
        VeritasProperties.OpenRouterProperties config = properties.getLlm().getOpenrouter();
        return config.getApiUrl() != null && !config.getApiUrl().isBlank()
                && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    LlmResponse convertResponse(ChatCompletionResponse apiResponse) {
        if (apiResponse == null || apiResponse.getChoices() == null || apiResponse.getChoices().isEmpty()
                || apiResponse.getChoices().get(0).getMessage() == null) {
            throw new LlmProviderException("Invalid OpenRouter response structure");
        }
        ChatChoice choice = apiResponse.getChoices().get(0);
        return LlmResponse.builder()
                .content(choice.getMessage().getContent())
                .model(apiResponse.getModel())
                .finishReason(choice.getFinishReason())
                .build();
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    // Feign API interface
    public interface OpenRouterApi {
        @RequestLine("POST /chat/completions")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}",
                "HTTP-Referer: {referer}",
                "X-Title: {title}"
        })
        ChatCompletionResponse chatCompletion(@Param("apiKey") String apiKey, @Param("referer") String referer,
                @Param("title") String title, ChatCompletionRequest request);
    }

    // API DTOs
    @Data
    public static class ChatCompletionRequest {
        private String model;
        private List<ApiMessage> messages;
    }

    @Data
    public static class ChatCompletionResponse {
        private String id;
        private String model;
        private List<ChatChoice> choices;
    }

    @Data
    public static class ChatChoice {
        private int index;
        private ApiMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    public static class ApiMessage {
        private String role;
        private String content;
    }
}
