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
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter for any OpenAI-compatible endpoint through langchain4j.
 *
 * <p>
 * Configuration via {@code veritas.llm.langchain4j.*}: {@code base-url}
 * (optional, defaults to OpenAI), {@code api-key}, {@code model},
 * {@code temperature} (optional) and {@code max-retries}. Retries on transient
 * errors are left to langchain4j.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    private final VeritasProperties properties;

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        try {
            this.chatModel = createModel();
            initialized = true;
            log.info("Langchain4j adapter initialized with model: {}", getCurrentModel());
        } catch (RuntimeException e) {
            log.warn("Failed to initialize Langchain4j adapter: {}", e.getMessage());
        }
    }

    /**
     * Build the chat model. Overridable so tests can substitute a stub.
     */
    protected ChatModel createModel() {
        VeritasProperties.Langchain4jProperties config = properties.getLlm().getLangchain4j();
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(config.getMaxRetries())
                .timeout(properties.getLlm().getTimeout());

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            if (!isAvailable()) {
                throw new LlmProviderException("Langchain4j api-key not configured");
            }
            ensureInitialized();
            if (chatModel == null) {
                throw new LlmProviderException("Langchain4j adapter not available");
            }

            ChatResponse response;
            try {
                response = chatModel.chat(List.of(UserMessage.from(request.getPrompt())));
            } catch (RuntimeException e) {
                log.error("[LLM] Langchain4j chat failed", e);
                throw new LlmProviderException("LLM chat failed: " + e.getMessage(), e);
            }

            AiMessage aiMessage = response != null ? response.aiMessage() : null;
            if (aiMessage == null) {
                throw new LlmProviderException("LLM returned no message");
            }
            return LlmResponse.builder()
                    .content(aiMessage.text())
                    .model(getCurrentModel())
                    .finishReason(response.finishReason() != null ? response.finishReason().name() : null)
                    .build();
        });
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getLangchain4j().getModel();
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getLangchain4j().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }
}
