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
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Cloudflare Workers AI adapter using the REST "run model" endpoint through
 * Feign + OkHttp.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code veritas.llm.workers-ai.account-id} - Cloudflare account</li>
 * <li>{@code veritas.llm.workers-ai.api-token} - API token with Workers AI
 * access</li>
 * <li>{@code veritas.llm.workers-ai.model} - model slug, e.g.
 * {@code @cf/meta/llama-3-8b-instruct}</li>
 * </ul>
 *
 * <p>
 * Provider ID: {@code "workers-ai"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkersAiAdapter implements LlmProviderAdapter {

    private final VeritasProperties properties;
    private final FeignClientFactory feignClientFactory;

    private WorkersAiApi client;
    private volatile boolean initialized = false;

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        VeritasProperties.WorkersAiProperties config = properties.getLlm().getWorkersAi();
        if (isBlank(config.getApiUrl())) {
            log.warn("Workers AI adapter not initialized: api-url is empty");
            return;
        }
        this.client = feignClientFactory.create(WorkersAiApi.class, config.getApiUrl());
        initialized = true;
        log.info("Workers AI adapter initialized with model: {}", config.getModel());
    }

    @Override
    public String getProviderId() {
        return "workers-ai";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            if (!isAvailable()) {
                throw new LlmProviderException("Workers AI binding not configured");
            }
            ensureInitialized();
            if (client == null) {
                throw new LlmProviderException("Workers AI adapter not available");
            }

            VeritasProperties.WorkersAiProperties config = properties.getLlm().getWorkersAi();
            String model = request.getModel() != null ? request.getModel() : config.getModel();
            RunResponse response;
            try {
                response = client.run(config.getAccountId(), model, config.getApiToken(),
                        new RunRequest(request.getPrompt()));
            } catch (FeignException e) {
                log.error("[LLM] Workers AI call failed with status {}", e.status());
                throw new LlmProviderException("Workers AI error: " + e.status() + " " + e.contentUTF8(), e);
            } catch (RuntimeException e) {
                log.error("[LLM] Workers AI call failed", e);
                throw new LlmProviderException("Workers AI call failed: " + e.getMessage(), e);
            }
            return convertResponse(response, model);
        });
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getWorkersAi().getModel();
    }

    @Override
    public boolean isAvailable() {
        VeritasProperties.WorkersAiProperties config = properties.getLlm().getWorkersAi();
        return !isBlank(config.getAccountId()) && !isBlank(config.getApiToken());
    }

    LlmResponse convertResponse(RunResponse response, String model) {
        if (response == null || !response.isSuccess() || response.getResult() == null) {
            String detail = response != null && response.getErrors() != null && !response.getErrors().isEmpty()
                    ? response.getErrors().get(0).getMessage()
                    : "missing result";
            throw new LlmProviderException("Invalid Workers AI response: " + detail);
        }
        return LlmResponse.builder()
                .content(response.getResult().getResponse())
                .model(model)
                .finishReason("stop")
                .build();
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // Feign API interface
    public interface WorkersAiApi {
        @RequestLine("POST /accounts/{accountId}/ai/run/{model}")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiToken}"
        })
        RunResponse run(@Param("accountId") String accountId, @Param("model") String model,
                @Param("apiToken") String apiToken, RunRequest request);
    }

    // API DTOs
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RunRequest {
        private String prompt;
    }

    @Data
    public static class RunResponse {
        private RunResult result;
        private boolean success;
        private List<ApiError> errors;
    }

    @Data
    public static class RunResult {
        private String response;
    }

    @Data
    public static class ApiError {
        private int code;
        private String message;
    }
}
