package me.golemcore.veritas.infrastructure.config;

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
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code veritas.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - model provider selection and credentials</li>
 * <li>{@link StorageProperties} - key-value and session persistence</li>
 * <li>{@link CacheProperties} - promotion and ranking policy</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link WebProperties} - CORS for the HTTP API</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "veritas")
@Data
public class VeritasProperties {

    private LlmProperties llm = new LlmProperties();
    private StorageProperties storage = new StorageProperties();
    private CacheProperties cache = new CacheProperties();
    private HttpProperties http = new HttpProperties();
    private WebProperties web = new WebProperties();

    @Data
    public static class LlmProperties {
        private String provider = "workers-ai";
        private Duration timeout = Duration.ofSeconds(60);
        private WorkersAiProperties workersAi = new WorkersAiProperties();
        private OpenRouterProperties openrouter = new OpenRouterProperties();
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class WorkersAiProperties {
        private String apiUrl = "https://api.cloudflare.com/client/v4";
        private String accountId;
        private String apiToken;
        private String model = "@cf/meta/llama-3-8b-instruct";
    }

    @Data
    public static class OpenRouterProperties {
        private String apiUrl = "https://openrouter.ai/api/v1";
        private String apiKey;
        private String model = "meta-llama/llama-3-8b-instruct";
        private String referer = "https://ingenium-veritas.com";
        private String title = "Ingenium Veritas";
    }

    @Data
    public static class Langchain4jProperties {
        private String baseUrl;
        private String apiKey;
        private String model = "gpt-4o-mini";
        private Double temperature;
        private int maxRetries = 2;
    }

    @Data
    public static class StorageProperties {
        private String type = "local";
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.veritas/workspace";
    }

    @Data
    public static class CacheProperties {
        private int promotionThreshold = 5;
        private int maxKeyLength = 100;
        private int topQueriesLimit = 10;
        private int followUpContextMessages = 2;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class WebProperties {
        private String corsAllowedOrigins = "*";
    }
}
