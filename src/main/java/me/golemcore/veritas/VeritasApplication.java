package me.golemcore.veritas;

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
 * Main application class for Veritas Cache.
 *
 * <p>
 * Veritas Cache answers free-text queries from a tiered store of vetted
 * answers and falls back to an LLM provider only on a miss.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Tiered cache</b> - promoted fast path, canonical human-editable
 * answers, per-query usage counters</li>
 * <li><b>Session history</b> - per-session transcripts with JSON export and
 * import</li>
 * <li><b>Popularity</b> - today's most-asked queries</li>
 * <li><b>Multi-LLM Support</b> - Workers AI, OpenRouter and any
 * OpenAI-compatible endpoint via langchain4j</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → TruthController, ConversationController
 * Domain Layer       → TruthEngineService, TieredCacheService, SessionHistoryService
 * Infrastructure     → LLM/Storage Adapters
 * </pre>
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class VeritasApplication {

    public static void main(String[] args) {
        SpringApplication.run(VeritasApplication.class, args);
    }
}
