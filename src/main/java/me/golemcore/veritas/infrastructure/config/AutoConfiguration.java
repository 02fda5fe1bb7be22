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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core bean definitions and startup logging.
 *
 * <p>
 * Provides:
 * <ul>
 * <li>UTC {@link Clock} - all record timestamps and the "today" of the
 * popularity ranking derive from it</li>
 * <li>Shared {@link ObjectMapper} - ISO-8601 dates, lenient on unknown
 * properties</li>
 * <li>{@link CachePolicy} - frozen copy of {@code veritas.cache.*} and the provider timeout</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final VeritasProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public CachePolicy cachePolicy() {
        return CachePolicy.from(properties);
    }

    @PostConstruct
    public void init() {
        log.info("Veritas cache starting...");
        log.info("LLM Provider: {}", properties.getLlm().getProvider());
        log.info("Storage: {} ({})", properties.getStorage().getType(),
                properties.getStorage().getLocal().getBasePath());
        log.info("Promotion threshold: {}", properties.getCache().getPromotionThreshold());
    }
}
