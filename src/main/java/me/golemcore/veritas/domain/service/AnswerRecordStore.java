package me.golemcore.veritas.domain.service;

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

import me.golemcore.veritas.domain.model.CanonicalRecord;
import me.golemcore.veritas.domain.model.PromotedRecord;
import me.golemcore.veritas.domain.model.StoreException;
import me.golemcore.veritas.port.outbound.KeyValueStorePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Typed access to the answer cache records kept in the key-value store.
 *
 * <p>
 * Key layout, per normalized query {@code q}:
 * <ul>
 * <li>{@code truth:q} - {@link CanonicalRecord} as JSON</li>
 * <li>{@code cache:q} - {@link PromotedRecord} as JSON</li>
 * <li>{@code count:q} - usage counter as a decimal integer</li>
 * </ul>
 *
 * <p>
 * This is the only class that knows the key prefixes and the encoded form of
 * the records. Every failure surfaces as {@link StoreException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnswerRecordStore {

    static final String TRUTH_PREFIX = "truth:";
    static final String CACHE_PREFIX = "cache:";
    static final String COUNT_PREFIX = "count:";

    private final KeyValueStorePort keyValueStore;
    private final ObjectMapper objectMapper;

    public Optional<CanonicalRecord> findCanonical(String normalizedQuery) {
        return read(TRUTH_PREFIX + normalizedQuery, CanonicalRecord.class);
    }

    public void putCanonical(String normalizedQuery, CanonicalRecord canonical) {
        write(TRUTH_PREFIX + normalizedQuery, encode(canonical));
    }

    public Optional<PromotedRecord> findPromoted(String normalizedQuery) {
        return read(CACHE_PREFIX + normalizedQuery, PromotedRecord.class);
    }

    public void putPromoted(String normalizedQuery, PromotedRecord promoted) {
        write(CACHE_PREFIX + normalizedQuery, encode(promoted));
    }

    /**
     * Read the usage counter. An absent counter reads as zero; a counter that
     * is not an integer is reported as a store failure.
     */
    public long getUsageCount(String normalizedQuery) {
        String key = COUNT_PREFIX + normalizedQuery;
        String raw = await(keyValueStore.get(key), key);
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        OptionalLong parsed = parseCount(raw);
        if (parsed.isEmpty()) {
            throw new StoreException("Corrupt usage counter: " + key);
        }
        return parsed.getAsLong();
    }

    /**
     * Read the usage counter for ranking purposes: absent or corrupt counters
     * are reported as empty instead of failing.
     */
    public OptionalLong findUsageCount(String normalizedQuery) {
        String key = COUNT_PREFIX + normalizedQuery;
        String raw = await(keyValueStore.get(key), key);
        if (raw == null) {
            return OptionalLong.empty();
        }
        OptionalLong parsed = parseCount(raw);
        if (parsed.isEmpty()) {
            log.debug("[Cache] Skipping unparsable counter {}: {}", key, raw);
        }
        return parsed;
    }

    public void putUsageCount(String normalizedQuery, long count) {
        write(COUNT_PREFIX + normalizedQuery, Long.toString(count));
    }

    /**
     * Normalized queries that have a usage counter, in key order.
     */
    public List<String> listCountedQueries() {
        List<String> keys = await(keyValueStore.list(COUNT_PREFIX), COUNT_PREFIX + "*");
        return keys.stream()
                .filter(key -> key.startsWith(COUNT_PREFIX))
                .map(key -> key.substring(COUNT_PREFIX.length()))
                .toList();
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        String json = await(keyValueStore.get(key), key);
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt record: " + key, e);
        }
    }

    private void write(String key, String value) {
        await(keyValueStore.put(key, value), key);
    }

    private String encode(Object record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to encode record", e);
        }
    }

    private OptionalLong parseCount(String raw) {
        try {
            return OptionalLong.of(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    private <T> T await(CompletableFuture<T> future, String key) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof StoreException storeException) {
                throw storeException;
            }
            throw new StoreException("Store operation failed for " + key + ": " + cause.getMessage(), cause);
        }
    }
}
