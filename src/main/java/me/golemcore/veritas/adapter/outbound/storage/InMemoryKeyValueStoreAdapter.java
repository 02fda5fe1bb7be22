package me.golemcore.veritas.adapter.outbound.storage;

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

import me.golemcore.veritas.port.outbound.KeyValueStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-local key-value store. Contents are lost on restart; intended for
 * ephemeral deployments and local development.
 *
 * <p>
 * Active when {@code veritas.storage.type=memory}.
 */
@Component
@ConditionalOnProperty(prefix = "veritas.storage", name = "type", havingValue = "memory")
@Slf4j
public class InMemoryKeyValueStoreAdapter implements KeyValueStorePort {

    private final NavigableMap<String, String> entries = new ConcurrentSkipListMap<>();

    @Override
    public CompletableFuture<String> get(String key) {
        return CompletableFuture.completedFuture(entries.get(key));
    }

    @Override
    public CompletableFuture<Void> put(String key, String value) {
        entries.put(key, value);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<List<String>> list(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return CompletableFuture.completedFuture(new ArrayList<>(entries.keySet()));
        }
        // prefix + Character.MAX_VALUE bounds every key that starts with prefix
        List<String> keys = new ArrayList<>(entries.subMap(prefix, true, prefix + Character.MAX_VALUE, false)
                .keySet());
        return CompletableFuture.completedFuture(keys);
    }
}
