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

import me.golemcore.veritas.domain.model.StoreException;
import me.golemcore.veritas.port.outbound.KeyValueStorePort;
import me.golemcore.veritas.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Key-value store backed by the workspace filesystem: one file per key under
 * {@code kv/}, the key URL-encoded into the file name. Writes go through
 * {@link StoragePort#putTextAtomic} so a reader never sees a half-written
 * record.
 *
 * <p>
 * Active when {@code veritas.storage.type=local} (the default).
 */
@Component
@ConditionalOnProperty(prefix = "veritas.storage", name = "type", havingValue = "local", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class FileKeyValueStoreAdapter implements KeyValueStorePort {

    private static final String KV_DIR = "kv";

    private final StoragePort storagePort;

    @Override
    public CompletableFuture<String> get(String key) {
        return storagePort.getText(KV_DIR, toFileName(key))
                .handle((value, error) -> {
                    if (error != null) {
                        throw storeFailure("read", key, error);
                    }
                    return value;
                });
    }

    @Override
    public CompletableFuture<Void> put(String key, String value) {
        return storagePort.putTextAtomic(KV_DIR, toFileName(key), value)
                .handle((ignored, error) -> {
                    if (error != null) {
                        throw storeFailure("write", key, error);
                    }
                    log.trace("[KV] put {}", key);
                    return null;
                });
    }

    @Override
    public CompletableFuture<List<String>> list(String prefix) {
        return storagePort.listObjects(KV_DIR, "")
                .handle((files, error) -> {
                    if (error != null) {
                        throw storeFailure("list", prefix, error);
                    }
                    return files.stream()
                            .map(FileKeyValueStoreAdapter::toKey)
                            .filter(key -> prefix == null || key.startsWith(prefix))
                            .sorted()
                            .toList();
                });
    }

    static String toFileName(String key) {
        return URLEncoder.encode(key, StandardCharsets.UTF_8);
    }

    static String toKey(String fileName) {
        return URLDecoder.decode(fileName, StandardCharsets.UTF_8);
    }

    private StoreException storeFailure(String operation, String key, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        log.error("[KV] Failed to {} key {}: {}", operation, key, cause.getMessage());
        return new StoreException("Failed to " + operation + " key: " + key, cause);
    }
}
