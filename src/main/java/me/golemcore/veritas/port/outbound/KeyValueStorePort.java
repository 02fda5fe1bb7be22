package me.golemcore.veritas.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the key-value substrate behind the answer cache. Keys are flat
 * strings such as {@code truth:how-are-you}; values are opaque text.
 *
 * <p>
 * Implementations provide read-after-write consistency for a single key and
 * complete exceptionally with
 * {@link me.golemcore.veritas.domain.model.StoreException} on persistence
 * failures.
 */
public interface KeyValueStorePort {

    /**
     * Read a value. Completes with {@code null} when the key is absent.
     */
    CompletableFuture<String> get(String key);

    /**
     * Create or overwrite a value.
     */
    CompletableFuture<Void> put(String key, String value);

    /**
     * List all keys starting with the prefix, in ascending order.
     */
    CompletableFuture<List<String>> list(String prefix);
}
