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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Per-key mutual exclusion for read-modify-write sequences against the stores
 * (usage counters, session transcripts). Actions for different keys run in
 * parallel; actions for the same key run one at a time.
 *
 * <p>
 * One monitor object is kept per key ever seen, so memory grows with the number
 * of distinct keys, in line with the usage counters themselves.
 */
public class KeyedLocks {

    private final Map<String, Object> monitors = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> action) {
        Object monitor = monitors.computeIfAbsent(key, k -> new Object());
        synchronized (monitor) {
            return action.get();
        }
    }

    public void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }
}
