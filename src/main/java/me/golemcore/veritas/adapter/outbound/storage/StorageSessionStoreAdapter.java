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

import me.golemcore.veritas.domain.model.SessionRecord;
import me.golemcore.veritas.domain.model.StoreException;
import me.golemcore.veritas.port.outbound.SessionStorePort;
import me.golemcore.veritas.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Session store writing one JSON document per session to
 * {@code sessions/<session-id>.json}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageSessionStoreAdapter implements SessionStorePort {

    private static final String SESSIONS_DIR = "sessions";
    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<SessionRecord> get(String sessionId) {
        String json;
        try {
            json = storagePort.getText(SESSIONS_DIR, fileName(sessionId)).join();
        } catch (CompletionException e) {
            throw new StoreException("Failed to read session: " + sessionId, unwrap(e));
        }
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, SessionRecord.class));
        } catch (JsonProcessingException e) {
            log.error("[Session] Unreadable session file for {}: {}", sessionId, e.getOriginalMessage());
            throw new StoreException("Corrupt session: " + sessionId, e);
        }
    }

    @Override
    public void put(SessionRecord session) {
        String json;
        try {
            json = objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to encode session: " + session.getSessionId(), e);
        }
        try {
            storagePort.putTextAtomic(SESSIONS_DIR, fileName(session.getSessionId()), json).join();
            log.debug("[Session] Saved session: {}", session.getSessionId());
        } catch (CompletionException e) {
            throw new StoreException("Failed to write session: " + session.getSessionId(), unwrap(e));
        }
    }

    private String fileName(String sessionId) {
        return URLEncoder.encode(sessionId, StandardCharsets.UTF_8) + JSON_EXTENSION;
    }

    private Throwable unwrap(CompletionException e) {
        return e.getCause() != null ? e.getCause() : e;
    }
}
