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

import me.golemcore.veritas.domain.model.ChatMessage;
import me.golemcore.veritas.domain.model.EngineResult;
import me.golemcore.veritas.domain.model.FailureKind;
import me.golemcore.veritas.domain.model.SessionRecord;
import me.golemcore.veritas.port.outbound.SessionStorePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only conversation transcripts keyed by session id.
 *
 * <p>
 * Sessions are created lazily on first append. Every read-append-write runs
 * under a per-session lock so concurrent requests for one session never lose
 * messages. Import replaces a transcript wholesale after checking that the
 * document belongs to the target session.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionHistoryService {

    private static final String ASSISTANT_NAME = "ai";

    private final SessionStorePort sessionStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final KeyedLocks locks = new KeyedLocks();

    /**
     * Returns the stored transcript, or a fresh empty one if the session does not
     * exist yet. Nothing is written.
     */
    public SessionRecord read(String sessionId) {
        return sessionStore.get(sessionId)
                .map(session -> normalize(session, sessionId))
                .orElseGet(() -> SessionRecord.empty(sessionId, clock.instant()));
    }

    public void append(String sessionId, ChatMessage message) {
        locks.withLock(sessionId, () -> {
            SessionRecord session = read(sessionId);
            session.getMessages().add(message);
            sessionStore.put(session);
        });
    }

    /**
     * Append a user message and the assistant answer in one write.
     *
     * @param userName
     *            recorded as the author of the user message ("user" or the
     *            editor's name)
     */
    public void appendExchange(String sessionId, String userContent, String assistantContent, String userName) {
        ChatMessage userMessage = ChatMessage.builder()
                .id(UUID.randomUUID().toString())
                .content(userContent)
                .user(userName)
                .role(ChatMessage.ROLE_USER)
                .build();
        ChatMessage assistantMessage = ChatMessage.builder()
                .id(UUID.randomUUID().toString())
                .content(assistantContent)
                .user(ASSISTANT_NAME)
                .role(ChatMessage.ROLE_ASSISTANT)
                .build();

        locks.withLock(sessionId, () -> {
            SessionRecord session = read(sessionId);
            session.getMessages().add(userMessage);
            session.getMessages().add(assistantMessage);
            sessionStore.put(session);
        });
        log.debug("[Session] Appended exchange to {}", sessionId);
    }

    /**
     * The most recent assistant messages of the session, oldest first. User
     * messages are never included.
     */
    public List<ChatMessage> recentAssistantMessages(String sessionId, int limit) {
        List<ChatMessage> assistantMessages = read(sessionId).getMessages().stream()
                .filter(Objects::nonNull)
                .filter(ChatMessage::isAssistantMessage)
                .toList();
        int from = Math.max(0, assistantMessages.size() - limit);
        return assistantMessages.subList(from, assistantMessages.size());
    }

    /**
     * Serialize the full transcript as pretty-printed JSON.
     */
    public String export(String sessionId) {
        SessionRecord session = read(sessionId);
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session " + sessionId, e);
        }
    }

    /**
     * Replace the transcript with an exported document. Fails with
     * {@link FailureKind#PARSE} on malformed JSON and with
     * {@link FailureKind#VALIDATION} when the document names another session;
     * nothing is written in either case.
     */
    public EngineResult<SessionRecord> importSession(String sessionId, String data) {
        SessionRecord imported;
        try {
            imported = data == null ? null : objectMapper.readValue(data, SessionRecord.class);
        } catch (JsonProcessingException e) {
            log.debug("[Session] Rejected import for {}: {}", sessionId, e.getOriginalMessage());
            return EngineResult.failure(FailureKind.PARSE, "Invalid JSON format");
        }
        if (imported == null) {
            return EngineResult.failure(FailureKind.PARSE, "Invalid JSON format");
        }
        if (!sessionId.equals(imported.getSessionId())) {
            log.warn("[Session] Import for {} carried session id {}", sessionId, imported.getSessionId());
            return EngineResult.validation("Invalid session ID");
        }

        SessionRecord session = normalize(imported, sessionId);
        locks.withLock(sessionId, () -> sessionStore.put(session));
        log.info("[Session] Imported {} messages into {}", session.getMessages().size(), sessionId);
        return EngineResult.success(session);
    }

    private SessionRecord normalize(SessionRecord session, String sessionId) {
        if (session.getSessionId() == null) {
            session.setSessionId(sessionId);
        }
        if (session.getMessages() == null) {
            session.setMessages(new ArrayList<>());
        } else if (!(session.getMessages() instanceof ArrayList)) {
            session.setMessages(new ArrayList<>(session.getMessages()));
        }
        if (session.getCreated() == null) {
            session.setCreated(clock.instant());
        }
        return session;
    }
}
