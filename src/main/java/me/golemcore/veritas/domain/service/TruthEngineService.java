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

import me.golemcore.veritas.domain.model.AnswerSource;
import me.golemcore.veritas.domain.model.CanonicalRecord;
import me.golemcore.veritas.domain.model.EngineResult;
import me.golemcore.veritas.domain.model.FailureKind;
import me.golemcore.veritas.domain.model.LlmProviderException;
import me.golemcore.veritas.domain.model.LlmRequest;
import me.golemcore.veritas.domain.model.LlmResponse;
import me.golemcore.veritas.domain.model.QueryAnswer;
import me.golemcore.veritas.domain.model.SessionRecord;
import me.golemcore.veritas.domain.model.StoreException;
import me.golemcore.veritas.domain.model.TopQuery;
import me.golemcore.veritas.infrastructure.config.CachePolicy;
import me.golemcore.veritas.port.outbound.LlmPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Entry point for every cache and session operation exposed to the transport
 * layer.
 *
 * <p>
 * A query is answered from the first tier that has it:
 * <ol>
 * <li>promoted record - answer returned as-is, counters untouched</li>
 * <li>canonical record - answer returned, usage counted</li>
 * <li>model provider - answer stored as a new canonical record, usage
 * counted</li>
 * </ol>
 * Every answered query is appended to the session transcript.
 *
 * <p>
 * Each operation returns an {@link EngineResult}; nothing is thrown to the
 * caller. The provider is called before any write, so a provider failure
 * leaves records, counters and the transcript untouched.
 *
 * <p>
 * Cache tiers are committed before the transcript append in {@code save} and
 * {@code query}. If the append fails the caller gets {@code STORE} while the
 * canonical record, promoted record and counter already reflect the event; the
 * transcript simply lacks that exchange.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TruthEngineService {

    private static final String QUERY_REQUIRED = "Query is required";

    private final QueryNormalizer normalizer;
    private final TieredCacheService cache;
    private final PopularityRanker ranker;
    private final SessionHistoryService sessions;
    private final LlmPort llmPort;
    private final CachePolicy policy;
    private final ObjectMapper objectMapper;

    // ==================== cache ====================

    /**
     * Canonical answer for the query, or a {@code null} payload when none is
     * stored.
     */
    public EngineResult<String> load(String query) {
        if (isBlank(query)) {
            return EngineResult.validation(QUERY_REQUIRED);
        }
        String normalizedQuery = normalizer.normalize(query);
        if (normalizedQuery.isEmpty()) {
            return EngineResult.success(null);
        }
        return execute("load", () -> EngineResult.success(cache.load(normalizedQuery).orElse(null)));
    }

    /**
     * Store a human-edited answer. Returns the normalized query it was filed
     * under.
     */
    public EngineResult<String> save(String sessionId, String query, String answer, String editor) {
        if (isBlank(query) || isBlank(answer)) {
            return EngineResult.validation("query and answer are required");
        }
        if (isBlank(sessionId)) {
            return EngineResult.validation("sessionId is required");
        }
        String normalizedQuery = normalizer.normalize(query);
        if (normalizedQuery.isEmpty()) {
            return EngineResult.validation("Query must contain at least one letter or digit");
        }
        String author = isBlank(editor) ? CanonicalRecord.EDITOR_USER : editor;

        return execute("save", () -> {
            cache.saveEdit(normalizedQuery, answer, author);
            sessions.appendExchange(sessionId, query, answer, author);
            return EngineResult.success(normalizedQuery);
        });
    }

    public EngineResult<QueryAnswer> query(String sessionId, String query, boolean followUp) {
        if (isBlank(query)) {
            return EngineResult.validation(QUERY_REQUIRED);
        }
        if (isBlank(sessionId)) {
            return EngineResult.validation("sessionId is required");
        }
        String normalizedQuery = normalizer.normalize(query);
        if (normalizedQuery.isEmpty()) {
            return EngineResult.validation("Query must contain at least one letter or digit");
        }

        return execute("query", () -> {
            Optional<String> promoted = cache.findPromotedAnswer(normalizedQuery);
            if (promoted.isPresent()) {
                log.debug("[Query] Promoted hit for '{}'", normalizedQuery);
                return answered(sessionId, query, promoted.get(), AnswerSource.PROMOTED);
            }

            Optional<CanonicalRecord> canonical = cache.findCanonical(normalizedQuery);
            if (canonical.isPresent()) {
                log.debug("[Query] Canonical hit for '{}'", normalizedQuery);
                cache.recordCanonicalHit(normalizedQuery, canonical.get().getAnswer());
                return answered(sessionId, query, canonical.get().getAnswer(), AnswerSource.CANONICAL);
            }

            String prompt = buildPrompt(sessionId, query, followUp);
            LlmResponse response = invokeProvider(prompt);
            CanonicalRecord stored = cache.saveModelAnswer(normalizedQuery, response.getContent());
            log.info("[Query] Model answered '{}' via {}", normalizedQuery, llmPort.getProviderId());
            return answered(sessionId, query, stored.getAnswer(), AnswerSource.MODEL);
        });
    }

    public EngineResult<List<TopQuery>> topQueries() {
        return execute("top-queries", () -> EngineResult.success(ranker.topQueries()));
    }

    public EngineResult<List<TopQuery>> topQueries(int limit) {
        return execute("top-queries", () -> EngineResult.success(ranker.topQueries(limit)));
    }

    // ==================== sessions ====================

    public EngineResult<Void> appendExchange(String sessionId, String userContent, String assistantContent) {
        if (isBlank(sessionId)) {
            return EngineResult.validation("sessionId is required");
        }
        if (isBlank(userContent) || isBlank(assistantContent)) {
            return EngineResult.validation("query and answer are required");
        }
        return execute("append", () -> {
            sessions.appendExchange(sessionId, userContent, assistantContent, CanonicalRecord.EDITOR_USER);
            return EngineResult.success(null);
        });
    }

    public EngineResult<SessionRecord> history(String sessionId) {
        if (isBlank(sessionId)) {
            return EngineResult.validation("sessionId is required");
        }
        return execute("history", () -> EngineResult.success(sessions.read(sessionId)));
    }

    public EngineResult<String> exportSession(String sessionId) {
        if (isBlank(sessionId)) {
            return EngineResult.validation("sessionId is required");
        }
        return execute("export", () -> EngineResult.success(sessions.export(sessionId)));
    }

    public EngineResult<SessionRecord> importSession(String sessionId, String data) {
        if (isBlank(sessionId)) {
            return EngineResult.validation("sessionId is required");
        }
        return execute("import", () -> sessions.importSession(sessionId, data));
    }

    // ==================== internals ====================

    /**
     * Prompt sent to the provider. A follow-up carries the session's most recent
     * assistant answers as a JSON context block ahead of the raw query.
     */
    String buildPrompt(String sessionId, String query, boolean followUp) {
        if (!followUp) {
            return query;
        }
        List<Map<String, String>> context = sessions
                .recentAssistantMessages(sessionId, policy.getFollowUpContextMessages())
                .stream()
                .map(message -> {
                    Map<String, String> entry = new LinkedHashMap<>();
                    entry.put("role", message.getRole());
                    entry.put("content", message.getContent());
                    return entry;
                })
                .toList();
        try {
            return "Context: " + objectMapper.writeValueAsString(context) + "\nQuery: " + query;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode follow-up context", e);
        }
    }

    private LlmResponse invokeProvider(String prompt) {
        LlmRequest request = LlmRequest.builder().prompt(prompt).build();
        LlmResponse response;
        try {
            response = llmPort.chat(request)
                    .orTimeout(policy.getProviderTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                throw new LlmProviderException("Model provider timed out after "
                        + policy.getProviderTimeout().toSeconds() + "s", cause);
            }
            if (cause instanceof LlmProviderException providerException) {
                throw providerException;
            }
            throw new LlmProviderException("Model provider failed: " + cause.getMessage(), cause);
        } catch (LlmProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LlmProviderException("Model provider failed: " + e.getMessage(), e);
        }

        if (response == null || !response.hasContent()) {
            throw new LlmProviderException("Model provider returned no answer");
        }
        return response;
    }

    private EngineResult<QueryAnswer> answered(String sessionId, String query, String answer, AnswerSource source) {
        sessions.appendExchange(sessionId, query, answer, CanonicalRecord.EDITOR_USER);
        return EngineResult.success(QueryAnswer.builder()
                .answer(answer)
                .sessionId(sessionId)
                .source(source)
                .build());
    }

    private <T> EngineResult<T> execute(String operation, Supplier<EngineResult<T>> action) {
        try {
            return action.get();
        } catch (LlmProviderException e) {
            log.warn("[Query] Provider failure during {}: {}", operation, e.getMessage());
            return EngineResult.failure(FailureKind.PROVIDER, e.getMessage());
        } catch (StoreException e) {
            log.error("[Cache] Store failure during {}", operation, e);
            return EngineResult.failure(FailureKind.STORE, e.getMessage());
        } catch (RuntimeException e) { // NOSONAR - every failure is reported as a value
            log.error("[Engine] Unexpected failure during {}", operation, e);
            return EngineResult.failure(FailureKind.INTERNAL, "Internal error: " + e.getMessage());
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
