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
import me.golemcore.veritas.infrastructure.config.CachePolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the two answer tiers and the usage counter of every normalized query.
 *
 * <p>
 * Tiers:
 * <ul>
 * <li><b>canonical</b> ({@code truth:}) - authoritative answer with provenance
 * ({@code lastEditedBy}, {@code edited}, {@code created})</li>
 * <li><b>promoted</b> ({@code cache:}) - answer-only copy written once the
 * usage counter exceeds {@link CachePolicy#getPromotionThreshold()}</li>
 * </ul>
 *
 * <p>
 * All writes for one normalized query run under a per-query lock, so the
 * counter increment and the promotion decision see a consistent count. Within
 * an event the write order is canonical, then promoted, then counter: a failure
 * between the last two leaves a promoted record whose counter was not bumped,
 * which the next event repairs. A counter is never incremented without its
 * canonical write having succeeded first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TieredCacheService {

    private final AnswerRecordStore recordStore;
    private final CachePolicy policy;
    private final Clock clock;
    private final KeyedLocks locks = new KeyedLocks();

    /**
     * Side-effect-free peek at the canonical answer.
     */
    public Optional<String> load(String normalizedQuery) {
        return recordStore.findCanonical(normalizedQuery).map(CanonicalRecord::getAnswer);
    }

    public Optional<String> findPromotedAnswer(String normalizedQuery) {
        return recordStore.findPromoted(normalizedQuery).map(PromotedRecord::getAnswer);
    }

    public Optional<CanonicalRecord> findCanonical(String normalizedQuery) {
        return recordStore.findCanonical(normalizedQuery);
    }

    /**
     * Store a human edit. The original {@code created} time survives; the
     * usage counter is incremented and the answer promoted if the query is
     * popular enough.
     */
    public CanonicalRecord saveEdit(String normalizedQuery, String answer, String editor) {
        return locks.withLock(normalizedQuery, () -> {
            Instant now = clock.instant();
            Instant created = recordStore.findCanonical(normalizedQuery)
                    .map(CanonicalRecord::getCreated)
                    .filter(Objects::nonNull)
                    .orElse(now);

            CanonicalRecord canonical = CanonicalRecord.builder()
                    .answer(answer)
                    .lastEditedBy(editor != null && !editor.isBlank() ? editor : CanonicalRecord.EDITOR_USER)
                    .edited(true)
                    .created(created)
                    .timestamp(now)
                    .build();
            recordStore.putCanonical(normalizedQuery, canonical);
            log.info("[Cache] Saved edit for '{}' by {}", normalizedQuery, canonical.getLastEditedBy());

            countUsage(normalizedQuery, answer);
            return canonical;
        });
    }

    /**
     * Store a fresh model answer. A human edit that landed while the model was
     * running is kept instead, and returned.
     */
    public CanonicalRecord saveModelAnswer(String normalizedQuery, String answer) {
        return locks.withLock(normalizedQuery, () -> {
            Optional<CanonicalRecord> existing = recordStore.findCanonical(normalizedQuery);
            if (existing.isPresent() && existing.get().isEdited()) {
                log.info("[Cache] Keeping human edit for '{}', model answer discarded", normalizedQuery);
                countUsage(normalizedQuery, existing.get().getAnswer());
                return existing.get();
            }

            Instant now = clock.instant();
            CanonicalRecord canonical = CanonicalRecord.builder()
                    .answer(answer)
                    .lastEditedBy(CanonicalRecord.EDITOR_AI)
                    .edited(false)
                    .created(now)
                    .timestamp(now)
                    .build();
            recordStore.putCanonical(normalizedQuery, canonical);
            log.debug("[Cache] Stored model answer for '{}'", normalizedQuery);

            countUsage(normalizedQuery, answer);
            return canonical;
        });
    }

    /**
     * Count a query served from the canonical tier.
     */
    public long recordCanonicalHit(String normalizedQuery, String answer) {
        return locks.withLock(normalizedQuery, () -> countUsage(normalizedQuery, answer));
    }

    private long countUsage(String normalizedQuery, String answer) {
        long count = recordStore.getUsageCount(normalizedQuery) + 1;
        if (policy.shouldPromote(count)) {
            recordStore.putPromoted(normalizedQuery, PromotedRecord.builder()
                    .answer(answer)
                    .timestamp(clock.instant())
                    .build());
            log.debug("[Cache] Promoted '{}' at count {}", normalizedQuery, count);
        }
        recordStore.putUsageCount(normalizedQuery, count);
        return count;
    }
}
