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
import me.golemcore.veritas.domain.model.TopQuery;
import me.golemcore.veritas.infrastructure.config.CachePolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Daily ranking of the most used queries.
 *
 * <p>
 * A query qualifies when its canonical record was last written on the current
 * UTC calendar day. Cost is one counter read and one canonical read per query
 * ever counted, not just today's.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PopularityRanker {

    private final AnswerRecordStore recordStore;
    private final CachePolicy policy;
    private final Clock clock;

    public List<TopQuery> topQueries() {
        return topQueries(policy.getTopQueriesLimit());
    }

    /**
     * Queries touched today, by usage count descending. Ties keep key order.
     */
    public List<TopQuery> topQueries(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);

        List<TopQuery> candidates = new ArrayList<>();
        for (String query : recordStore.listCountedQueries()) {
            OptionalLong count = recordStore.findUsageCount(query);
            if (count.isEmpty()) {
                continue;
            }
            Optional<CanonicalRecord> canonical = recordStore.findCanonical(query);
            if (canonical.isEmpty() || !isOn(canonical.get().getTimestamp(), today)) {
                continue;
            }
            candidates.add(TopQuery.builder()
                    .query(query)
                    .count(count.getAsLong())
                    .build());
        }

        // List.sort is stable
        candidates.sort(Comparator.comparingLong(TopQuery::getCount).reversed());
        log.debug("[Ranking] {} of today's queries ranked", candidates.size());
        return candidates.size() > limit ? List.copyOf(candidates.subList(0, limit)) : List.copyOf(candidates);
    }

    private boolean isOn(Instant timestamp, LocalDate day) {
        return timestamp != null && LocalDate.ofInstant(timestamp, ZoneOffset.UTC).equals(day);
    }
}
