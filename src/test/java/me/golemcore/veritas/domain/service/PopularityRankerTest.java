package me.golemcore.veritas.domain.service;

import me.golemcore.veritas.adapter.outbound.storage.InMemoryKeyValueStoreAdapter;
import me.golemcore.veritas.domain.model.CanonicalRecord;
import me.golemcore.veritas.domain.model.TopQuery;
import me.golemcore.veritas.infrastructure.config.AutoConfiguration;
import me.golemcore.veritas.infrastructure.config.CachePolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PopularityRankerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T23:59:00Z");
    private static final Instant EARLIER_TODAY = Instant.parse("2026-03-01T00:00:01Z");
    private static final Instant YESTERDAY = Instant.parse("2026-02-28T23:59:59Z");

    private InMemoryKeyValueStoreAdapter keyValueStore;
    private AnswerRecordStore recordStore;
    private PopularityRanker ranker;

    @BeforeEach
    void setUp() {
        keyValueStore = new InMemoryKeyValueStoreAdapter();
        recordStore = new AnswerRecordStore(keyValueStore, AutoConfiguration.objectMapper());
        ranker = new PopularityRanker(recordStore, CachePolicy.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldReturnEmptyWhenNothingCounted() {
        assertTrue(ranker.topQueries().isEmpty());
    }

    @Test
    void shouldExcludeQueriesNotTouchedToday() {
        seed("fresh", 3, EARLIER_TODAY);
        seed("stale", 100, YESTERDAY);

        List<TopQuery> top = ranker.topQueries();

        assertEquals(1, top.size());
        assertEquals("fresh", top.get(0).getQuery());
        assertEquals(3, top.get(0).getCount());
    }

    @Test
    void shouldExcludeCountersWithoutCanonicalRecord() {
        recordStore.putUsageCount("orphan", 9);
        seed("kept", 1, NOW);

        List<TopQuery> top = ranker.topQueries();

        assertEquals(List.of("kept"), top.stream().map(TopQuery::getQuery).toList());
    }

    @Test
    void shouldSkipUnparsableCounters() {
        seed("good", 2, NOW);
        seed("bad", 0, NOW);
        keyValueStore.put("count:bad", "NaN").join();

        List<TopQuery> top = ranker.topQueries();

        assertEquals(List.of("good"), top.stream().map(TopQuery::getQuery).toList());
    }

    @Test
    void shouldSortByCountDescending() {
        seed("low", 1, NOW);
        seed("high", 50, NOW);
        seed("mid", 7, NOW);

        List<TopQuery> top = ranker.topQueries();

        assertEquals(List.of("high", "mid", "low"), top.stream().map(TopQuery::getQuery).toList());
    }

    @Test
    void shouldKeepKeyOrderForTies() {
        seed("b-query", 4, NOW);
        seed("a-query", 4, NOW);

        List<TopQuery> top = ranker.topQueries();

        assertEquals(List.of("a-query", "b-query"), top.stream().map(TopQuery::getQuery).toList());
    }

    @Test
    void shouldLimitToTenByDefault() {
        for (int i = 0; i < 15; i++) {
            seed("query-" + i, i + 1, NOW);
        }

        List<TopQuery> top = ranker.topQueries();

        assertEquals(10, top.size());
        assertEquals("query-14", top.get(0).getQuery());
        assertEquals(15, top.get(0).getCount());
        assertEquals(6, top.get(9).getCount());
    }

    @Test
    void shouldHonourExplicitLimit() {
        seed("one", 1, NOW);
        seed("two", 2, NOW);

        assertEquals(1, ranker.topQueries(1).size());
        assertTrue(ranker.topQueries(0).isEmpty());
    }

    private void seed(String query, long count, Instant timestamp) {
        recordStore.putCanonical(query, CanonicalRecord.builder()
                .answer("answer for " + query)
                .lastEditedBy(CanonicalRecord.EDITOR_AI)
                .created(timestamp)
                .timestamp(timestamp)
                .build());
        recordStore.putUsageCount(query, count);
    }
}
