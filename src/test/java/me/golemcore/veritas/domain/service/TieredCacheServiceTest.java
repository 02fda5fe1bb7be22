package me.golemcore.veritas.domain.service;

import me.golemcore.veritas.adapter.outbound.storage.InMemoryKeyValueStoreAdapter;
import me.golemcore.veritas.domain.model.CanonicalRecord;
import me.golemcore.veritas.infrastructure.config.AutoConfiguration;
import me.golemcore.veritas.infrastructure.config.CachePolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TieredCacheServiceTest {

    private static final Instant T1 = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2026-03-02T12:30:00Z");
    private static final String QUERY = "what-is-truth";

    private AnswerRecordStore recordStore;
    private Clock clock;
    private TieredCacheService cache;

    @BeforeEach
    void setUp() {
        recordStore = new AnswerRecordStore(new InMemoryKeyValueStoreAdapter(), AutoConfiguration.objectMapper());
        clock = mock(Clock.class);
        when(clock.instant()).thenReturn(T1);
        when(clock.getZone()).thenReturn(ZoneOffset.UTC);
        cache = new TieredCacheService(recordStore, CachePolicy.defaults(), clock);
    }

    @Test
    void shouldLoadNothingForUnknownQuery() {
        assertTrue(cache.load("unknown").isEmpty());
        assertEquals(0, recordStore.getUsageCount("unknown"));
    }

    @Test
    void shouldPreserveCreatedAcrossEdits() {
        cache.saveModelAnswer(QUERY, "model answer");
        when(clock.instant()).thenReturn(T2);

        CanonicalRecord edited = cache.saveEdit(QUERY, "human answer", "alice");

        assertEquals(T1, edited.getCreated());
        assertEquals(T2, edited.getTimestamp());
        CanonicalRecord stored = recordStore.findCanonical(QUERY).orElseThrow();
        assertEquals("human answer", stored.getAnswer());
        assertEquals("alice", stored.getLastEditedBy());
        assertTrue(stored.isEdited());
        assertEquals(T1, stored.getCreated());
    }

    @Test
    void shouldSetCreatedOnFirstEdit() {
        CanonicalRecord edited = cache.saveEdit(QUERY, "human answer", null);

        assertEquals(T1, edited.getCreated());
        assertEquals(CanonicalRecord.EDITOR_USER, edited.getLastEditedBy());
    }

    @Test
    void shouldMarkModelAnswersAsUnedited() {
        CanonicalRecord stored = cache.saveModelAnswer(QUERY, "model answer");

        assertFalse(stored.isEdited());
        assertEquals(CanonicalRecord.EDITOR_AI, stored.getLastEditedBy());
        assertEquals(1, recordStore.getUsageCount(QUERY));
    }

    @Test
    void shouldKeepHumanEditOverLaterModelAnswer() {
        cache.saveEdit(QUERY, "human answer", "user");

        CanonicalRecord result = cache.saveModelAnswer(QUERY, "model answer");

        assertEquals("human answer", result.getAnswer());
        assertEquals("human answer", cache.load(QUERY).orElseThrow());
        assertEquals(2, recordStore.getUsageCount(QUERY));
    }

    @Test
    void shouldNotPromoteAtThreshold() {
        for (int i = 0; i < 5; i++) {
            cache.saveEdit(QUERY, "answer", "user");
        }

        assertEquals(5, recordStore.getUsageCount(QUERY));
        assertTrue(cache.findPromotedAnswer(QUERY).isEmpty());
    }

    @Test
    void shouldPromoteWhenCountExceedsThreshold() {
        for (int i = 0; i < 6; i++) {
            cache.saveEdit(QUERY, "answer", "user");
        }

        assertEquals(6, recordStore.getUsageCount(QUERY));
        assertEquals("answer", cache.findPromotedAnswer(QUERY).orElseThrow());
    }

    @Test
    void shouldRefreshPromotedAnswerOnLaterEdit() {
        for (int i = 0; i < 6; i++) {
            cache.saveEdit(QUERY, "old", "user");
        }

        cache.saveEdit(QUERY, "new", "user");

        assertEquals("new", cache.findPromotedAnswer(QUERY).orElseThrow());
    }

    @Test
    void shouldCountCanonicalHits() {
        cache.saveModelAnswer(QUERY, "answer");

        long count = cache.recordCanonicalHit(QUERY, "answer");

        assertEquals(2, count);
    }

    @Test
    void shouldNotLoseIncrementsUnderConcurrency() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Long>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                futures.add(executor.submit(() -> cache.recordCanonicalHit(QUERY, "answer")));
            }
            for (Future<Long> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(40, recordStore.getUsageCount(QUERY));
    }
}
