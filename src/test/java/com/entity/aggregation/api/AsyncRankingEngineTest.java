package com.entity.aggregation.api;

import com.entity.aggregation.core.model.EntityCategory;
import com.entity.aggregation.core.model.QueryConstraints;
import com.entity.aggregation.core.model.QueryIntent;
import com.entity.aggregation.metrics.NoOpMetricsService;
import com.entity.aggregation.rules.SynonymTable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.entity.aggregation.testing.EntityFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AsyncRankingEngine Tests")
class AsyncRankingEngineTest {

    private BlockingMetrics metrics;
    private EntityRankingEngine engine;

    /**
     * Holds a query inside its FILTERED stage until released.
     */
    static class BlockingMetrics extends NoOpMetricsService {
        final AtomicBoolean blocking = new AtomicBoolean();
        final CountDownLatch release = new CountDownLatch(1);

        @Override
        public void recordCandidateCount(int count) {
            if (!blocking.get()) {
                return;
            }
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @BeforeEach
    void setUp() {
        metrics = new BlockingMetrics();
        engine = EntityRankingEngine.builder()
                .metrics(metrics)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .synonymTable(SynonymTable.empty())
                .build();
        engine.ingest(List.of(
                raw("Blue Bottle", EntityCategory.LOCATION, 0.8, "post-1", daysAgo(4)),
                raw("Oat Latte", EntityCategory.PRODUCT, 0.7, "post-1", daysAgo(4))));
    }

    @AfterEach
    void tearDown() {
        metrics.release.countDown();
        engine.close();
    }

    private static QueryIntent byCategory(EntityCategory category) {
        return QueryIntent.of("", QueryConstraints.builder().category(category).build());
    }

    @Test
    @DisplayName("Answers asynchronously with the same outcome as a direct call")
    void answersAsync() throws Exception {
        try (AsyncRankingEngine async = new AsyncRankingEngine(engine)) {
            QueryOutcome outcome = async.answerAsync(byCategory(EntityCategory.LOCATION)).get(5, TimeUnit.SECONDS);

            assertTrue(outcome.hasResults());
            assertEquals("blue bottle", outcome.getResults().get(0).entity().getCanonicalKey());
            assertEquals(30_000, async.getTimeoutMs());
        }
    }

    @Test
    @DisplayName("Batch outcomes come back in request order")
    void batchOrder() throws Exception {
        try (AsyncRankingEngine async = new AsyncRankingEngine(engine, 3, 5_000)) {
            List<QueryOutcome> outcomes = async.answerAllAsync(List.of(
                    byCategory(EntityCategory.LOCATION),
                    byCategory(EntityCategory.PERSON),
                    byCategory(EntityCategory.PRODUCT))).get(5, TimeUnit.SECONDS);

            assertEquals(List.of(QueryOutcome.Kind.RESULTS, QueryOutcome.Kind.SUGGESTIONS, QueryOutcome.Kind.RESULTS),
                    outcomes.stream().map(QueryOutcome::getKind).toList());
            assertEquals("oat latte", outcomes.get(2).getResults().get(0).entity().getCanonicalKey());
        }
    }

    @Test
    @DisplayName("A query past its timeout is cancelled at the stage it reached")
    void timeoutCancels() throws Exception {
        // warm-up run, not blocked
        engine.answer(byCategory(EntityCategory.LOCATION));
        metrics.blocking.set(true);

        try (AsyncRankingEngine async = new AsyncRankingEngine(engine, 1, 200)) {
            QueryOutcome outcome = async.answerAsync(byCategory(EntityCategory.LOCATION)).get(5, TimeUnit.SECONDS);

            assertTrue(outcome.isCancelled());
            assertEquals(QueryStage.FILTERED, outcome.getStage());
            assertTrue(outcome.getResults().isEmpty());
            metrics.release.countDown();
        }
    }

    @Test
    @DisplayName("Rejects non-positive pool size and timeout")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> new AsyncRankingEngine(engine, 0, 100));
        assertThrows(IllegalArgumentException.class, () -> new AsyncRankingEngine(engine, 1, 0));
    }
}
