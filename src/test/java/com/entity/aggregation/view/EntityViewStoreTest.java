package com.entity.aggregation.view;

import com.entity.aggregation.aggregate.EntityAggregator;
import com.entity.aggregation.core.model.AggregatedEntity;
import com.entity.aggregation.core.model.EntityCategory;
import com.entity.aggregation.core.model.RawEntity;
import com.entity.aggregation.core.model.SkipReason;
import com.entity.aggregation.ingest.ContentAnalysis;
import com.entity.aggregation.ingest.ContentAnalysisFlattener;
import com.entity.aggregation.ingest.HashtagEntityExtractor;
import com.entity.aggregation.metrics.MetricsService;
import com.entity.aggregation.rules.DefaultNormalizationRules;
import com.entity.aggregation.rules.EntityNormalizer;
import com.entity.aggregation.rules.SynonymTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.entity.aggregation.testing.EntityFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;

@DisplayName("EntityViewStore Tests")
class EntityViewStoreTest {

    private EntityViewStore store;
    private MetricsService metrics;

    @BeforeEach
    void setUp() {
        EntityNormalizer normalizer = new EntityNormalizer(
                DefaultNormalizationRules.createDefaultEngine(), SynonymTable.empty());
        metrics = Mockito.mock(MetricsService.class);
        store = new EntityViewStore(normalizer, new EntityAggregator(), null,
                new ContentAnalysisFlattener(new HashtagEntityExtractor()), metrics,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static List<RawEntity> firstBatch() {
        return List.of(
                raw("Blue Bottle", EntityCategory.LOCATION, 0.8, "post-1", daysAgo(4)),
                raw("Blue Bottle", EntityCategory.LOCATION, 0.6, "post-2", daysAgo(2)),
                raw("Oat Latte", EntityCategory.PRODUCT, 0.7, "post-2", daysAgo(2)));
    }

    private static Set<String> keys(EntityViewSnapshot snapshot) {
        return snapshot.entities().stream()
                .map(AggregatedEntity::getCanonicalKey)
                .collect(Collectors.toSet());
    }

    @Test
    @DisplayName("Starts empty at version 0")
    void startsEmpty() {
        EntityViewSnapshot snapshot = store.snapshot();

        assertEquals(0, snapshot.version());
        assertTrue(snapshot.isEmpty());
        assertEquals(NOW, snapshot.createdAt());
    }

    @Test
    @DisplayName("Each ingest publishes the next version")
    void versionIncrements() {
        IngestResult first = store.ingest(firstBatch());
        IngestResult second = store.ingest(List.of(
                raw("Kinfolk", EntityCategory.PRODUCT, 0.9, "post-3", daysAgo(1))));

        assertEquals(1, first.snapshot().version());
        assertEquals(2, second.snapshot().version());
        assertEquals(3, second.snapshot().size());
        assertSame(second.snapshot(), store.snapshot());
        verify(metrics).recordIngestSize(3);
        verify(metrics).recordIngestSize(1);
    }

    @Test
    @DisplayName("A snapshot held by a reader does not change")
    void snapshotIsolation() {
        store.ingest(firstBatch());
        EntityViewSnapshot held = store.snapshot();

        store.ingest(List.of(raw("Kinfolk", EntityCategory.PRODUCT, 0.9, "post-3", daysAgo(1))));

        assertEquals(2, held.size());
        assertEquals(1, held.version());
        assertThrows(UnsupportedOperationException.class, () -> held.entities().clear());
    }

    @Test
    @DisplayName("Ingesting the same batch twice leaves the entities unchanged")
    void reingestIdempotent() {
        Set<AggregatedEntity> once = store.ingest(firstBatch()).snapshot().entities();
        Set<AggregatedEntity> twice = store.ingest(firstBatch()).snapshot().entities();

        assertEquals(once, twice);
        AggregatedEntity bottle = twice.stream()
                .filter(e -> e.getCategory() == EntityCategory.LOCATION)
                .findFirst()
                .orElseThrow();
        assertEquals(2, bottle.getMentionCount());
    }

    @Test
    @DisplayName("Rebuild replaces the whole view")
    void rebuildReplaces() {
        store.ingest(firstBatch());

        IngestResult rebuilt = store.rebuild(List.of(
                raw("Kinfolk", EntityCategory.PRODUCT, 0.9, "post-3", daysAgo(1))));

        assertEquals(2, rebuilt.snapshot().version());
        assertEquals(1, rebuilt.snapshot().size());
        assertEquals(Set.of("kinfolk"), keys(rebuilt.snapshot()));
    }

    @Test
    @DisplayName("Malformed mentions are counted and left out")
    void skippedCounted() {
        List<RawEntity> batch = new ArrayList<>(firstBatch());
        batch.add(raw(" ", EntityCategory.PRODUCT, 0.5, "post-9", daysAgo(1)));
        batch.add(raw("Ghost", EntityCategory.PRODUCT, 0.5, "post-9", null));
        batch.add(new RawEntity("Blue Bottle", EntityCategory.LOCATION, 0.9, null, "", "post-9", daysAgo(1), null));

        IngestResult result = assertDoesNotThrow(() -> store.ingest(batch));

        assertEquals(6, result.totalMentions());
        assertEquals(3, result.normalizedCount());
        assertTrue(result.hasSkipped());
        assertEquals(List.of(SkipReason.MISSING_NAME, SkipReason.MISSING_TIMESTAMP, SkipReason.MISSING_MODALITY),
                result.skipped().stream().map(s -> s.reason()).toList());
        assertEquals(2, result.snapshot().size());
    }

    @Test
    @DisplayName("Listeners see the previous and current snapshots; failures are contained")
    void listeners() {
        List<Long> seen = new ArrayList<>();
        store.addListener((previous, current) -> {
            throw new IllegalStateException("listener broke");
        });
        ViewChangeListener recording = (previous, current) -> {
            seen.add(previous.version());
            seen.add(current.version());
        };
        store.addListener(recording);

        assertDoesNotThrow(() -> store.ingest(firstBatch()));
        store.removeListener(recording);
        store.ingest(firstBatch());

        assertEquals(List.of(0L, 1L), seen);
    }

    @Test
    @DisplayName("Post analyses without entities are ingested through their hashtags")
    void ingestAnalyses() {
        IngestResult result = store.ingestAnalyses(List.of(
                new ContentAnalysis("post-5", daysAgo(1), null, "Weekend reset #minimalism", List.of(), List.of())));

        assertEquals(1, result.normalizedCount());
        assertEquals(Set.of("minimalism"), keys(result.snapshot()));
    }
}
