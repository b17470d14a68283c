package com.entity.aggregation.view;

import com.entity.aggregation.aggregate.EntityAggregator;
import com.entity.aggregation.aggregate.PartialAggregation;
import com.entity.aggregation.core.model.AggregatedEntity;
import com.entity.aggregation.core.model.NormalizedEntity;
import com.entity.aggregation.core.model.RawEntity;
import com.entity.aggregation.ingest.ContentAnalysis;
import com.entity.aggregation.ingest.ContentAnalysisFlattener;
import com.entity.aggregation.logging.LogContext;
import com.entity.aggregation.metrics.MetricsService;
import com.entity.aggregation.metrics.NoOpMetricsService;
import com.entity.aggregation.rules.EntityNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Holds the current aggregated view and publishes a new snapshot for every change.
 *
 * <p>Writers build the next snapshot from the current one and swap it in atomically. Readers
 * call {@link #snapshot()} once and work on that snapshot; a concurrent ingest never changes
 * what they see. Ingesting the same batch twice leaves the entity set unchanged, since merging
 * is idempotent.</p>
 */
public class EntityViewStore {
    private static final Logger log = LoggerFactory.getLogger(EntityViewStore.class);

    private final EntityNormalizer normalizer;
    private final EntityAggregator aggregator;
    private final Function<Collection<NormalizedEntity>, PartialAggregation> grouper;
    private final ContentAnalysisFlattener flattener;
    private final MetricsService metrics;
    private final Clock clock;
    private final AtomicReference<EntityViewSnapshot> current;
    private final List<ViewChangeListener> listeners = new CopyOnWriteArrayList<>();

    public EntityViewStore(EntityNormalizer normalizer, EntityAggregator aggregator) {
        this(normalizer, aggregator, null, new ContentAnalysisFlattener(), new NoOpMetricsService(),
                Clock.systemUTC());
    }

    /**
     * @param grouper groups normalized mentions into a partial, for example
     *                {@code ShardedAggregator::group}; {@code null} groups on the calling thread
     */
    public EntityViewStore(EntityNormalizer normalizer, EntityAggregator aggregator,
                           Function<Collection<NormalizedEntity>, PartialAggregation> grouper,
                           ContentAnalysisFlattener flattener, MetricsService metrics, Clock clock) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator is required");
        this.flattener = Objects.requireNonNull(flattener, "flattener is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.grouper = grouper != null ? grouper : aggregator::group;
        this.current = new AtomicReference<>(EntityViewSnapshot.empty(clock.instant()));
    }

    public EntityViewSnapshot snapshot() {
        return current.get();
    }

    /**
     * Merges a batch of mentions into the view.
     */
    public IngestResult ingest(Collection<RawEntity> raws) {
        return apply(raws, false);
    }

    /**
     * Flattens post analyses into mentions and merges them into the view.
     */
    public IngestResult ingestAnalyses(Collection<ContentAnalysis> analyses) {
        return ingest(flattener.flatten(analyses));
    }

    /**
     * Replaces the whole view with one built from {@code raws}.
     */
    public IngestResult rebuild(Collection<RawEntity> raws) {
        return apply(raws, true);
    }

    public void addListener(ViewChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(ViewChangeListener listener) {
        listeners.remove(listener);
    }

    private IngestResult apply(Collection<RawEntity> raws, boolean replace) {
        try (LogContext ignored = LogContext.forIngest(LogContext.newId(), raws.size())) {
            metrics.recordIngestSize(raws.size());

            EntityNormalizer.Batch batch = normalizer.normalizeAll(raws);
            PartialAggregation incoming = grouper.apply(batch.normalized());

            EntityViewSnapshot previous;
            EntityViewSnapshot next;
            do {
                previous = current.get();
                PartialAggregation partial = replace ? incoming : previous.partial().merge(incoming);
                Set<AggregatedEntity> entities = aggregator.finish(partial);
                next = new EntityViewSnapshot(previous.version() + 1, partial, entities, clock.instant());
            } while (!current.compareAndSet(previous, next));

            log.info("Published view version={} entities={} (mentions={}, skipped={}, replace={})",
                    next.version(), next.size(), raws.size(), batch.skipped().size(), replace);
            notifyListeners(previous, next);
            return new IngestResult(next, raws.size(), batch.normalized().size(), batch.skipped());
        }
    }

    private void notifyListeners(EntityViewSnapshot previous, EntityViewSnapshot next) {
        for (ViewChangeListener listener : listeners) {
            try {
                listener.onViewChanged(previous, next);
            } catch (RuntimeException e) {
                log.warn("View change listener {} failed for version {}", listener, next.version(), e);
            }
        }
    }
}
