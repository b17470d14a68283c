package com.entity.aggregation.view;

import com.entity.aggregation.aggregate.PartialAggregation;
import com.entity.aggregation.core.model.AggregatedEntity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable, versioned state of the aggregated view. Queries read one snapshot from start to
 * finish; later ingestion publishes a new snapshot and leaves this one untouched.
 *
 * @param version   increases by one with every published change, starting at 0
 * @param partial   exact-key groups, kept so later batches can be merged in
 * @param entities  finished entities after fuzzy consolidation
 * @param createdAt when the snapshot was published
 */
public record EntityViewSnapshot(
        long version,
        PartialAggregation partial,
        Set<AggregatedEntity> entities,
        Instant createdAt
) {
    public EntityViewSnapshot {
        partial = partial != null ? partial : PartialAggregation.empty();
        entities = entities != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(entities))
                : Set.of();
    }

    public static EntityViewSnapshot empty(Instant createdAt) {
        return new EntityViewSnapshot(0, PartialAggregation.empty(), Set.of(), createdAt);
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    public int size() {
        return entities.size();
    }
}
