package com.entity.aggregation.aggregate;

import com.entity.aggregation.core.model.AggregatedEntity;
import com.entity.aggregation.core.model.NormalizedEntity;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Exact-key aggregation of some set of mentions, before fuzzy consolidation.
 *
 * <p>{@link #merge} is associative and commutative, so partials built over disjoint shards
 * can be combined in any order and grouping. Instances are immutable.</p>
 */
public final class PartialAggregation {

    private static final PartialAggregation EMPTY = new PartialAggregation(new TreeMap<>());

    private final SortedMap<GroupKey, AggregatedEntity> groups;

    private PartialAggregation(SortedMap<GroupKey, AggregatedEntity> groups) {
        this.groups = Collections.unmodifiableSortedMap(groups);
    }

    public static PartialAggregation empty() {
        return EMPTY;
    }

    /**
     * Groups mentions by canonical key and category.
     */
    public static PartialAggregation of(Collection<NormalizedEntity> entities) {
        SortedMap<GroupKey, AggregatedEntity> groups = new TreeMap<>();
        for (NormalizedEntity entity : entities) {
            groups.merge(new GroupKey(entity.canonicalKey(), entity.category()),
                    AggregatedEntity.of(entity), AggregatedEntity::merge);
        }
        return new PartialAggregation(groups);
    }

    public PartialAggregation merge(PartialAggregation other) {
        if (other.groups.isEmpty()) {
            return this;
        }
        if (groups.isEmpty()) {
            return other;
        }
        SortedMap<GroupKey, AggregatedEntity> merged = new TreeMap<>(groups);
        other.groups.forEach((key, entity) -> merged.merge(key, entity, AggregatedEntity::merge));
        return new PartialAggregation(merged);
    }

    public Map<GroupKey, AggregatedEntity> getGroups() {
        return groups;
    }

    public int size() {
        return groups.size();
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return groups.equals(((PartialAggregation) o).groups);
    }

    @Override
    public int hashCode() {
        return groups.hashCode();
    }

    @Override
    public String toString() {
        return "PartialAggregation{groups=" + groups.size() + '}';
    }
}
