package com.entity.aggregation.aggregate;

import com.entity.aggregation.core.model.EntityCategory;

import java.util.Comparator;

/**
 * Exact grouping key of the aggregation step.
 */
public record GroupKey(String canonicalKey, EntityCategory category) implements Comparable<GroupKey> {

    private static final Comparator<GroupKey> ORDER = Comparator
            .comparing(GroupKey::category)
            .thenComparing(GroupKey::canonicalKey);

    @Override
    public int compareTo(GroupKey other) {
        return ORDER.compare(this, other);
    }
}
