package com.entity.aggregation.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies one provenance slot of an aggregate: a content item seen through one modality.
 */
public record SourceRef(String contentItemId, SourceModality modality) implements Comparable<SourceRef> {

    private static final Comparator<SourceRef> ORDER = Comparator
            .comparing(SourceRef::contentItemId)
            .thenComparing(SourceRef::modality);

    public SourceRef {
        Objects.requireNonNull(contentItemId, "contentItemId is required");
        Objects.requireNonNull(modality, "modality is required");
    }

    @Override
    public int compareTo(SourceRef other) {
        return ORDER.compare(this, other);
    }
}
