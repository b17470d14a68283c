package com.entity.aggregation.core.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * One supporting source of an aggregated entity.
 * Two mentions with the same {@link SourceRef} collapse into one via {@link #strongest}.
 */
public record SourceEvidence(
        String contentItemId,
        SourceModality modality,
        double confidence,
        String snippet,
        Instant timestamp,
        EngagementMetrics engagement
) {
    /**
     * Order used when collapsing: higher confidence, then newer, then snippet text, then engagement.
     */
    static final Comparator<SourceEvidence> STRENGTH = Comparator
            .comparingDouble(SourceEvidence::confidence)
            .thenComparing(SourceEvidence::timestamp)
            .thenComparing(SourceEvidence::snippet, Comparator.reverseOrder())
            .thenComparingLong(e -> e.engagement().total())
            .thenComparingLong(e -> e.engagement().likes());

    public SourceEvidence {
        Objects.requireNonNull(contentItemId, "contentItemId is required");
        Objects.requireNonNull(modality, "modality is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
        snippet = snippet != null ? snippet : "";
        engagement = engagement != null ? engagement : EngagementMetrics.none();
    }

    public SourceRef ref() {
        return new SourceRef(contentItemId, modality);
    }

    /**
     * Picks the stronger of two evidences for the same source slot.
     */
    public static SourceEvidence strongest(SourceEvidence a, SourceEvidence b) {
        return STRENGTH.compare(a, b) >= 0 ? a : b;
    }
}
