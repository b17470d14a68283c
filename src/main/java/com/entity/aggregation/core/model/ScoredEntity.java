package com.entity.aggregation.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * An aggregated entity together with its scores for the current query.
 */
public record ScoredEntity(AggregatedEntity entity, ScoreBreakdown scores) {

    /**
     * Ranking order: relevance descending, then canonical key ascending.
     */
    public static final Comparator<ScoredEntity> RANKING = Comparator
            .comparingDouble((ScoredEntity s) -> s.scores().relevance()).reversed()
            .thenComparing(s -> s.entity().getCanonicalKey());

    public ScoredEntity {
        Objects.requireNonNull(entity, "entity is required");
        Objects.requireNonNull(scores, "scores is required");
    }

    public double relevance() {
        return scores.relevance();
    }
}
