package com.entity.aggregation.core.model;

import java.util.Objects;

/**
 * One answer to a query. Built fresh for every query and never stored.
 *
 * @param rank     1-based position in the answer
 * @param entity   the aggregated entity
 * @param scores   score components
 * @param evidence supporting evidence
 */
public record RankedResult(int rank, AggregatedEntity entity, ScoreBreakdown scores, EvidenceBlock evidence) {

    public RankedResult {
        if (rank < 1) {
            throw new IllegalArgumentException("rank must be >= 1");
        }
        Objects.requireNonNull(entity, "entity is required");
        Objects.requireNonNull(scores, "scores is required");
        Objects.requireNonNull(evidence, "evidence is required");
    }

    public double relevanceScore() {
        return scores.relevance();
    }

    public double recencyScore() {
        return scores.recency();
    }

    public double confidenceScore() {
        return scores.confidence();
    }
}
