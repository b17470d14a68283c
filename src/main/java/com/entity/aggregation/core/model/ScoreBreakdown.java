package com.entity.aggregation.core.model;

/**
 * Per-component scores of one aggregated entity for one query.
 *
 * @param relevance  weighted combination used for ranking
 * @param frequency  {@code ln(1 + mentionCount)}
 * @param recency    exponential decay of the most recent mention, in (0, 1]
 * @param engagement min-max scaled engagement over the candidate set, in [0, 1]
 * @param confidence aggregated confidence, in [0, 1]
 */
public record ScoreBreakdown(
        double relevance,
        double frequency,
        double recency,
        double engagement,
        double confidence
) {
    @Override
    public String toString() {
        return String.format(
                "ScoreBreakdown{relevance=%.4f, frequency=%.4f, recency=%.4f, engagement=%.4f, confidence=%.4f}",
                relevance, frequency, recency, engagement, confidence);
    }
}
