package com.entity.aggregation.scoring;

import com.entity.aggregation.core.model.AggregatedEntity;
import com.entity.aggregation.core.model.ScoreBreakdown;
import com.entity.aggregation.core.model.ScoredEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Scores aggregated entities for ranking.
 *
 * <pre>
 * frequency  = ln(1 + mentionCount)
 * recency    = exp(-lambda * (now - latestTimestamp))
 * engagement = min-max scaled mean engagement over the candidate set
 * relevance  = w1*frequency + w2*recency + w3*engagement + w4*aggregatedConfidence
 * </pre>
 *
 * Every component is non-decreasing in its input and every weight is non-negative, so
 * relevance never drops when mentions, recency, engagement or confidence go up.
 * Weights and decay are fixed at construction; a scorer holds no per-query state.
 */
public class RelevanceScorer {
    private static final Logger log = LoggerFactory.getLogger(RelevanceScorer.class);

    private final ScoringWeights weights;
    private final RecencyDecay decay;

    public RelevanceScorer() {
        this(ScoringWeights.defaultWeights(), RecencyDecay.defaultDecay());
    }

    public RelevanceScorer(ScoringWeights weights, RecencyDecay decay) {
        this.weights = weights;
        this.decay = decay;
    }

    /**
     * Scores every candidate, with engagement scaled over the candidates themselves.
     */
    public List<ScoredEntity> scoreAll(Collection<AggregatedEntity> candidates, Instant now) {
        EngagementRange range = EngagementRange.of(candidates);
        List<ScoredEntity> scored = new ArrayList<>(candidates.size());
        for (AggregatedEntity candidate : candidates) {
            scored.add(new ScoredEntity(candidate, score(candidate, now, range)));
        }
        log.debug("Scored {} candidates, engagement range [{}, {}]", scored.size(), range.min(), range.max());
        return scored;
    }

    public ScoreBreakdown score(AggregatedEntity entity, Instant now, EngagementRange range) {
        double frequency = frequencyScore(entity.getMentionCount());
        double recency = decay.score(entity.getLatestTimestamp(), now);
        double engagement = range.scale(entity.getMeanEngagement());
        double confidence = entity.getAggregatedConfidence();
        return new ScoreBreakdown(
                combine(frequency, recency, engagement, confidence),
                frequency, recency, engagement, confidence);
    }

    /**
     * The weighted sum. Exposed so callers can probe the formula component by component.
     */
    public double combine(double frequency, double recency, double engagement, double confidence) {
        return weights.frequencyWeight() * frequency
                + weights.recencyWeight() * recency
                + weights.engagementWeight() * engagement
                + weights.confidenceWeight() * confidence;
    }

    public static double frequencyScore(int mentionCount) {
        return Math.log1p(Math.max(0, mentionCount));
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    public RecencyDecay getDecay() {
        return decay;
    }
}
