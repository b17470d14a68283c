package com.entity.aggregation.scoring;

import com.entity.aggregation.core.model.AggregatedEntity;

import java.util.Collection;

/**
 * Min-max bounds of mean engagement over a candidate set, used to scale engagement into [0, 1].
 *
 * @param min smallest mean engagement
 * @param max largest mean engagement
 */
public record EngagementRange(double min, double max) {

    public EngagementRange {
        if (max < min) {
            throw new IllegalArgumentException("max must be >= min");
        }
    }

    public static EngagementRange of(Collection<AggregatedEntity> candidates) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (AggregatedEntity candidate : candidates) {
            min = Math.min(min, candidate.getMeanEngagement());
            max = Math.max(max, candidate.getMeanEngagement());
        }
        return candidates.isEmpty() ? new EngagementRange(0, 0) : new EngagementRange(min, max);
    }

    /**
     * Scales a mean engagement into [0, 1]. A degenerate range scales everything to 0,
     * since engagement cannot tell the candidates apart.
     */
    public double scale(double meanEngagement) {
        if (max <= min) {
            return 0.0;
        }
        double scaled = (meanEngagement - min) / (max - min);
        return Math.max(0.0, Math.min(1.0, scaled));
    }
}
