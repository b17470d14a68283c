package com.entity.aggregation.scoring;

/**
 * Weights of the relevance formula
 * {@code relevance = frequency*f + recency*r + engagement*e + confidence*c}.
 * Weights are non-negative and sum to 1.
 */
public record ScoringWeights(
        double frequencyWeight,
        double recencyWeight,
        double engagementWeight,
        double confidenceWeight
) {
    public ScoringWeights {
        if (frequencyWeight < 0 || recencyWeight < 0 || engagementWeight < 0 || confidenceWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = frequencyWeight + recencyWeight + engagementWeight + confidenceWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * 0.3 frequency, 0.3 recency, 0.2 engagement, 0.2 confidence.
     */
    public static ScoringWeights defaultWeights() {
        return new ScoringWeights(0.3, 0.3, 0.2, 0.2);
    }

    /**
     * Favors what was saved lately, for "what have I been into recently" questions.
     */
    public static ScoringWeights recencyFocused() {
        return new ScoringWeights(0.2, 0.5, 0.1, 0.2);
    }

    /**
     * Favors what was saved often, for "what do I keep saving" questions.
     */
    public static ScoringWeights frequencyFocused() {
        return new ScoringWeights(0.5, 0.2, 0.1, 0.2);
    }
}
