package com.entity.aggregation.similarity;

/**
 * Settings for fuzzy consolidation of canonical keys.
 *
 * @param enabled       whether keys are fuzzy-matched at all
 * @param threshold     minimum similarity for two keys to name the same entity
 * @param minKeyLength  keys shorter than this only ever match exactly
 */
public record FuzzyMatchOptions(boolean enabled, double threshold, int minKeyLength) {

    public FuzzyMatchOptions {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        if (minKeyLength < 1) {
            throw new IllegalArgumentException("minKeyLength must be >= 1");
        }
    }

    /**
     * Enabled, threshold 0.92, keys of at least 4 characters.
     */
    public static FuzzyMatchOptions defaults() {
        return new FuzzyMatchOptions(true, 0.92, 4);
    }

    public static FuzzyMatchOptions disabled() {
        return new FuzzyMatchOptions(false, 1.0, 1);
    }
}
