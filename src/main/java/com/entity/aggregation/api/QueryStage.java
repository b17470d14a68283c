package com.entity.aggregation.api;

/**
 * Stages a query passes through, in order. A query ends in {@link #DONE} after either
 * {@link #ASSEMBLED} (results) or {@link #SUGGESTED} (fallback suggestions).
 */
public enum QueryStage {
    RECEIVED,
    NORMALIZED,
    AGGREGATED,
    SCORED,
    FILTERED,
    ASSEMBLED,
    SUGGESTED,
    DONE;

    /**
     * Whether a query in this stage may move to {@code next}.
     */
    public boolean canAdvanceTo(QueryStage next) {
        switch (this) {
            case FILTERED:
                return next == ASSEMBLED || next == SUGGESTED;
            case ASSEMBLED:
            case SUGGESTED:
                return next == DONE;
            case DONE:
                return false;
            default:
                // Any stage may bail out straight to suggestions
                return next == values()[ordinal() + 1] || next == SUGGESTED;
        }
    }
}
