package com.entity.aggregation.core.model;

/**
 * Engagement counters captured for a saved post at ingestion time.
 *
 * @param likes    number of likes
 * @param comments number of comments
 * @param shares   number of shares
 * @param views    number of views, or {@code null} for non-video content
 */
public record EngagementMetrics(long likes, long comments, long shares, Long views) {

    public EngagementMetrics {
        if (likes < 0 || comments < 0 || shares < 0 || (views != null && views < 0)) {
            throw new IllegalArgumentException("Engagement counters must be non-negative");
        }
    }

    public static EngagementMetrics none() {
        return new EngagementMetrics(0, 0, 0, null);
    }

    public static EngagementMetrics of(long likes, long comments, long shares) {
        return new EngagementMetrics(likes, comments, shares, null);
    }

    /**
     * Scalar engagement used for ranking. Views are excluded since only videos carry them.
     */
    public long total() {
        return likes + comments + shares;
    }
}
