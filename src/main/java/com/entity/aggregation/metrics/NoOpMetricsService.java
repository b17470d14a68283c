package com.entity.aggregation.metrics;

import com.entity.aggregation.core.model.SkipReason;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordQueryDuration(String outcome, Duration duration) {
    }

    @Override
    public void incrementSkippedEntity(SkipReason reason) {
    }

    @Override
    public void recordCandidateCount(int count) {
    }

    @Override
    public void incrementFallback() {
    }

    @Override
    public void incrementInsufficientCount() {
    }

    @Override
    public void recordIngestSize(int size) {
    }
}
