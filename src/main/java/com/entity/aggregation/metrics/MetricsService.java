package com.entity.aggregation.metrics;

import com.entity.aggregation.core.model.SkipReason;

import java.time.Duration;

/**
 * Records ranking engine metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works without a metrics
 * backend on the classpath.
 */
public interface MetricsService {

    void recordQueryDuration(String outcome, Duration duration);

    void incrementSkippedEntity(SkipReason reason);

    void recordCandidateCount(int count);

    void incrementFallback();

    void incrementInsufficientCount();

    void recordIngestSize(int size);
}
