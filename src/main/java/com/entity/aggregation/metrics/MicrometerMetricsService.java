package com.entity.aggregation.metrics;

import com.entity.aggregation.core.model.SkipReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code ranking.query.duration}: Timer (tag: outcome)</li>
 *   <li>{@code ranking.entity.skipped}: Counter (tag: reason)</li>
 *   <li>{@code ranking.candidates}: DistributionSummary</li>
 *   <li>{@code ranking.fallback}: Counter</li>
 *   <li>{@code ranking.insufficient.count}: Counter</li>
 *   <li>{@code ranking.ingest.size}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<SkipReason, Counter> skippedCounters = new ConcurrentHashMap<>();
    private final DistributionSummary candidateSummary;
    private final DistributionSummary ingestSummary;
    private final Counter fallbackCounter;
    private final Counter insufficientCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.candidateSummary = DistributionSummary.builder("ranking.candidates")
                .description("Number of candidates left after filtering")
                .register(registry);
        this.ingestSummary = DistributionSummary.builder("ranking.ingest.size")
                .description("Number of raw entities per ingestion")
                .register(registry);
        this.fallbackCounter = Counter.builder("ranking.fallback")
                .description("Queries answered with suggestions instead of results")
                .register(registry);
        this.insufficientCounter = Counter.builder("ranking.insufficient.count")
                .description("Queries that found fewer results than requested")
                .register(registry);
    }

    @Override
    public void recordQueryDuration(String outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(outcome, k ->
                Timer.builder("ranking.query.duration")
                        .description("Duration of ranking queries")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementSkippedEntity(SkipReason reason) {
        Counter counter = skippedCounters.computeIfAbsent(reason, r ->
                Counter.builder("ranking.entity.skipped")
                        .description("Malformed entities left out of aggregation")
                        .tag("reason", r.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordCandidateCount(int count) {
        candidateSummary.record(count);
    }

    @Override
    public void incrementFallback() {
        fallbackCounter.increment();
    }

    @Override
    public void incrementInsufficientCount() {
        insufficientCounter.increment();
    }

    @Override
    public void recordIngestSize(int size) {
        ingestSummary.record(size);
    }
}
