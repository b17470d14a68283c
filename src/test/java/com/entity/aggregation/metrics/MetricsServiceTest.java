package com.entity.aggregation.metrics;

import com.entity.aggregation.core.model.SkipReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordQueryDuration("results", Duration.ofMillis(10));
                noOp.incrementSkippedEntity(SkipReason.MISSING_NAME);
                noOp.recordCandidateCount(4);
                noOp.incrementFallback();
                noOp.incrementInsufficientCount();
                noOp.recordIngestSize(12);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record query duration per outcome")
        void recordQueryDuration() {
            metrics.recordQueryDuration("results", Duration.ofMillis(15));
            metrics.recordQueryDuration("results", Duration.ofMillis(25));
            metrics.recordQueryDuration("suggestions", Duration.ofMillis(5));

            Timer results = registry.find("ranking.query.duration").tag("outcome", "results").timer();
            Timer suggestions = registry.find("ranking.query.duration").tag("outcome", "suggestions").timer();

            assertNotNull(results);
            assertEquals(2, results.count());
            assertEquals(40.0, results.totalTime(TimeUnit.MILLISECONDS), 0.001);
            assertNotNull(suggestions);
            assertEquals(1, suggestions.count());
        }

        @Test
        @DisplayName("Should count skipped entities per reason")
        void skippedPerReason() {
            metrics.incrementSkippedEntity(SkipReason.MISSING_NAME);
            metrics.incrementSkippedEntity(SkipReason.MISSING_NAME);
            metrics.incrementSkippedEntity(SkipReason.INVALID_CONFIDENCE);

            Counter missingName = registry.find("ranking.entity.skipped").tag("reason", "MISSING_NAME").counter();
            Counter invalid = registry.find("ranking.entity.skipped").tag("reason", "INVALID_CONFIDENCE").counter();

            assertEquals(2.0, missingName.count());
            assertEquals(1.0, invalid.count());
        }

        @Test
        @DisplayName("Should record candidate and ingest sizes as distributions")
        void distributions() {
            metrics.recordCandidateCount(3);
            metrics.recordCandidateCount(7);
            metrics.recordIngestSize(100);

            DistributionSummary candidates = registry.find("ranking.candidates").summary();
            DistributionSummary ingest = registry.find("ranking.ingest.size").summary();

            assertEquals(2, candidates.count());
            assertEquals(10.0, candidates.totalAmount());
            assertEquals(100.0, ingest.max());
        }

        @Test
        @DisplayName("Should count fallbacks and insufficient answers")
        void counters() {
            metrics.incrementFallback();
            metrics.incrementInsufficientCount();
            metrics.incrementInsufficientCount();

            assertEquals(1.0, registry.find("ranking.fallback").counter().count());
            assertEquals(2.0, registry.find("ranking.insufficient.count").counter().count());
        }
    }
}
