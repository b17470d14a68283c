package com.entity.aggregation.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records the stages one query passes through. Stages only move forward; an attempt to go
 * back or skip ahead is a programming error.
 *
 * <p>One thread advances the trace; other threads may read {@link #current()} at any time.</p>
 */
public final class QueryTrace {
    private static final Logger log = LoggerFactory.getLogger(QueryTrace.class);

    private final String queryId;
    private final Instant startedAt;
    private final List<QueryStage> stages = new CopyOnWriteArrayList<>();
    private volatile QueryStage current = QueryStage.RECEIVED;

    public QueryTrace(String queryId) {
        this.queryId = queryId;
        this.startedAt = Instant.now();
        this.stages.add(QueryStage.RECEIVED);
    }

    /**
     * @throws IllegalStateException if {@code next} does not follow the current stage
     */
    public void advance(QueryStage next) {
        QueryStage from = current;
        if (!from.canAdvanceTo(next)) {
            throw new IllegalStateException("Query " + queryId + " cannot move from " + from + " to " + next);
        }
        stages.add(next);
        current = next;
        log.trace("Query {} entered {}", queryId, next);
    }

    public QueryStage current() {
        return current;
    }

    public List<QueryStage> getStages() {
        return List.copyOf(stages);
    }

    public String getQueryId() {
        return queryId;
    }

    public Duration elapsed() {
        return Duration.between(startedAt, Instant.now());
    }
}
