package com.entity.aggregation.api;

import com.entity.aggregation.core.model.QueryIntent;
import com.entity.aggregation.logging.LogContext;
import com.entity.aggregation.view.EntityViewSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs queries on a fixed thread pool with a per-query timeout.
 *
 * <p>Each query gets its own {@link QueryCancellation}. When the timeout fires, the token is
 * tripped so the pipeline stops at its next stage boundary, and the returned future completes
 * with a cancelled outcome naming the last stage the query reached.</p>
 */
public class AsyncRankingEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AsyncRankingEngine.class);

    private final EntityRankingEngine engine;
    private final ExecutorService executor;
    private final long timeoutMs;

    public AsyncRankingEngine(EntityRankingEngine engine) {
        this(engine, engine.getOptions().getQueryThreads(), engine.getOptions().getQueryTimeoutMs());
    }

    public AsyncRankingEngine(EntityRankingEngine engine, int threads, long timeoutMs) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be > 0");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        this.engine = engine;
        this.executor = Executors.newFixedThreadPool(threads);
        this.timeoutMs = timeoutMs;
    }

    /**
     * Answers against the snapshot current at submission time.
     */
    public CompletableFuture<QueryOutcome> answerAsync(QueryIntent intent) {
        return answerAsync(intent, engine.snapshot(), engine.getClock().instant());
    }

    public CompletableFuture<QueryOutcome> answerAsync(QueryIntent intent, EntityViewSnapshot snapshot, Instant now) {
        QueryCancellation cancellation = QueryCancellation.create();
        QueryTrace trace = new QueryTrace(LogContext.newId());
        return CompletableFuture
                .supplyAsync(() -> engine.answer(intent, snapshot, now, cancellation, trace), executor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(error -> {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause() : error;
                    cancellation.cancel();
                    if (cause instanceof TimeoutException) {
                        log.warn("Query {} timed out after {}ms at stage {}",
                                trace.getQueryId(), timeoutMs, trace.current());
                    } else {
                        log.error("Query {} could not be run", trace.getQueryId(), cause);
                    }
                    return QueryOutcome.cancelled(trace.current());
                });
    }

    /**
     * Answers several questions concurrently; the outcomes are in request order.
     */
    public CompletableFuture<List<QueryOutcome>> answerAllAsync(List<QueryIntent> intents) {
        EntityViewSnapshot snapshot = engine.snapshot();
        Instant now = engine.getClock().instant();
        List<CompletableFuture<QueryOutcome>> futures = intents.stream()
                .map(intent -> answerAsync(intent, snapshot, now))
                .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
