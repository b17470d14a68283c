package com.entity.aggregation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries for query and ingest logging. Entries added through a context
 * are removed again when it is closed.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forQuery(queryId, "RECOMMENDATION")) {
 *     log.info("query.answered results={}", results.size());
 * }
 * </pre>
 */
public final class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forQuery(String queryId, String intentType) {
        LogContext ctx = new LogContext();
        ctx.put("queryId", queryId);
        ctx.put("intentType", intentType);
        ctx.put("operation", "query");
        return ctx;
    }

    public static LogContext forIngest(String batchId, int size) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("batchSize", Integer.toString(size));
        ctx.put("operation", "ingest");
        return ctx;
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
