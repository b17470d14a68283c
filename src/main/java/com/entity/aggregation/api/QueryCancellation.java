package com.entity.aggregation.api;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one query. The engine checks it between stages.
 */
public final class QueryCancellation {

    private static final QueryCancellation NEVER = new QueryCancellation();

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * A token nobody can trip, for callers that never cancel.
     */
    public static QueryCancellation none() {
        return NEVER;
    }

    public static QueryCancellation create() {
        return new QueryCancellation();
    }

    public void cancel() {
        if (this != NEVER) {
            cancelled.set(true);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
