package com.entity.aggregation.core.model;

import java.time.Instant;

/**
 * Inclusive time range; either end may be open ({@code null}).
 */
public record TimeWindow(Instant from, Instant to) {

    public static TimeWindow between(Instant from, Instant to) {
        return new TimeWindow(from, to);
    }

    public static TimeWindow since(Instant from) {
        return new TimeWindow(from, null);
    }

    public static TimeWindow until(Instant to) {
        return new TimeWindow(null, to);
    }

    public boolean contains(Instant instant) {
        if (instant == null) {
            return false;
        }
        if (from != null && instant.isBefore(from)) {
            return false;
        }
        return to == null || !instant.isAfter(to);
    }

    /**
     * A window whose start is after its end can never match anything.
     */
    public boolean isInverted() {
        return from != null && to != null && from.isAfter(to);
    }
}
