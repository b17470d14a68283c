package com.entity.aggregation.scoring;

import java.time.Duration;
import java.time.Instant;

/**
 * Exponential decay {@code exp(-lambda * age)} with {@code lambda = ln 2 / halfLife}.
 * Age is measured in days; timestamps in the future count as age zero.
 */
public class RecencyDecay {

    private static final double SECONDS_PER_DAY = 86_400.0;

    private final double halfLifeDays;
    private final double lambda;

    public RecencyDecay(double halfLifeDays) {
        if (!(halfLifeDays > 0.0) || Double.isInfinite(halfLifeDays)) {
            throw new IllegalArgumentException("halfLifeDays must be a positive finite number");
        }
        this.halfLifeDays = halfLifeDays;
        this.lambda = Math.log(2) / halfLifeDays;
    }

    /**
     * 30-day half-life.
     */
    public static RecencyDecay defaultDecay() {
        return new RecencyDecay(30.0);
    }

    public double score(Instant latest, Instant now) {
        double ageDays = Duration.between(latest, now).getSeconds() / SECONDS_PER_DAY;
        if (ageDays < 0) {
            ageDays = 0;
        }
        return Math.exp(-lambda * ageDays);
    }

    public double getHalfLifeDays() {
        return halfLifeDays;
    }

    public double getLambda() {
        return lambda;
    }
}
