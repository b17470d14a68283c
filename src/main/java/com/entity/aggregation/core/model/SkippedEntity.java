package com.entity.aggregation.core.model;

import java.util.Objects;

/**
 * A malformed mention that was left out of aggregation. Counted and logged, never fatal.
 *
 * @param raw    the rejected mention
 * @param reason why it was rejected
 */
public record SkippedEntity(RawEntity raw, SkipReason reason) {

    public SkippedEntity {
        Objects.requireNonNull(raw, "raw is required");
        Objects.requireNonNull(reason, "reason is required");
    }
}
