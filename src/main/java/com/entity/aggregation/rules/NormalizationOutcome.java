package com.entity.aggregation.rules;

import com.entity.aggregation.core.model.NormalizedEntity;
import com.entity.aggregation.core.model.SkippedEntity;

import java.util.Optional;

/**
 * Result of normalizing one raw mention: either a {@link NormalizedEntity} or a {@link SkippedEntity}.
 */
public final class NormalizationOutcome {

    private final NormalizedEntity normalized;
    private final SkippedEntity skipped;

    private NormalizationOutcome(NormalizedEntity normalized, SkippedEntity skipped) {
        this.normalized = normalized;
        this.skipped = skipped;
    }

    public static NormalizationOutcome normalized(NormalizedEntity entity) {
        return new NormalizationOutcome(entity, null);
    }

    public static NormalizationOutcome skipped(SkippedEntity entity) {
        return new NormalizationOutcome(null, entity);
    }

    public boolean isSkipped() {
        return skipped != null;
    }

    public Optional<NormalizedEntity> getNormalized() {
        return Optional.ofNullable(normalized);
    }

    public Optional<SkippedEntity> getSkipped() {
        return Optional.ofNullable(skipped);
    }
}
