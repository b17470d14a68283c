package com.entity.aggregation.core.model;

import java.util.Objects;

/**
 * A raw mention paired with the canonical key used for grouping.
 *
 * @param raw          the original mention
 * @param canonicalKey normalized grouping key
 * @param tableVersion version of the synonym table that produced the key
 */
public record NormalizedEntity(RawEntity raw, String canonicalKey, String tableVersion) {

    public NormalizedEntity {
        Objects.requireNonNull(raw, "raw is required");
        if (canonicalKey == null || canonicalKey.isEmpty()) {
            throw new IllegalArgumentException("canonicalKey must not be empty");
        }
    }

    public EntityCategory category() {
        return raw.category();
    }

    /**
     * The provenance entry this mention contributes to an aggregate.
     */
    public SourceEvidence toSourceEvidence() {
        return new SourceEvidence(raw.contentItemId(), raw.modality(), raw.confidence(),
                raw.context(), raw.contentTimestamp(), raw.engagement());
    }
}
