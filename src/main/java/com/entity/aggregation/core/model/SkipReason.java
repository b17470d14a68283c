package com.entity.aggregation.core.model;

/**
 * Why an upstream mention was rejected before aggregation.
 */
public enum SkipReason {
    MISSING_NAME,
    MISSING_CATEGORY,
    MISSING_CONTENT_ITEM,
    MISSING_TIMESTAMP,
    MISSING_MODALITY,
    INVALID_CONFIDENCE,
    EMPTY_CANONICAL_KEY
}
