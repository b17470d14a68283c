package com.entity.aggregation.core.model;

/**
 * The part of a saved post an entity was extracted from.
 */
public enum SourceModality {
    CAPTION,
    HASHTAG,
    VISION,
    AUDIO
}
