package com.entity.aggregation.core.model;

import java.time.Instant;

/**
 * Secondary reference to one supporting post.
 *
 * @param contentItemId   supporting post
 * @param timestamp       publication time of the post
 * @param bestConfidence  highest confidence among the post's sources
 */
public record EvidenceReference(String contentItemId, Instant timestamp, double bestConfidence) {
}
