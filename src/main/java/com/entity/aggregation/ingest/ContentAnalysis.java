package com.entity.aggregation.ingest;

import com.entity.aggregation.core.model.EngagementMetrics;

import java.time.Instant;
import java.util.List;

/**
 * Analysis of one saved post as delivered by the content analysis collaborator.
 *
 * @param contentId         id of the saved post
 * @param timestamp         when the post was published
 * @param engagement        engagement counters at ingestion time
 * @param caption           caption text, possibly empty
 * @param hashtags          hashtags attached to the post, without the leading '#'
 * @param extractedEntities entities the analyzer found; may be empty
 */
public record ContentAnalysis(
        String contentId,
        Instant timestamp,
        EngagementMetrics engagement,
        String caption,
        List<String> hashtags,
        List<ExtractedEntity> extractedEntities
) {
    public ContentAnalysis {
        engagement = engagement != null ? engagement : EngagementMetrics.none();
        caption = caption != null ? caption : "";
        hashtags = hashtags != null ? List.copyOf(hashtags) : List.of();
        extractedEntities = extractedEntities != null ? List.copyOf(extractedEntities) : List.of();
    }
}
