package com.entity.aggregation.view;

import com.entity.aggregation.core.model.SkippedEntity;

import java.util.List;

/**
 * Result of ingesting one batch of mentions.
 *
 * @param snapshot        the snapshot published by this batch
 * @param totalMentions   number of mentions in the batch
 * @param normalizedCount mentions that made it into the view
 * @param skipped         malformed mentions that were left out
 */
public record IngestResult(
        EntityViewSnapshot snapshot,
        int totalMentions,
        int normalizedCount,
        List<SkippedEntity> skipped
) {
    public IngestResult {
        skipped = skipped != null ? List.copyOf(skipped) : List.of();
    }

    public int skippedCount() {
        return skipped.size();
    }

    public boolean hasSkipped() {
        return !skipped.isEmpty();
    }

    @Override
    public String toString() {
        return "IngestResult{version=" + snapshot.version() +
                ", total=" + totalMentions +
                ", normalized=" + normalizedCount +
                ", skipped=" + skipped.size() + '}';
    }
}
