package com.entity.aggregation.ingest;

import java.util.List;

/**
 * Source of entities for a saved post whose analysis came without any.
 * Implementations may call remote models; they are allowed to fail.
 */
public interface EntityExtractionProvider {

    /**
     * @param analysis the post to extract from
     * @return extracted entities, empty if none were found
     */
    List<ExtractedEntity> extract(ContentAnalysis analysis);

    /**
     * Name used in logs.
     */
    String getProviderName();

    /**
     * Whether the provider is configured and can be called at all.
     */
    default boolean isAvailable() {
        return true;
    }
}
