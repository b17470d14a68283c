package com.entity.aggregation.ingest;

import com.entity.aggregation.core.model.EntityCategory;
import com.entity.aggregation.core.model.SourceModality;

/**
 * An entity found in one saved post by a content analyzer, before it is tied to the post.
 */
public record ExtractedEntity(
        String name,
        EntityCategory category,
        double confidence,
        SourceModality modality,
        String context
) {
    public ExtractedEntity {
        modality = modality != null ? modality : SourceModality.CAPTION;
        context = context != null ? context : "";
    }
}
