package com.entity.aggregation.ingest;

import com.entity.aggregation.core.model.RawEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Turns post analyses into raw entity mentions, one per extracted entity, each carrying the
 * post's id, timestamp and engagement. Posts analyzed without any entities are handed to the
 * fallback extraction provider, when one is configured.
 */
public class ContentAnalysisFlattener {
    private static final Logger log = LoggerFactory.getLogger(ContentAnalysisFlattener.class);

    private final EntityExtractionProvider fallback;

    public ContentAnalysisFlattener() {
        this(null);
    }

    public ContentAnalysisFlattener(EntityExtractionProvider fallback) {
        this.fallback = fallback;
    }

    public List<RawEntity> flatten(Collection<ContentAnalysis> analyses) {
        List<RawEntity> raws = new ArrayList<>();
        for (ContentAnalysis analysis : analyses) {
            raws.addAll(flatten(analysis));
        }
        log.debug("Flattened {} analyses into {} mentions", analyses.size(), raws.size());
        return raws;
    }

    public List<RawEntity> flatten(ContentAnalysis analysis) {
        List<ExtractedEntity> extracted = analysis.extractedEntities();
        if (extracted.isEmpty() && fallback != null) {
            extracted = fallback.extract(analysis);
        }
        List<RawEntity> raws = new ArrayList<>(extracted.size());
        for (ExtractedEntity entity : extracted) {
            raws.add(RawEntity.builder()
                    .name(entity.name())
                    .category(entity.category())
                    .confidence(entity.confidence())
                    .modality(entity.modality())
                    .context(entity.context().isEmpty() ? analysis.caption() : entity.context())
                    .contentItemId(analysis.contentId())
                    .contentTimestamp(analysis.timestamp())
                    .engagement(analysis.engagement())
                    .build());
        }
        return raws;
    }

    public Optional<EntityExtractionProvider> getFallback() {
        return Optional.ofNullable(fallback);
    }
}
