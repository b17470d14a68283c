package com.entity.aggregation.evidence;

import com.entity.aggregation.core.model.AggregatedEntity;
import com.entity.aggregation.core.model.EntityCategory;
import com.entity.aggregation.core.model.EvidenceBlock;
import com.entity.aggregation.core.model.EvidenceReference;
import com.entity.aggregation.core.model.RankedResult;
import com.entity.aggregation.core.model.ScoredEntity;
import com.entity.aggregation.core.model.SourceEvidence;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Builds the evidence shown with each result.
 *
 * <p>The primary quote is the snippet of the most confident source; ties go to the most
 * recent source, then the smallest content item id. Every supporting post is listed as a
 * reference, newest first. For places, the first address or venue text found in the
 * snippets (primary quote first) is surfaced; if none is present, none is reported.</p>
 */
public class EvidenceAssembler {

    static final Comparator<SourceEvidence> PRIMARY = Comparator
            .comparingDouble(SourceEvidence::confidence)
            .thenComparing(SourceEvidence::timestamp)
            .thenComparing(SourceEvidence::contentItemId, Comparator.reverseOrder())
            .thenComparing(SourceEvidence::modality, Comparator.reverseOrder());

    private static final Comparator<EvidenceReference> NEWEST_FIRST = Comparator
            .comparing(EvidenceReference::timestamp, Comparator.reverseOrder())
            .thenComparing(EvidenceReference::contentItemId);

    private final GeoContextExtractor geoExtractor;

    public EvidenceAssembler() {
        this(new GeoContextExtractor());
    }

    public EvidenceAssembler(GeoContextExtractor geoExtractor) {
        this.geoExtractor = geoExtractor;
    }

    public EvidenceBlock assemble(ScoredEntity scored) {
        AggregatedEntity entity = scored.entity();
        List<SourceEvidence> sources = new ArrayList<>(entity.getSources());
        sources.sort(PRIMARY.reversed());
        SourceEvidence primary = sources.get(0);

        Optional<String> geo = Optional.empty();
        if (entity.getCategory() == EntityCategory.LOCATION) {
            List<String> snippets = new ArrayList<>(sources.size());
            for (SourceEvidence source : sources) {
                snippets.add(source.snippet());
            }
            geo = geoExtractor.extractFirst(snippets);
        }

        return new EvidenceBlock(primary, references(sources), entity.getAggregatedConfidence(), geo);
    }

    /**
     * Assembles evidence for already ordered results and numbers them from 1.
     */
    public List<RankedResult> rank(List<ScoredEntity> ordered) {
        List<RankedResult> ranked = new ArrayList<>(ordered.size());
        int rank = 1;
        for (ScoredEntity scored : ordered) {
            ranked.add(new RankedResult(rank++, scored.entity(), scored.scores(), assemble(scored)));
        }
        return ranked;
    }

    private static List<EvidenceReference> references(List<SourceEvidence> sources) {
        Map<String, EvidenceReference> byItem = new TreeMap<>();
        for (SourceEvidence source : sources) {
            byItem.merge(source.contentItemId(),
                    new EvidenceReference(source.contentItemId(), source.timestamp(), source.confidence()),
                    (a, b) -> new EvidenceReference(a.contentItemId(),
                            a.timestamp().isAfter(b.timestamp()) ? a.timestamp() : b.timestamp(),
                            Math.max(a.bestConfidence(), b.bestConfidence())));
        }
        List<EvidenceReference> references = new ArrayList<>(byItem.values());
        references.sort(NEWEST_FIRST);
        return references;
    }
}
