package com.entity.aggregation.rules;

import com.entity.aggregation.cache.CanonicalKeyCache;
import com.entity.aggregation.cache.NoOpCanonicalKeyCache;
import com.entity.aggregation.core.model.NormalizedEntity;
import com.entity.aggregation.core.model.RawEntity;
import com.entity.aggregation.core.model.SkipReason;
import com.entity.aggregation.core.model.SkippedEntity;
import com.entity.aggregation.metrics.MetricsService;
import com.entity.aggregation.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Canonicalizes raw mentions into grouping keys.
 *
 * <p>The canonical key is a pure function of the mention's name and category for a given
 * {@link SynonymTable} version. Fuzzy matching between keys is not done here; it belongs
 * to aggregation so that this step stays cacheable.</p>
 */
public class EntityNormalizer {
    private static final Logger log = LoggerFactory.getLogger(EntityNormalizer.class);

    private final NormalizationEngine engine;
    private final SynonymTable synonyms;
    private final CanonicalKeyCache cache;
    private final MetricsService metrics;

    public EntityNormalizer(NormalizationEngine engine, SynonymTable synonyms) {
        this(engine, synonyms, new NoOpCanonicalKeyCache(), new NoOpMetricsService());
    }

    public EntityNormalizer(NormalizationEngine engine, SynonymTable synonyms,
                            CanonicalKeyCache cache, MetricsService metrics) {
        this.engine = engine;
        this.synonyms = synonyms;
        this.cache = cache;
        this.metrics = metrics;
    }

    /**
     * Normalizes a mention, or rejects it when a required field is missing or invalid.
     */
    public NormalizationOutcome normalize(RawEntity raw) {
        SkipReason problem = validate(raw);
        if (problem != null) {
            return skip(raw, problem);
        }

        String key = canonicalKey(raw);
        if (key.isEmpty()) {
            return skip(raw, SkipReason.EMPTY_CANONICAL_KEY);
        }
        return NormalizationOutcome.normalized(new NormalizedEntity(raw, key, synonyms.getVersion()));
    }

    /**
     * Normalizes every mention, dropping and counting the malformed ones.
     */
    public Batch normalizeAll(Collection<RawEntity> raws) {
        List<NormalizedEntity> normalized = new ArrayList<>(raws.size());
        List<SkippedEntity> skipped = new ArrayList<>();
        for (RawEntity raw : raws) {
            NormalizationOutcome outcome = normalize(raw);
            outcome.getNormalized().ifPresent(normalized::add);
            outcome.getSkipped().ifPresent(skipped::add);
        }
        if (!skipped.isEmpty()) {
            log.info("Normalized {} entities, skipped {} malformed", normalized.size(), skipped.size());
        }
        return new Batch(normalized, skipped);
    }

    /**
     * Canonical key for a name and category, without validation of the other fields.
     */
    public String canonicalKey(RawEntity raw) {
        return cache.get(raw.name(), raw.category(), synonyms.getVersion(),
                () -> synonyms.apply(engine.normalize(raw.name(), raw.category())));
    }

    public SynonymTable getSynonymTable() {
        return synonyms;
    }

    public NormalizationEngine getEngine() {
        return engine;
    }

    private SkipReason validate(RawEntity raw) {
        if (raw.name() == null || raw.name().isBlank()) {
            return SkipReason.MISSING_NAME;
        }
        if (raw.category() == null) {
            return SkipReason.MISSING_CATEGORY;
        }
        if (raw.contentItemId() == null || raw.contentItemId().isBlank()) {
            return SkipReason.MISSING_CONTENT_ITEM;
        }
        if (raw.contentTimestamp() == null) {
            return SkipReason.MISSING_TIMESTAMP;
        }
        if (raw.modality() == null) {
            return SkipReason.MISSING_MODALITY;
        }
        if (Double.isNaN(raw.confidence()) || raw.confidence() < 0.0 || raw.confidence() > 1.0) {
            return SkipReason.INVALID_CONFIDENCE;
        }
        return null;
    }

    private NormalizationOutcome skip(RawEntity raw, SkipReason reason) {
        metrics.incrementSkippedEntity(reason);
        log.warn("Skipping malformed entity reason={} item={} name='{}'",
                reason, raw.contentItemId(), raw.name());
        return NormalizationOutcome.skipped(new SkippedEntity(raw, reason));
    }

    /**
     * Normalized and skipped mentions of one batch.
     */
    public record Batch(List<NormalizedEntity> normalized, List<SkippedEntity> skipped) {
        public Batch {
            normalized = List.copyOf(normalized);
            skipped = List.copyOf(skipped);
        }
    }
}
