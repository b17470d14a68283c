package com.entity.aggregation.rules;

import com.entity.aggregation.cache.CacheConfig;
import com.entity.aggregation.cache.CanonicalKeyCache;
import com.entity.aggregation.core.model.EntityCategory;
import com.entity.aggregation.core.model.NormalizedEntity;
import com.entity.aggregation.core.model.RawEntity;
import com.entity.aggregation.core.model.SkipReason;
import com.entity.aggregation.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.entity.aggregation.testing.EntityFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EntityNormalizer Tests")
class EntityNormalizerTest {

    @Mock
    private MetricsService metrics;

    private EntityNormalizer normalizer;
    private CanonicalKeyCache cache;

    @BeforeEach
    void setUp() {
        NormalizationEngine engine = DefaultNormalizationRules.createDefaultEngine();
        SynonymTable synonyms = new SynonymTableLoader(engine).loadDefault();
        cache = CanonicalKeyCache.create(CacheConfig.defaults());
        normalizer = new EntityNormalizer(engine, synonyms, cache, metrics);
    }

    @Test
    @DisplayName("Spelling variants of one place share a key")
    void variantsShareKey() {
        NormalizedEntity a = normalizer.normalize(raw("Paris Café", EntityCategory.LOCATION, 0.8, "I1", NOW))
                .getNormalized().orElseThrow();
        NormalizedEntity b = normalizer.normalize(raw("paris cafe", EntityCategory.LOCATION, 0.6, "I2", NOW))
                .getNormalized().orElseThrow();

        assertEquals("paris cafe", a.canonicalKey());
        assertEquals(a.canonicalKey(), b.canonicalKey());
        assertEquals("default-v1", a.tableVersion());
    }

    @Test
    @DisplayName("Synonyms are applied after folding")
    void synonymsApplied() {
        assertEquals("instagram", normalizer.canonicalKey(raw("IG", EntityCategory.CONCEPT, 1.0, "I1", NOW)));
        assertEquals("new york city", normalizer.canonicalKey(raw("#NYC", EntityCategory.LOCATION, 1.0, "I1", NOW)));
        assertEquals("sunscreen", normalizer.canonicalKey(raw("SPF", EntityCategory.PRODUCT, 1.0, "I1", NOW)));
    }

    @Test
    @DisplayName("Malformed mentions are skipped with a reason and counted")
    void malformedSkipped() {
        List<RawEntity> raws = List.of(
                raw(" ", EntityCategory.PRODUCT, 0.5, "I1", NOW),
                raw("Matcha", null, 0.5, "I1", NOW),
                raw("Matcha", EntityCategory.PRODUCT, 0.5, null, NOW),
                raw("Matcha", EntityCategory.PRODUCT, 0.5, "I1", null),
                new RawEntity("Matcha", EntityCategory.PRODUCT, 0.5, null, "", "I1", NOW, null),
                raw("Matcha", EntityCategory.PRODUCT, 1.5, "I1", NOW),
                raw("!!!", EntityCategory.PRODUCT, 0.5, "I1", NOW),
                raw("Matcha", EntityCategory.PRODUCT, 0.5, "I1", NOW));

        EntityNormalizer.Batch batch = normalizer.normalizeAll(raws);

        assertEquals(1, batch.normalized().size());
        assertEquals(List.of(
                        SkipReason.MISSING_NAME,
                        SkipReason.MISSING_CATEGORY,
                        SkipReason.MISSING_CONTENT_ITEM,
                        SkipReason.MISSING_TIMESTAMP,
                        SkipReason.MISSING_MODALITY,
                        SkipReason.INVALID_CONFIDENCE,
                        SkipReason.EMPTY_CANONICAL_KEY),
                batch.skipped().stream().map(s -> s.reason()).toList());
        verify(metrics).incrementSkippedEntity(SkipReason.MISSING_NAME);
        verify(metrics).incrementSkippedEntity(SkipReason.EMPTY_CANONICAL_KEY);
        verify(metrics, times(7)).incrementSkippedEntity(any());
    }

    @Test
    @DisplayName("Repeated names are served from the key cache")
    void cachesKeys() {
        normalizer.normalize(raw("Blue Bottle", EntityCategory.LOCATION, 0.5, "I1", NOW));
        normalizer.normalize(raw("Blue Bottle", EntityCategory.LOCATION, 0.5, "I2", NOW));
        normalizer.normalize(raw("Blue Bottle", EntityCategory.PRODUCT, 0.5, "I3", NOW));

        assertEquals(1, cache.getStats().hitCount());
        assertEquals(2, cache.getStats().missCount());
        verifyNoInteractions(metrics);
    }
}
