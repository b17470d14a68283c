package com.entity.aggregation.config;

import com.entity.aggregation.api.RankingOptions;
import com.entity.aggregation.cache.CacheConfig;
import com.entity.aggregation.scoring.ScoringWeights;
import com.entity.aggregation.similarity.FuzzyMatchOptions;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link RankingOptions} from MicroProfile Config properties. Properties that are
 * not set keep the builder defaults; invalid values are rejected by the builder.
 *
 * <pre>
 * ranking.weights.frequency=0.3
 * ranking.weights.recency=0.3
 * ranking.weights.engagement=0.2
 * ranking.weights.confidence=0.2
 * ranking.recency.half-life-days=30
 * ranking.result.default-cap=10
 * ranking.fuzzy.enabled=true
 * ranking.fuzzy.threshold=0.92
 * ranking.fuzzy.min-key-length=4
 * ranking.cache.enabled=true
 * ranking.cache.max-size=50000
 * ranking.aggregation.shard-count=1
 * ranking.query.threads=4
 * ranking.query.timeout-ms=30000
 * ranking.synonyms.resource=synonyms/default-v1.json
 * ranking.hashtag.confidence=0.5
 * </pre>
 */
public class RankingOptionsLoader {
    private static final Logger log = LoggerFactory.getLogger(RankingOptionsLoader.class);

    static final String WEIGHT_FREQUENCY = "ranking.weights.frequency";
    static final String WEIGHT_RECENCY = "ranking.weights.recency";
    static final String WEIGHT_ENGAGEMENT = "ranking.weights.engagement";
    static final String WEIGHT_CONFIDENCE = "ranking.weights.confidence";
    static final String HALF_LIFE_DAYS = "ranking.recency.half-life-days";
    static final String DEFAULT_CAP = "ranking.result.default-cap";
    static final String FUZZY_ENABLED = "ranking.fuzzy.enabled";
    static final String FUZZY_THRESHOLD = "ranking.fuzzy.threshold";
    static final String FUZZY_MIN_KEY_LENGTH = "ranking.fuzzy.min-key-length";
    static final String CACHE_ENABLED = "ranking.cache.enabled";
    static final String CACHE_MAX_SIZE = "ranking.cache.max-size";
    static final String SHARD_COUNT = "ranking.aggregation.shard-count";
    static final String QUERY_THREADS = "ranking.query.threads";
    static final String QUERY_TIMEOUT_MS = "ranking.query.timeout-ms";
    static final String SYNONYM_RESOURCE = "ranking.synonyms.resource";
    static final String HASHTAG_CONFIDENCE = "ranking.hashtag.confidence";

    private final Config config;

    public RankingOptionsLoader() {
        this(ConfigProvider.getConfig());
    }

    public RankingOptionsLoader(Config config) {
        this.config = config;
    }

    /**
     * @throws IllegalArgumentException if a property holds an invalid value
     */
    public RankingOptions load() {
        RankingOptions.Builder builder = RankingOptions.builder();

        ScoringWeights defaults = ScoringWeights.defaultWeights();
        builder.scoringWeights(new ScoringWeights(
                doubleValue(WEIGHT_FREQUENCY, defaults.frequencyWeight()),
                doubleValue(WEIGHT_RECENCY, defaults.recencyWeight()),
                doubleValue(WEIGHT_ENGAGEMENT, defaults.engagementWeight()),
                doubleValue(WEIGHT_CONFIDENCE, defaults.confidenceWeight())));

        config.getOptionalValue(HALF_LIFE_DAYS, Double.class).ifPresent(builder::halfLifeDays);
        config.getOptionalValue(DEFAULT_CAP, Integer.class).ifPresent(builder::defaultResultCap);

        FuzzyMatchOptions fuzzyDefaults = FuzzyMatchOptions.defaults();
        boolean fuzzyEnabled = config.getOptionalValue(FUZZY_ENABLED, Boolean.class).orElse(fuzzyDefaults.enabled());
        builder.fuzzyMatchOptions(fuzzyEnabled
                ? new FuzzyMatchOptions(true,
                        doubleValue(FUZZY_THRESHOLD, fuzzyDefaults.threshold()),
                        config.getOptionalValue(FUZZY_MIN_KEY_LENGTH, Integer.class).orElse(fuzzyDefaults.minKeyLength()))
                : FuzzyMatchOptions.disabled());

        CacheConfig cacheDefaults = CacheConfig.defaults();
        builder.cacheConfig(new CacheConfig(
                config.getOptionalValue(CACHE_MAX_SIZE, Integer.class).orElse(cacheDefaults.maxSize()),
                config.getOptionalValue(CACHE_ENABLED, Boolean.class).orElse(cacheDefaults.enabled())));

        config.getOptionalValue(SHARD_COUNT, Integer.class).ifPresent(builder::shardCount);
        config.getOptionalValue(QUERY_THREADS, Integer.class).ifPresent(builder::queryThreads);
        config.getOptionalValue(QUERY_TIMEOUT_MS, Long.class).ifPresent(builder::queryTimeoutMs);
        config.getOptionalValue(SYNONYM_RESOURCE, String.class).ifPresent(builder::synonymResource);
        config.getOptionalValue(HASHTAG_CONFIDENCE, Double.class).ifPresent(builder::hashtagConfidence);

        RankingOptions options = builder.build();
        log.info("Loaded {}", options);
        return options;
    }

    private double doubleValue(String name, double defaultValue) {
        return config.getOptionalValue(name, Double.class).orElse(defaultValue);
    }
}
