package com.entity.aggregation.api;

import com.entity.aggregation.cache.CacheConfig;
import com.entity.aggregation.rules.SynonymTableLoader;
import com.entity.aggregation.scoring.ScoringWeights;
import com.entity.aggregation.similarity.FuzzyMatchOptions;

/**
 * Options for the ranking engine: scoring weights, recency half-life, result cap,
 * fuzzy consolidation, key caching, parallelism and query timeout.
 */
public class RankingOptions {

    private static final double DEFAULT_HALF_LIFE_DAYS = 30.0;
    private static final int DEFAULT_RESULT_CAP = 10;
    private static final int DEFAULT_SHARD_COUNT = 1;
    private static final int DEFAULT_QUERY_THREADS = 4;
    private static final long DEFAULT_QUERY_TIMEOUT_MS = 30_000;
    private static final double DEFAULT_HASHTAG_CONFIDENCE = 0.5;

    private final ScoringWeights scoringWeights;
    private final double halfLifeDays;
    private final int defaultResultCap;
    private final FuzzyMatchOptions fuzzyMatchOptions;
    private final CacheConfig cacheConfig;
    private final int shardCount;
    private final int queryThreads;
    private final long queryTimeoutMs;
    private final String synonymResource;
    private final double hashtagConfidence;

    private RankingOptions(Builder builder) {
        this.scoringWeights = builder.scoringWeights;
        this.halfLifeDays = builder.halfLifeDays;
        this.defaultResultCap = builder.defaultResultCap;
        this.fuzzyMatchOptions = builder.fuzzyMatchOptions;
        this.cacheConfig = builder.cacheConfig;
        this.shardCount = builder.shardCount;
        this.queryThreads = builder.queryThreads;
        this.queryTimeoutMs = builder.queryTimeoutMs;
        this.synonymResource = builder.synonymResource;
        this.hashtagConfidence = builder.hashtagConfidence;
    }

    public ScoringWeights getScoringWeights() {
        return scoringWeights;
    }

    public double getHalfLifeDays() {
        return halfLifeDays;
    }

    public int getDefaultResultCap() {
        return defaultResultCap;
    }

    public FuzzyMatchOptions getFuzzyMatchOptions() {
        return fuzzyMatchOptions;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public int getShardCount() {
        return shardCount;
    }

    public int getQueryThreads() {
        return queryThreads;
    }

    public long getQueryTimeoutMs() {
        return queryTimeoutMs;
    }

    /**
     * Classpath location of the synonym table.
     */
    public String getSynonymResource() {
        return synonymResource;
    }

    public double getHashtagConfidence() {
        return hashtagConfidence;
    }

    public static RankingOptions defaults() {
        return builder().build();
    }

    /**
     * Options that favor recently saved content and ignore fuzzy key matching.
     */
    public static RankingOptions strictRecent() {
        return builder()
                .scoringWeights(ScoringWeights.recencyFocused())
                .halfLifeDays(14.0)
                .fuzzyMatchOptions(FuzzyMatchOptions.disabled())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ScoringWeights scoringWeights = ScoringWeights.defaultWeights();
        private double halfLifeDays = DEFAULT_HALF_LIFE_DAYS;
        private int defaultResultCap = DEFAULT_RESULT_CAP;
        private FuzzyMatchOptions fuzzyMatchOptions = FuzzyMatchOptions.defaults();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private int shardCount = DEFAULT_SHARD_COUNT;
        private int queryThreads = DEFAULT_QUERY_THREADS;
        private long queryTimeoutMs = DEFAULT_QUERY_TIMEOUT_MS;
        private String synonymResource = SynonymTableLoader.DEFAULT_RESOURCE;
        private double hashtagConfidence = DEFAULT_HASHTAG_CONFIDENCE;

        public Builder scoringWeights(ScoringWeights scoringWeights) {
            if (scoringWeights == null) {
                throw new IllegalArgumentException("scoringWeights must not be null");
            }
            this.scoringWeights = scoringWeights;
            return this;
        }

        public Builder halfLifeDays(double halfLifeDays) {
            if (!(halfLifeDays > 0.0) || Double.isInfinite(halfLifeDays)) {
                throw new IllegalArgumentException("halfLifeDays must be a positive finite number");
            }
            this.halfLifeDays = halfLifeDays;
            return this;
        }

        public Builder defaultResultCap(int defaultResultCap) {
            validatePositive(defaultResultCap, "defaultResultCap");
            this.defaultResultCap = defaultResultCap;
            return this;
        }

        public Builder fuzzyMatchOptions(FuzzyMatchOptions fuzzyMatchOptions) {
            if (fuzzyMatchOptions == null) {
                throw new IllegalArgumentException("fuzzyMatchOptions must not be null");
            }
            this.fuzzyMatchOptions = fuzzyMatchOptions;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            if (cacheConfig == null) {
                throw new IllegalArgumentException("cacheConfig must not be null");
            }
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder shardCount(int shardCount) {
            validatePositive(shardCount, "shardCount");
            this.shardCount = shardCount;
            return this;
        }

        public Builder queryThreads(int queryThreads) {
            validatePositive(queryThreads, "queryThreads");
            this.queryThreads = queryThreads;
            return this;
        }

        public Builder queryTimeoutMs(long queryTimeoutMs) {
            if (queryTimeoutMs <= 0) {
                throw new IllegalArgumentException("queryTimeoutMs must be positive");
            }
            this.queryTimeoutMs = queryTimeoutMs;
            return this;
        }

        public Builder synonymResource(String synonymResource) {
            if (synonymResource == null || synonymResource.isBlank()) {
                throw new IllegalArgumentException("synonymResource must not be blank");
            }
            this.synonymResource = synonymResource;
            return this;
        }

        public Builder hashtagConfidence(double hashtagConfidence) {
            if (hashtagConfidence < 0.0 || hashtagConfidence > 1.0) {
                throw new IllegalArgumentException("hashtagConfidence must be between 0.0 and 1.0");
            }
            this.hashtagConfidence = hashtagConfidence;
            return this;
        }

        public RankingOptions build() {
            return new RankingOptions(this);
        }

        private void validatePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }

    @Override
    public String toString() {
        return "RankingOptions{" +
                "scoringWeights=" + scoringWeights +
                ", halfLifeDays=" + halfLifeDays +
                ", defaultResultCap=" + defaultResultCap +
                ", fuzzyMatchOptions=" + fuzzyMatchOptions +
                ", cacheConfig=" + cacheConfig +
                ", shardCount=" + shardCount +
                ", queryThreads=" + queryThreads +
                ", queryTimeoutMs=" + queryTimeoutMs +
                ", synonymResource='" + synonymResource + '\'' +
                ", hashtagConfidence=" + hashtagConfidence +
                '}';
    }
}
