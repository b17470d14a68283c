package com.entity.aggregation.api;

import com.entity.aggregation.aggregate.EntityAggregator;
import com.entity.aggregation.aggregate.PartialAggregation;
import com.entity.aggregation.aggregate.ShardedAggregator;
import com.entity.aggregation.cache.CanonicalKeyCache;
import com.entity.aggregation.core.model.AggregatedEntity;
import com.entity.aggregation.core.model.NormalizedEntity;
import com.entity.aggregation.core.model.QueryConstraints;
import com.entity.aggregation.core.model.QueryIntent;
import com.entity.aggregation.core.model.RankedResult;
import com.entity.aggregation.core.model.RawEntity;
import com.entity.aggregation.core.model.ScoredEntity;
import com.entity.aggregation.evidence.EvidenceAssembler;
import com.entity.aggregation.fallback.FallbackSuggestor;
import com.entity.aggregation.ingest.ContentAnalysis;
import com.entity.aggregation.ingest.ContentAnalysisFlattener;
import com.entity.aggregation.ingest.EntityExtractionProvider;
import com.entity.aggregation.ingest.ExtractionProviderChain;
import com.entity.aggregation.ingest.HashtagEntityExtractor;
import com.entity.aggregation.logging.LogContext;
import com.entity.aggregation.metrics.MetricsService;
import com.entity.aggregation.metrics.NoOpMetricsService;
import com.entity.aggregation.resolve.ConstraintResolver;
import com.entity.aggregation.resolve.Resolution;
import com.entity.aggregation.resolve.TextMatcher;
import com.entity.aggregation.rules.DefaultNormalizationRules;
import com.entity.aggregation.rules.EntityNormalizer;
import com.entity.aggregation.rules.NormalizationEngine;
import com.entity.aggregation.rules.SynonymTable;
import com.entity.aggregation.rules.SynonymTableLoader;
import com.entity.aggregation.scoring.RecencyDecay;
import com.entity.aggregation.scoring.RelevanceScorer;
import com.entity.aggregation.similarity.FuzzyKeyMatcher;
import com.entity.aggregation.view.EntityViewSnapshot;
import com.entity.aggregation.view.EntityViewStore;
import com.entity.aggregation.view.IngestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Answers questions about saved content from the aggregated entity view.
 *
 * <p>A query runs once through
 * {@code RECEIVED -> NORMALIZED -> AGGREGATED -> SCORED -> FILTERED -> ASSEMBLED | SUGGESTED -> DONE}
 * against the snapshot taken when it started. The outcome is always typed: ranked results,
 * fallback suggestions, or a cancellation. Runtime failures inside the pipeline are logged
 * and answered with the fallback explanation.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * try (EntityRankingEngine engine = EntityRankingEngine.builder()
 *         .options(RankingOptions.defaults())
 *         .build()) {
 *     engine.ingestAnalyses(analyses);
 *     QueryOutcome outcome = engine.answer(intent);
 * }
 * </pre>
 */
public class EntityRankingEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EntityRankingEngine.class);

    private final RankingOptions options;
    private final EntityNormalizer normalizer;
    private final EntityAggregator aggregator;
    private final Function<Collection<NormalizedEntity>, PartialAggregation> grouper;
    private final RelevanceScorer scorer;
    private final ConstraintResolver resolver;
    private final EvidenceAssembler assembler;
    private final FallbackSuggestor suggestor;
    private final EntityViewStore viewStore;
    private final CanonicalKeyCache keyCache;
    private final MetricsService metrics;
    private final Clock clock;
    private final ExecutorService shardExecutor;

    private EntityRankingEngine(Builder builder) {
        this.options = builder.options;
        this.metrics = builder.metrics;
        this.clock = builder.clock;

        NormalizationEngine rules = builder.normalizationEngine != null
                ? builder.normalizationEngine
                : DefaultNormalizationRules.createDefaultEngine();
        SynonymTable synonyms = builder.synonymTable != null
                ? builder.synonymTable
                : new SynonymTableLoader(rules).loadResource(options.getSynonymResource());

        this.keyCache = CanonicalKeyCache.create(options.getCacheConfig());
        this.normalizer = new EntityNormalizer(rules, synonyms, keyCache, metrics);
        this.aggregator = new EntityAggregator(new FuzzyKeyMatcher(options.getFuzzyMatchOptions()));
        if (options.getShardCount() > 1) {
            this.shardExecutor = Executors.newFixedThreadPool(options.getShardCount());
            this.grouper = new ShardedAggregator(aggregator, shardExecutor, options.getShardCount())::group;
        } else {
            this.shardExecutor = null;
            this.grouper = aggregator::group;
        }
        this.scorer = new RelevanceScorer(options.getScoringWeights(), new RecencyDecay(options.getHalfLifeDays()));
        this.resolver = new ConstraintResolver(new TextMatcher(rules, synonyms), options.getDefaultResultCap());
        this.assembler = new EvidenceAssembler();
        this.suggestor = new FallbackSuggestor(resolver);

        List<EntityExtractionProvider> providers = new ArrayList<>(builder.extractionProviders);
        providers.add(new HashtagEntityExtractor(options.getHashtagConfidence()));
        ContentAnalysisFlattener flattener = new ContentAnalysisFlattener(new ExtractionProviderChain(providers));
        this.viewStore = new EntityViewStore(normalizer, aggregator, grouper, flattener, metrics, clock);

        log.info("Ranking engine created with {} (synonyms={})", options, synonyms);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ── Ingestion ─────────────────────────────────────────────

    public IngestResult ingest(Collection<RawEntity> raws) {
        return viewStore.ingest(raws);
    }

    public IngestResult ingestAnalyses(Collection<ContentAnalysis> analyses) {
        return viewStore.ingestAnalyses(analyses);
    }

    public IngestResult rebuild(Collection<RawEntity> raws) {
        return viewStore.rebuild(raws);
    }

    public EntityViewSnapshot snapshot() {
        return viewStore.snapshot();
    }

    // ── Queries ───────────────────────────────────────────────

    /**
     * Answers against the current view at the current time.
     */
    public QueryOutcome answer(QueryIntent intent) {
        return answer(intent, viewStore.snapshot(), clock.instant(), QueryCancellation.none());
    }

    public QueryOutcome answer(QueryConstraints constraints) {
        return answer(QueryIntent.of("", constraints));
    }

    /**
     * Answers against a snapshot. The snapshot's mentions were normalized and aggregated at
     * ingestion, so those stages are passed through without work.
     */
    public QueryOutcome answer(QueryIntent intent, EntityViewSnapshot snapshot, Instant now,
                               QueryCancellation cancellation) {
        return answer(intent, snapshot, now, cancellation, new QueryTrace(LogContext.newId()));
    }

    QueryOutcome answer(QueryIntent intent, EntityViewSnapshot snapshot, Instant now,
                        QueryCancellation cancellation, QueryTrace trace) {
        return execute(intent, now, cancellation, trace, () -> {
            trace.advance(QueryStage.NORMALIZED);
            trace.advance(QueryStage.AGGREGATED);
            return Optional.of(snapshot.entities());
        });
    }

    /**
     * Answers over an ad-hoc batch of mentions without touching the stored view.
     */
    public QueryOutcome answer(QueryIntent intent, Collection<RawEntity> raws, Instant now,
                               QueryCancellation cancellation) {
        QueryTrace trace = new QueryTrace(LogContext.newId());
        return execute(intent, now, cancellation, trace, () -> {
            List<NormalizedEntity> normalized = normalizer.normalizeAll(raws).normalized();
            trace.advance(QueryStage.NORMALIZED);
            if (cancellation.isCancelled()) {
                return Optional.empty();
            }
            Collection<AggregatedEntity> entities = aggregator.finish(grouper.apply(normalized));
            trace.advance(QueryStage.AGGREGATED);
            return Optional.of(entities);
        });
    }

    private QueryOutcome execute(QueryIntent intent, Instant now, QueryCancellation cancellation,
                                 QueryTrace trace, CandidateSource source) {
        long start = System.nanoTime();
        QueryOutcome outcome;
        try (LogContext ignored = LogContext.forQuery(trace.getQueryId(), intent.intentType().name())) {
            outcome = runPipeline(intent.constraints(), now, cancellation, trace, source);
            log.debug("query.done outcome={} stages={}", outcome, trace.getStages());
        }
        metrics.recordQueryDuration(outcome.getKind().name().toLowerCase(Locale.ROOT),
                Duration.ofNanos(System.nanoTime() - start));
        return outcome;
    }

    private QueryOutcome runPipeline(QueryConstraints constraints, Instant now, QueryCancellation cancellation,
                                     QueryTrace trace, CandidateSource source) {
        try {
            if (cancellation.isCancelled()) {
                return cancelled(trace);
            }
            Optional<Collection<AggregatedEntity>> candidates = source.load();
            if (candidates.isEmpty() || cancellation.isCancelled()) {
                return cancelled(trace);
            }

            List<ScoredEntity> scored = scorer.scoreAll(candidates.get(), now);
            trace.advance(QueryStage.SCORED);
            if (cancellation.isCancelled()) {
                return cancelled(trace);
            }

            Resolution resolution = resolver.resolve(scored, constraints);
            trace.advance(QueryStage.FILTERED);
            metrics.recordCandidateCount(resolution.totalMatched());
            if (cancellation.isCancelled()) {
                return cancelled(trace);
            }

            if (resolution.isEmpty()) {
                List<String> suggestions = suggestor.suggest(constraints, scored);
                trace.advance(QueryStage.SUGGESTED);
                metrics.incrementFallback();
                log.info("query.empty constraints={} suggestions={}", constraints, suggestions.size());
                trace.advance(QueryStage.DONE);
                return QueryOutcome.suggestions(suggestions);
            }

            List<RankedResult> ranked = assembler.rank(resolution.results());
            trace.advance(QueryStage.ASSEMBLED);
            if (cancellation.isCancelled()) {
                return cancelled(trace);
            }
            if (resolution.insufficientCount()) {
                metrics.incrementInsufficientCount();
            }
            trace.advance(QueryStage.DONE);
            log.info("query.answered results={} matched={} insufficient={}",
                    ranked.size(), resolution.totalMatched(), resolution.insufficientCount());
            return QueryOutcome.results(ranked, resolution.insufficientCount());
        } catch (RuntimeException e) {
            log.error("query.failed stage={} constraints={}", trace.current(), constraints, e);
            metrics.incrementFallback();
            return QueryOutcome.suggestions(suggestor.suggest(constraints, List.of()));
        }
    }

    private static QueryOutcome cancelled(QueryTrace trace) {
        log.info("query.cancelled stage={}", trace.current());
        return QueryOutcome.cancelled(trace.current());
    }

    // ── Accessors ─────────────────────────────────────────────

    public RankingOptions getOptions() {
        return options;
    }

    public EntityNormalizer getNormalizer() {
        return normalizer;
    }

    public EntityViewStore getViewStore() {
        return viewStore;
    }

    public FallbackSuggestor getFallbackSuggestor() {
        return suggestor;
    }

    public CanonicalKeyCache getKeyCache() {
        return keyCache;
    }

    public Clock getClock() {
        return clock;
    }

    @Override
    public void close() {
        if (shardExecutor == null) {
            return;
        }
        shardExecutor.shutdown();
        try {
            if (!shardExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                shardExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            shardExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Produces the candidate entities of one query; empty when the query was cancelled meanwhile.
     */
    @FunctionalInterface
    private interface CandidateSource {
        Optional<Collection<AggregatedEntity>> load();
    }

    public static class Builder {
        private RankingOptions options = RankingOptions.defaults();
        private MetricsService metrics = new NoOpMetricsService();
        private Clock clock = Clock.systemUTC();
        private NormalizationEngine normalizationEngine;
        private SynonymTable synonymTable;
        private final List<EntityExtractionProvider> extractionProviders = new ArrayList<>();

        public Builder options(RankingOptions options) {
            if (options == null) {
                throw new IllegalArgumentException("options must not be null");
            }
            this.options = options;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            if (metrics == null) {
                throw new IllegalArgumentException("metrics must not be null");
            }
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new IllegalArgumentException("clock must not be null");
            }
            this.clock = clock;
            return this;
        }

        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        /**
         * Uses this table instead of loading {@link RankingOptions#getSynonymResource()}.
         */
        public Builder synonymTable(SynonymTable synonymTable) {
            this.synonymTable = synonymTable;
            return this;
        }

        /**
         * Adds a provider consulted, in order, for posts analyzed without entities.
         * The hashtag extractor is always tried last.
         */
        public Builder extractionProvider(EntityExtractionProvider provider) {
            if (provider == null) {
                throw new IllegalArgumentException("provider must not be null");
            }
            this.extractionProviders.add(provider);
            return this;
        }

        public EntityRankingEngine build() {
            return new EntityRankingEngine(this);
        }
    }
}
