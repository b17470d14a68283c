package com.entity.aggregation.aggregate;

import com.entity.aggregation.core.model.AggregatedEntity;
import com.entity.aggregation.core.model.NormalizedEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Aggregates large mention collections in parallel.
 *
 * <p>Mentions are split into shards by content item, so no post straddles two shards.
 * Each shard is grouped on the executor and the partials are reduced with
 * {@link PartialAggregation#merge}. That merge is associative and commutative, so the
 * result equals grouping everything at once.</p>
 */
public class ShardedAggregator {
    private static final Logger log = LoggerFactory.getLogger(ShardedAggregator.class);

    private final EntityAggregator aggregator;
    private final ExecutorService executor;
    private final int shardCount;

    public ShardedAggregator(EntityAggregator aggregator, ExecutorService executor, int shardCount) {
        if (shardCount <= 0) {
            throw new IllegalArgumentException("shardCount must be > 0");
        }
        this.aggregator = aggregator;
        this.executor = executor;
        this.shardCount = shardCount;
    }

    public Set<AggregatedEntity> aggregate(Collection<NormalizedEntity> entities) {
        return aggregator.finish(group(entities));
    }

    /**
     * Groups all mentions into one partial using every shard in parallel.
     */
    public PartialAggregation group(Collection<NormalizedEntity> entities) {
        List<List<NormalizedEntity>> shards = shard(entities, shardCount);

        List<CompletableFuture<PartialAggregation>> futures = new ArrayList<>(shards.size());
        for (List<NormalizedEntity> shard : shards) {
            futures.add(CompletableFuture.supplyAsync(() -> aggregator.group(shard), executor));
        }

        CompletableFuture<PartialAggregation> reduced = CompletableFuture.completedFuture(PartialAggregation.empty());
        for (CompletableFuture<PartialAggregation> future : futures) {
            reduced = reduced.thenCombine(future, PartialAggregation::merge);
        }

        try {
            PartialAggregation result = reduced.join();
            log.debug("Grouped {} mentions in {} shards into {} groups",
                    entities.size(), shards.size(), result.size());
            return result;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }

    /**
     * Splits mentions into at most {@code count} non-empty shards; all mentions of one
     * content item go to the same shard.
     */
    static List<List<NormalizedEntity>> shard(Collection<NormalizedEntity> entities, int count) {
        List<List<NormalizedEntity>> buckets = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            buckets.add(new ArrayList<>());
        }
        for (NormalizedEntity entity : entities) {
            int bucket = Math.floorMod(entity.raw().contentItemId().hashCode(), count);
            buckets.get(bucket).add(entity);
        }
        buckets.removeIf(List::isEmpty);
        return buckets;
    }
}
