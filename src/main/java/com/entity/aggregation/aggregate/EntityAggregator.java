package com.entity.aggregation.aggregate;

import com.entity.aggregation.core.model.AggregatedEntity;
import com.entity.aggregation.core.model.EntityCategory;
import com.entity.aggregation.core.model.NormalizedEntity;
import com.entity.aggregation.similarity.FuzzyKeyMatcher;
import com.entity.aggregation.similarity.FuzzyMatchOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

/**
 * Merges normalized mentions into aggregated entities.
 *
 * <p>Aggregation runs in two steps. {@link #group} builds a {@link PartialAggregation} keyed by
 * exact canonical key and category; partials of disjoint shards merge freely. {@link #finish}
 * then folds fuzzy-matching keys of the same category together. The representative key of a
 * fuzzy cluster is the member with the most supporting items, ties broken by the smallest key.</p>
 */
public class EntityAggregator {
    private static final Logger log = LoggerFactory.getLogger(EntityAggregator.class);

    private static final Comparator<AggregatedEntity> REPRESENTATIVE = Comparator
            .comparingInt(AggregatedEntity::getMentionCount).reversed()
            .thenComparing(AggregatedEntity::getCanonicalKey);

    private final FuzzyKeyMatcher matcher;

    public EntityAggregator() {
        this(new FuzzyKeyMatcher(FuzzyMatchOptions.defaults()));
    }

    public EntityAggregator(FuzzyKeyMatcher matcher) {
        this.matcher = matcher;
    }

    public Set<AggregatedEntity> aggregate(Collection<NormalizedEntity> entities) {
        return finish(group(entities));
    }

    public PartialAggregation group(Collection<NormalizedEntity> entities) {
        return PartialAggregation.of(entities);
    }

    /**
     * Applies fuzzy consolidation and returns the final entity set, ordered by category then key.
     */
    public Set<AggregatedEntity> finish(PartialAggregation partial) {
        Map<EntityCategory, List<AggregatedEntity>> byCategory = new EnumMap<>(EntityCategory.class);
        for (AggregatedEntity entity : partial.getGroups().values()) {
            byCategory.computeIfAbsent(entity.getCategory(), c -> new ArrayList<>()).add(entity);
        }

        Set<AggregatedEntity> result = new LinkedHashSet<>();
        int folded = 0;
        for (Map.Entry<EntityCategory, List<AggregatedEntity>> entry : byCategory.entrySet()) {
            Map<String, AggregatedEntity> byKey = new HashMap<>();
            for (AggregatedEntity entity : entry.getValue()) {
                byKey.put(entity.getCanonicalKey(), entity);
            }
            for (SortedSet<String> cluster : matcher.cluster(byKey.keySet())) {
                if (cluster.size() == 1) {
                    result.add(byKey.get(cluster.first()));
                    continue;
                }
                List<AggregatedEntity> members = new ArrayList<>(cluster.size());
                for (String key : cluster) {
                    members.add(byKey.get(key));
                }
                members.sort(REPRESENTATIVE);
                String representative = members.get(0).getCanonicalKey();
                AggregatedEntity merged = members.get(0);
                for (AggregatedEntity member : members.subList(1, members.size())) {
                    merged = merged.absorb(member, representative);
                }
                folded += cluster.size() - 1;
                log.debug("Consolidated {} keys of {} into '{}'", cluster.size(), entry.getKey(), representative);
                result.add(merged);
            }
        }
        log.debug("Aggregated {} groups into {} entities ({} folded by fuzzy match)",
                partial.size(), result.size(), folded);
        return Collections.unmodifiableSet(result);
    }

    public FuzzyKeyMatcher getMatcher() {
        return matcher;
    }
}
