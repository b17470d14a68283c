package com.entity.aggregation.resolve;

import com.entity.aggregation.core.model.AggregatedEntity;
import com.entity.aggregation.core.model.QueryConstraints;
import com.entity.aggregation.core.model.ScoredEntity;
import com.entity.aggregation.core.model.SourceEvidence;
import com.entity.aggregation.core.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies query constraints to scored candidates and truncates to the requested size.
 *
 * <p>Filters are conjunctive:</p>
 * <ul>
 *   <li><b>category</b>: exact match</li>
 *   <li><b>geographic</b>: the place phrase appears as whole tokens in the canonical key,
 *       an alias key, or any supporting snippet</li>
 *   <li><b>time window</b>: at least one supporting source falls inside the window</li>
 *   <li><b>minimum confidence</b>: aggregated confidence at or above the threshold</li>
 * </ul>
 *
 * <p>Survivors are ordered by relevance descending, then canonical key ascending.
 * A requested count of N yields exactly {@code min(N, matched)} results; falling short is
 * flagged, never an error. Without a requested count, the default cap applies.</p>
 */
public class ConstraintResolver {
    private static final Logger log = LoggerFactory.getLogger(ConstraintResolver.class);

    private final TextMatcher textMatcher;
    private final int defaultCap;

    public ConstraintResolver(TextMatcher textMatcher, int defaultCap) {
        if (defaultCap <= 0) {
            throw new IllegalArgumentException("defaultCap must be > 0");
        }
        this.textMatcher = textMatcher;
        this.defaultCap = defaultCap;
    }

    public Resolution resolve(List<ScoredEntity> candidates, QueryConstraints constraints) {
        Optional<String> conflict = constraints.conflict();
        if (conflict.isPresent()) {
            log.debug("Constraint conflict: {}", conflict.get());
            return Resolution.conflict(conflict.get());
        }

        List<ScoredEntity> filtered = filter(candidates, constraints);
        filtered.sort(ScoredEntity.RANKING);

        Optional<Integer> requested = constraints.getRequestedCount();
        int limit = requested.orElse(defaultCap);
        boolean insufficient = requested.isPresent() && filtered.size() < requested.get();
        List<ScoredEntity> results = filtered.subList(0, Math.min(limit, filtered.size()));

        log.debug("Resolved {} of {} candidates (matched={}, limit={}, insufficient={})",
                results.size(), candidates.size(), filtered.size(), limit, insufficient);
        return new Resolution(results, filtered.size(), insufficient, Optional.empty());
    }

    /**
     * Candidates passing every filter, in input order. Count and cap are not applied.
     */
    public List<ScoredEntity> filter(List<ScoredEntity> candidates, QueryConstraints constraints) {
        String geoPhrase = constraints.getGeographicFilter().map(textMatcher::normalize).orElse(null);
        List<ScoredEntity> filtered = new ArrayList<>();
        for (ScoredEntity candidate : candidates) {
            if (accepts(candidate.entity(), constraints, geoPhrase)) {
                filtered.add(candidate);
            }
        }
        return filtered;
    }

    public int getDefaultCap() {
        return defaultCap;
    }

    private boolean accepts(AggregatedEntity entity, QueryConstraints constraints, String geoPhrase) {
        if (constraints.getCategory().isPresent() && constraints.getCategory().get() != entity.getCategory()) {
            return false;
        }
        if (constraints.getMinConfidence().isPresent()
                && entity.getAggregatedConfidence() < constraints.getMinConfidence().get()) {
            return false;
        }
        if (constraints.getTimeWindow().isPresent() && !withinWindow(entity, constraints.getTimeWindow().get())) {
            return false;
        }
        return geoPhrase == null || mentionsPlace(entity, geoPhrase);
    }

    private static boolean withinWindow(AggregatedEntity entity, TimeWindow window) {
        for (SourceEvidence source : entity.getSources()) {
            if (window.contains(source.timestamp())) {
                return true;
            }
        }
        return false;
    }

    private boolean mentionsPlace(AggregatedEntity entity, String geoPhrase) {
        if (geoPhrase.isEmpty()) {
            return false;
        }
        for (String key : entity.getAliasKeys()) {
            if (textMatcher.containsPhrase(key, geoPhrase)) {
                return true;
            }
        }
        for (SourceEvidence source : entity.getSources()) {
            if (textMatcher.containsPhrase(textMatcher.normalize(source.snippet()), geoPhrase)) {
                return true;
            }
        }
        return false;
    }
}
