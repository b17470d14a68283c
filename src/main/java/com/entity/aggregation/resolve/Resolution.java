package com.entity.aggregation.resolve;

import com.entity.aggregation.core.model.ScoredEntity;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of applying query constraints to scored candidates.
 *
 * @param results           ranked results, at most the requested count (or default cap)
 * @param totalMatched      candidates that passed every filter, before truncation
 * @param insufficientCount true when a count was requested and fewer candidates matched
 * @param conflict          why the constraints can never be satisfied, if they can't
 */
public record Resolution(
        List<ScoredEntity> results,
        int totalMatched,
        boolean insufficientCount,
        Optional<String> conflict
) {
    public Resolution {
        results = results != null ? List.copyOf(results) : List.of();
        conflict = conflict != null ? conflict : Optional.empty();
    }

    public static Resolution conflict(String reason) {
        return new Resolution(List.of(), 0, false, Optional.of(reason));
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public boolean hasConflict() {
        return conflict.isPresent();
    }
}
