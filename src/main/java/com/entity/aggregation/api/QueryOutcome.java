package com.entity.aggregation.api;

import com.entity.aggregation.core.model.RankedResult;

import java.util.List;
import java.util.Objects;

/**
 * Typed answer to a query: ranked results, fallback suggestions, or a cancellation.
 * A cancelled outcome never carries partial results.
 */
public final class QueryOutcome {

    public enum Kind {
        RESULTS,
        SUGGESTIONS,
        CANCELLED
    }

    private final Kind kind;
    private final List<RankedResult> results;
    private final boolean insufficientCount;
    private final List<String> suggestions;
    private final QueryStage stage;

    private QueryOutcome(Kind kind, List<RankedResult> results, boolean insufficientCount,
                         List<String> suggestions, QueryStage stage) {
        this.kind = kind;
        this.results = List.copyOf(results);
        this.insufficientCount = insufficientCount;
        this.suggestions = List.copyOf(suggestions);
        this.stage = stage;
    }

    /**
     * @param results           ranked results, never empty
     * @param insufficientCount true when fewer results matched than were asked for
     */
    public static QueryOutcome results(List<RankedResult> results, boolean insufficientCount) {
        if (results == null || results.isEmpty()) {
            throw new IllegalArgumentException("A results outcome needs at least one result");
        }
        return new QueryOutcome(Kind.RESULTS, results, insufficientCount, List.of(), QueryStage.DONE);
    }

    /**
     * @param suggestions relaxations to try, ending with the explanation; never empty
     */
    public static QueryOutcome suggestions(List<String> suggestions) {
        if (suggestions == null || suggestions.isEmpty()) {
            throw new IllegalArgumentException("A suggestions outcome needs at least one suggestion");
        }
        return new QueryOutcome(Kind.SUGGESTIONS, List.of(), false, suggestions, QueryStage.DONE);
    }

    /**
     * @param stage the last stage the query completed before it was cancelled
     */
    public static QueryOutcome cancelled(QueryStage stage) {
        return new QueryOutcome(Kind.CANCELLED, List.of(), false, List.of(), Objects.requireNonNull(stage));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean hasResults() {
        return kind == Kind.RESULTS;
    }

    public boolean isCancelled() {
        return kind == Kind.CANCELLED;
    }

    public List<RankedResult> getResults() {
        return results;
    }

    public boolean isInsufficientCount() {
        return insufficientCount;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    public QueryStage getStage() {
        return stage;
    }

    @Override
    public String toString() {
        return "QueryOutcome{kind=" + kind +
                ", results=" + results.size() +
                ", insufficientCount=" + insufficientCount +
                ", suggestions=" + suggestions.size() +
                ", stage=" + stage + '}';
    }
}
