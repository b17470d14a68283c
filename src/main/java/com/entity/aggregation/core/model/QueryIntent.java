package com.entity.aggregation.core.model;

import java.util.Objects;

/**
 * Parsed user question handed over by the query-processing collaborator.
 *
 * @param originalQuery the question as typed
 * @param intentType    kind of question
 * @param constraints   filters and limits extracted from the question
 */
public record QueryIntent(String originalQuery, IntentType intentType, QueryConstraints constraints) {

    public QueryIntent {
        originalQuery = originalQuery != null ? originalQuery : "";
        intentType = intentType != null ? intentType : IntentType.SEARCH;
        constraints = constraints != null ? constraints : QueryConstraints.none();
    }

    public static QueryIntent of(String originalQuery, QueryConstraints constraints) {
        return new QueryIntent(originalQuery, IntentType.SEARCH, Objects.requireNonNull(constraints));
    }
}
