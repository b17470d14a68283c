package com.entity.aggregation.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Filters and limits extracted from a user question by the query-processing collaborator.
 * Every constraint is optional; an empty instance matches everything.
 */
public final class QueryConstraints {

    private static final QueryConstraints NONE = builder().build();

    private final EntityCategory category;
    private final Integer requestedCount;
    private final String geographicFilter;
    private final TimeWindow timeWindow;
    private final Double minConfidence;

    private QueryConstraints(Builder builder) {
        this.category = builder.category;
        this.requestedCount = builder.requestedCount;
        this.geographicFilter = builder.geographicFilter != null && !builder.geographicFilter.isBlank()
                ? builder.geographicFilter.trim() : null;
        this.timeWindow = builder.timeWindow;
        this.minConfidence = builder.minConfidence;
    }

    public static QueryConstraints none() {
        return NONE;
    }

    public Optional<EntityCategory> getCategory() {
        return Optional.ofNullable(category);
    }

    public Optional<Integer> getRequestedCount() {
        return Optional.ofNullable(requestedCount);
    }

    public Optional<String> getGeographicFilter() {
        return Optional.ofNullable(geographicFilter);
    }

    public Optional<TimeWindow> getTimeWindow() {
        return Optional.ofNullable(timeWindow);
    }

    public Optional<Double> getMinConfidence() {
        return Optional.ofNullable(minConfidence);
    }

    /**
     * Describes why these constraints can never be satisfied, if they can't.
     */
    public Optional<String> conflict() {
        if (requestedCount != null && requestedCount <= 0) {
            return Optional.of("requested count must be positive, got " + requestedCount);
        }
        if (timeWindow != null && timeWindow.isInverted()) {
            return Optional.of("time window starts after it ends");
        }
        if (minConfidence != null && (minConfidence < 0.0 || minConfidence > 1.0)) {
            return Optional.of("minimum confidence must be between 0.0 and 1.0, got " + minConfidence);
        }
        return Optional.empty();
    }

    public Builder toBuilder() {
        return new Builder()
                .category(category)
                .requestedCount(requestedCount)
                .geographicFilter(geographicFilter)
                .timeWindow(timeWindow)
                .minConfidence(minConfidence);
    }

    public QueryConstraints withoutTimeWindow() {
        return toBuilder().timeWindow(null).build();
    }

    public QueryConstraints withoutGeographicFilter() {
        return toBuilder().geographicFilter(null).build();
    }

    public QueryConstraints withCategory(EntityCategory newCategory) {
        return toBuilder().category(newCategory).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EntityCategory category;
        private Integer requestedCount;
        private String geographicFilter;
        private TimeWindow timeWindow;
        private Double minConfidence;

        public Builder category(EntityCategory category) {
            this.category = category;
            return this;
        }

        public Builder requestedCount(Integer requestedCount) {
            this.requestedCount = requestedCount;
            return this;
        }

        public Builder geographicFilter(String geographicFilter) {
            this.geographicFilter = geographicFilter;
            return this;
        }

        public Builder timeWindow(TimeWindow timeWindow) {
            this.timeWindow = timeWindow;
            return this;
        }

        public Builder minConfidence(Double minConfidence) {
            this.minConfidence = minConfidence;
            return this;
        }

        public QueryConstraints build() {
            return new QueryConstraints(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueryConstraints that = (QueryConstraints) o;
        return category == that.category
                && Objects.equals(requestedCount, that.requestedCount)
                && Objects.equals(geographicFilter, that.geographicFilter)
                && Objects.equals(timeWindow, that.timeWindow)
                && Objects.equals(minConfidence, that.minConfidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, requestedCount, geographicFilter, timeWindow, minConfidence);
    }

    @Override
    public String toString() {
        return "QueryConstraints{" +
                "category=" + category +
                ", requestedCount=" + requestedCount +
                ", geographicFilter='" + geographicFilter + '\'' +
                ", timeWindow=" + timeWindow +
                ", minConfidence=" + minConfidence +
                '}';
    }
}
