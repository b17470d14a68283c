package com.entity.aggregation.core.model;

import java.time.Instant;

/**
 * An entity mention as produced by an upstream extractor for one saved post.
 *
 * <p>Instances are never mutated. Fields are not validated here because upstream records
 * may be incomplete; the normalizer decides whether a mention is usable.</p>
 *
 * @param name             surface form as extracted
 * @param category         entity category
 * @param confidence       extractor confidence in [0, 1]
 * @param modality         which part of the post the mention came from
 * @param context          text snippet surrounding the mention
 * @param contentItemId    id of the saved post
 * @param contentTimestamp when the post was published
 * @param engagement       engagement counters of the post
 */
public record RawEntity(
        String name,
        EntityCategory category,
        double confidence,
        SourceModality modality,
        String context,
        String contentItemId,
        Instant contentTimestamp,
        EngagementMetrics engagement
) {
    public RawEntity {
        engagement = engagement != null ? engagement : EngagementMetrics.none();
        context = context != null ? context : "";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private EntityCategory category;
        private double confidence = 1.0;
        private SourceModality modality = SourceModality.CAPTION;
        private String context;
        private String contentItemId;
        private Instant contentTimestamp;
        private EngagementMetrics engagement;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder category(EntityCategory category) {
            this.category = category;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder modality(SourceModality modality) {
            this.modality = modality;
            return this;
        }

        public Builder context(String context) {
            this.context = context;
            return this;
        }

        public Builder contentItemId(String contentItemId) {
            this.contentItemId = contentItemId;
            return this;
        }

        public Builder contentTimestamp(Instant contentTimestamp) {
            this.contentTimestamp = contentTimestamp;
            return this;
        }

        public Builder engagement(EngagementMetrics engagement) {
            this.engagement = engagement;
            return this;
        }

        public RawEntity build() {
            return new RawEntity(name, category, confidence, modality, context,
                    contentItemId, contentTimestamp, engagement);
        }
    }
}
