package com.entity.aggregation.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * One canonical entity merged across every saved post that mentions it.
 *
 * <p>The state is fully described by the canonical key, category, alias keys, surface form
 * sources and the per-source evidence map. Every other property is derived from those, and
 * every part of the state merges by union, so {@link #merge} is associative, commutative and
 * idempotent: merging the same inputs in any grouping, any number of times, yields equal
 * instances.</p>
 *
 * <p>Instances are immutable; merging returns a new instance.</p>
 */
public final class AggregatedEntity {

    private final String canonicalKey;
    private final EntityCategory category;
    private final SortedSet<String> aliasKeys;
    private final SortedMap<String, SortedSet<SourceRef>> formSources;
    private final SortedMap<SourceRef, SourceEvidence> sources;

    // Derived
    private final SortedMap<String, Integer> surfaceForms;
    private final String displayName;
    private final SortedSet<String> supportingItems;
    private final Instant earliestTimestamp;
    private final Instant latestTimestamp;
    private final double aggregatedConfidence;
    private final double meanEngagement;

    private AggregatedEntity(String canonicalKey, EntityCategory category, SortedSet<String> aliasKeys,
                             SortedMap<String, SortedSet<SourceRef>> formSources,
                             SortedMap<SourceRef, SourceEvidence> sources) {
        this.canonicalKey = Objects.requireNonNull(canonicalKey, "canonicalKey is required");
        this.category = Objects.requireNonNull(category, "category is required");
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("An aggregated entity needs at least one source");
        }
        this.aliasKeys = Collections.unmodifiableSortedSet(new TreeSet<>(aliasKeys));
        SortedMap<String, SortedSet<SourceRef>> formsCopy = new TreeMap<>();
        SortedMap<String, Integer> counts = new TreeMap<>();
        formSources.forEach((form, refs) -> {
            formsCopy.put(form, Collections.unmodifiableSortedSet(new TreeSet<>(refs)));
            counts.put(form, refs.size());
        });
        this.formSources = Collections.unmodifiableSortedMap(formsCopy);
        this.surfaceForms = Collections.unmodifiableSortedMap(counts);
        this.sources = Collections.unmodifiableSortedMap(new TreeMap<>(sources));

        this.displayName = pickDisplayName(this.surfaceForms);

        SortedSet<String> items = new TreeSet<>();
        Map<String, Long> engagementByItem = new TreeMap<>();
        Instant earliest = null;
        Instant latest = null;
        double complement = 1.0;
        // Iteration order is the SourceRef order, so the product is reproducible bit for bit
        for (SourceEvidence evidence : this.sources.values()) {
            items.add(evidence.contentItemId());
            engagementByItem.merge(evidence.contentItemId(), evidence.engagement().total(), Math::max);
            if (earliest == null || evidence.timestamp().isBefore(earliest)) {
                earliest = evidence.timestamp();
            }
            if (latest == null || evidence.timestamp().isAfter(latest)) {
                latest = evidence.timestamp();
            }
            complement *= (1.0 - evidence.confidence());
        }
        this.supportingItems = Collections.unmodifiableSortedSet(items);
        this.earliestTimestamp = earliest;
        this.latestTimestamp = latest;
        this.aggregatedConfidence = 1.0 - complement;
        this.meanEngagement = engagementByItem.values().stream()
                .mapToLong(Long::longValue)
                .average()
                .orElse(0.0);
    }

    /**
     * Creates a single-source aggregate from one normalized mention.
     */
    public static AggregatedEntity of(NormalizedEntity entity) {
        SourceEvidence evidence = entity.toSourceEvidence();
        SortedMap<SourceRef, SourceEvidence> sources = new TreeMap<>();
        sources.put(evidence.ref(), evidence);
        SortedMap<String, SortedSet<SourceRef>> forms = new TreeMap<>();
        forms.put(entity.raw().name().trim(), new TreeSet<>(Set.of(evidence.ref())));
        SortedSet<String> aliases = new TreeSet<>();
        aliases.add(entity.canonicalKey());
        return new AggregatedEntity(entity.canonicalKey(), entity.category(), aliases, forms, sources);
    }

    /**
     * Merges two aggregates of the same canonical key and category.
     *
     * @throws IllegalArgumentException if the keys or categories differ
     */
    public AggregatedEntity merge(AggregatedEntity other) {
        if (!canonicalKey.equals(other.canonicalKey) || category != other.category) {
            throw new IllegalArgumentException("Cannot merge '" + canonicalKey + "' (" + category
                    + ") with '" + other.canonicalKey + "' (" + other.category + ")");
        }
        return combine(other, canonicalKey);
    }

    /**
     * Merges another aggregate of the same category under a new representative key.
     * Used when fuzzy matching decides two canonical keys name the same entity.
     */
    public AggregatedEntity absorb(AggregatedEntity other, String representativeKey) {
        if (category != other.category) {
            throw new IllegalArgumentException("Cannot absorb an entity of category " + other.category
                    + " into " + category);
        }
        return combine(other, representativeKey);
    }

    private AggregatedEntity combine(AggregatedEntity other, String key) {
        SortedSet<String> aliases = new TreeSet<>(aliasKeys);
        aliases.addAll(other.aliasKeys);
        aliases.add(key);

        SortedMap<String, SortedSet<SourceRef>> forms = new TreeMap<>();
        formSources.forEach((form, refs) -> forms.put(form, new TreeSet<>(refs)));
        other.formSources.forEach((form, refs) ->
                forms.computeIfAbsent(form, f -> new TreeSet<>()).addAll(refs));

        SortedMap<SourceRef, SourceEvidence> merged = new TreeMap<>(sources);
        other.sources.forEach((ref, evidence) -> merged.merge(ref, evidence, SourceEvidence::strongest));

        return new AggregatedEntity(key, category, aliases, forms, merged);
    }

    private static String pickDisplayName(SortedMap<String, Integer> forms) {
        String best = null;
        int bestCount = -1;
        // Sorted iteration: the first form reaching the highest count is the lexicographically smallest
        for (Map.Entry<String, Integer> entry : forms.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    public String getCanonicalKey() {
        return canonicalKey;
    }

    public EntityCategory getCategory() {
        return category;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * All canonical keys folded into this entity, including its own.
     */
    public Set<String> getAliasKeys() {
        return aliasKeys;
    }

    /**
     * Original spellings and how many sources used each.
     */
    public Map<String, Integer> getSurfaceForms() {
        return surfaceForms;
    }

    public Set<String> getSupportingItems() {
        return supportingItems;
    }

    /**
     * Number of distinct saved posts mentioning this entity.
     */
    public int getMentionCount() {
        return supportingItems.size();
    }

    public Instant getEarliestTimestamp() {
        return earliestTimestamp;
    }

    public Instant getLatestTimestamp() {
        return latestTimestamp;
    }

    /**
     * Noisy-OR combination of every per-source confidence.
     */
    public double getAggregatedConfidence() {
        return aggregatedConfidence;
    }

    /**
     * Mean raw engagement over supporting posts.
     */
    public double getMeanEngagement() {
        return meanEngagement;
    }

    public List<SourceEvidence> getSources() {
        return List.copyOf(sources.values());
    }

    public List<Double> getSourceConfidences() {
        List<Double> confidences = new ArrayList<>(sources.size());
        for (SourceEvidence evidence : sources.values()) {
            confidences.add(evidence.confidence());
        }
        return confidences;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AggregatedEntity that = (AggregatedEntity) o;
        return canonicalKey.equals(that.canonicalKey)
                && category == that.category
                && aliasKeys.equals(that.aliasKeys)
                && formSources.equals(that.formSources)
                && sources.equals(that.sources);
    }

    @Override
    public int hashCode() {
        return Objects.hash(canonicalKey, category, aliasKeys, formSources, sources);
    }

    @Override
    public String toString() {
        return "AggregatedEntity{" +
                "canonicalKey='" + canonicalKey + '\'' +
                ", category=" + category +
                ", displayName='" + displayName + '\'' +
                ", mentions=" + getMentionCount() +
                ", confidence=" + String.format("%.4f", aggregatedConfidence) +
                '}';
    }
}
