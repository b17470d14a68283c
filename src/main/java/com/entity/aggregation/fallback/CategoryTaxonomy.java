package com.entity.aggregation.fallback;

import com.entity.aggregation.core.model.EntityCategory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Which categories a query may be broadened to when its own category finds nothing.
 * Concepts and advice are siblings; products, places and people broaden to concepts.
 */
public final class CategoryTaxonomy {

    private static final CategoryTaxonomy DEFAULT;

    static {
        Map<EntityCategory, List<EntityCategory>> related = new EnumMap<>(EntityCategory.class);
        related.put(EntityCategory.PRODUCT, List.of(EntityCategory.CONCEPT));
        related.put(EntityCategory.LOCATION, List.of(EntityCategory.CONCEPT));
        related.put(EntityCategory.PERSON, List.of(EntityCategory.CONCEPT));
        related.put(EntityCategory.CONCEPT, List.of(EntityCategory.ADVICE));
        related.put(EntityCategory.ADVICE, List.of(EntityCategory.CONCEPT));
        DEFAULT = new CategoryTaxonomy(related);
    }

    private final Map<EntityCategory, List<EntityCategory>> related;

    public CategoryTaxonomy(Map<EntityCategory, List<EntityCategory>> related) {
        Map<EntityCategory, List<EntityCategory>> copy = new EnumMap<>(EntityCategory.class);
        related.forEach((category, siblings) -> copy.put(category, List.copyOf(siblings)));
        this.related = copy;
    }

    public static CategoryTaxonomy defaultTaxonomy() {
        return DEFAULT;
    }

    /**
     * Categories to try, in order, when broadening a query about {@code category}.
     */
    public List<EntityCategory> broaden(EntityCategory category) {
        return related.getOrDefault(category, List.of());
    }
}
