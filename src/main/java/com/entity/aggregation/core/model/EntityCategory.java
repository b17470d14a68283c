package com.entity.aggregation.core.model;

/**
 * Categories an extracted entity can belong to.
 */
public enum EntityCategory {
    PRODUCT("Product"),
    LOCATION("Location"),
    PERSON("Person"),
    CONCEPT("Concept"),
    ADVICE("Advice");

    private final String label;

    EntityCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
