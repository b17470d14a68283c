package com.entity.aggregation.resolve;

import com.entity.aggregation.core.model.EntityCategory;
import com.entity.aggregation.rules.NormalizationEngine;
import com.entity.aggregation.rules.SynonymTable;

/**
 * Whole-token phrase matching on normalized text, so that "Paris" matches "paris cafe"
 * and "cafe in paris" but not "parisian".
 */
public class TextMatcher {

    private final NormalizationEngine engine;
    private final SynonymTable synonyms;

    public TextMatcher(NormalizationEngine engine, SynonymTable synonyms) {
        this.engine = engine;
        this.synonyms = synonyms;
    }

    /**
     * Normalizes free text the same way place names are canonicalized.
     */
    public String normalize(String text) {
        return synonyms.apply(engine.normalize(text, EntityCategory.LOCATION));
    }

    /**
     * @param normalizedPhrase phrase already passed through {@link #normalize}
     * @param normalizedText   text already passed through {@link #normalize}
     */
    public boolean containsPhrase(String normalizedText, String normalizedPhrase) {
        if (normalizedPhrase == null || normalizedPhrase.isEmpty()
                || normalizedText == null || normalizedText.isEmpty()) {
            return false;
        }
        return (" " + normalizedText + " ").contains(" " + normalizedPhrase + " ");
    }
}
