package com.entity.aggregation.rules;

import com.entity.aggregation.core.model.EntityCategory;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in rules for names extracted from captions, hashtags, transcripts and images.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    public static NormalizationEngine createDefaultEngine() {
        List<NormalizationRule> rules = new ArrayList<>();
        rules.addAll(getCommonRules());
        rules.addAll(getPersonRules());
        rules.addAll(getPlaceAndProductRules());
        return new NormalizationEngine(rules);
    }

    /**
     * Rules for every category.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                // Hashtag and handle markers: "#ParisCafe", "@glossier"
                NormalizationRule.builder()
                        .name("common-tag-marker")
                        .pattern("(^|\\s)[#@]+")
                        .replacement("$1")
                        .priority(5)
                        .build(),

                // Apostrophes join rather than split: "joe's" -> "joes"
                NormalizationRule.builder()
                        .name("common-apostrophe")
                        .pattern("['’]")
                        .replacement("")
                        .priority(40)
                        .build(),

                NormalizationRule.builder()
                        .name("common-ampersand")
                        .pattern("\\s*&\\s*")
                        .replacement(" and ")
                        .priority(50)
                        .build(),

                // Everything that is not a letter, digit or space
                NormalizationRule.builder()
                        .name("common-punctuation")
                        .pattern("[^\\p{L}\\p{N}\\s]")
                        .replacement(" ")
                        .priority(100)
                        .build()
        );
    }

    public static List<NormalizationRule> getPersonRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("person-title")
                        .pattern("^(mr|mrs|ms|dr|chef)\\.?\\s+")
                        .replacement("")
                        .categories(EntityCategory.PERSON)
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("person-suffix")
                        .pattern(",?\\s+(jr|sr)\\.?$")
                        .replacement("")
                        .categories(EntityCategory.PERSON)
                        .priority(10)
                        .build()
        );
    }

    public static List<NormalizationRule> getPlaceAndProductRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("leading-article")
                        .pattern("^the\\s+")
                        .replacement("")
                        .categories(EntityCategory.LOCATION, EntityCategory.PRODUCT)
                        .priority(20)
                        .build()
        );
    }
}
