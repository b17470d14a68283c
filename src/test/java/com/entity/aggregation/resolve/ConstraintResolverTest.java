package com.entity.aggregation.resolve;

import com.entity.aggregation.core.model.AggregatedEntity;
import com.entity.aggregation.core.model.EntityCategory;
import com.entity.aggregation.core.model.QueryConstraints;
import com.entity.aggregation.core.model.ScoreBreakdown;
import com.entity.aggregation.core.model.ScoredEntity;
import com.entity.aggregation.core.model.TimeWindow;
import com.entity.aggregation.rules.DefaultNormalizationRules;
import com.entity.aggregation.rules.NormalizationEngine;
import com.entity.aggregation.rules.SynonymTableLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.entity.aggregation.testing.EntityFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConstraintResolver Tests")
class ConstraintResolverTest {

    private ConstraintResolver resolver;

    @BeforeEach
    void setUp() {
        NormalizationEngine engine = DefaultNormalizationRules.createDefaultEngine();
        resolver = new ConstraintResolver(new TextMatcher(engine, new SynonymTableLoader(engine).loadDefault()), 10);
    }

    private static ScoredEntity scored(AggregatedEntity entity, double relevance) {
        return new ScoredEntity(entity, new ScoreBreakdown(relevance, 0, 0, 0, entity.getAggregatedConfidence()));
    }

    private static ScoredEntity location(String key, double relevance, String snippet) {
        return scored(AggregatedEntity.of(keyed(key,
                raw(key, EntityCategory.LOCATION, 0.7, "item-" + key, daysAgo(3), snippet, 0))), relevance);
    }

    @Nested
    @DisplayName("Counting")
    class Counting {

        private List<ScoredEntity> fiveLocations;

        @BeforeEach
        void setUp() {
            fiveLocations = List.of(
                    location("louvre", 0.41, ""),
                    location("shakespeare and company", 0.93, ""),
                    location("jardin du luxembourg", 0.77, ""),
                    location("sacre coeur", 0.12, ""),
                    location("canal saint martin", 0.65, ""));
        }

        @Test
        @DisplayName("Top 3 of 5 places, highest first")
        void exactCount() {
            Resolution resolution = resolver.resolve(fiveLocations, QueryConstraints.builder()
                    .category(EntityCategory.LOCATION).requestedCount(3).build());

            assertEquals(List.of("shakespeare and company", "jardin du luxembourg", "canal saint martin"),
                    resolution.results().stream().map(s -> s.entity().getCanonicalKey()).toList());
            assertEquals(5, resolution.totalMatched());
            assertFalse(resolution.insufficientCount());
        }

        @Test
        @DisplayName("Asking for more than exists returns everything and flags it")
        void insufficientCount() {
            Resolution resolution = resolver.resolve(fiveLocations, QueryConstraints.builder()
                    .category(EntityCategory.LOCATION).requestedCount(8).build());

            assertEquals(5, resolution.results().size());
            assertTrue(resolution.insufficientCount());
        }

        @Test
        @DisplayName("Without a count the default cap applies and nothing is flagged")
        void defaultCap() {
            List<ScoredEntity> many = new ArrayList<>();
            for (int i = 0; i < 15; i++) {
                many.add(location("place " + (char) ('a' + i), i / 100.0, ""));
            }

            Resolution resolution = resolver.resolve(many, QueryConstraints.none());

            assertEquals(10, resolution.results().size());
            assertEquals(15, resolution.totalMatched());
            assertFalse(resolution.insufficientCount());
        }

        @Test
        @DisplayName("Equal relevance is ordered by canonical key")
        void tieBreak() {
            Resolution resolution = resolver.resolve(List.of(
                    location("zoo", 0.5, ""), location("aquarium", 0.5, ""), location("museum", 0.5, "")),
                    QueryConstraints.none());

            assertEquals(List.of("aquarium", "museum", "zoo"),
                    resolution.results().stream().map(s -> s.entity().getCanonicalKey()).toList());
        }
    }

    @Nested
    @DisplayName("Filtering")
    class Filtering {

        @Test
        @DisplayName("Category filter is exact")
        void category() {
            ScoredEntity product = scored(aggregate("matcha", EntityCategory.PRODUCT, 0.5, "I1", NOW), 0.9);
            ScoredEntity place = location("louvre", 0.5, "");

            Resolution resolution = resolver.resolve(List.of(product, place),
                    QueryConstraints.builder().category(EntityCategory.PRODUCT).build());

            assertEquals(List.of(product), resolution.results());
        }

        @Test
        @DisplayName("Place filter matches whole words in keys and snippets")
        void geographic() {
            ScoredEntity inKey = location("paris cafe", 0.5, "");
            ScoredEntity inSnippet = location("shakespeare and company", 0.4, "Best bookshop in Paris!");
            ScoredEntity parisian = location("parisian bakery", 0.3, "Parisian vibes");
            ScoredEntity elsewhere = location("blue bottle", 0.2, "Oakland coffee");

            Resolution resolution = resolver.resolve(List.of(inKey, inSnippet, parisian, elsewhere),
                    QueryConstraints.builder().geographicFilter("paris").build());

            assertEquals(List.of(inKey, inSnippet), resolution.results());
        }

        @Test
        @DisplayName("Place filter goes through synonyms")
        void geographicSynonyms() {
            ScoredEntity nyc = location("katz deli", 0.5, "Pastrami in NYC");

            Resolution resolution = resolver.resolve(List.of(nyc),
                    QueryConstraints.builder().geographicFilter("New York City").build());

            assertEquals(1, resolution.results().size());
        }

        @Test
        @DisplayName("Time window keeps entities with a source inside it")
        void timeWindow() {
            AggregatedEntity old = aggregate("louvre", EntityCategory.LOCATION, 0.5, "I1", daysAgo(90));
            AggregatedEntity spanning = old.merge(aggregate("louvre", EntityCategory.LOCATION, 0.5, "I2", daysAgo(2)));

            QueryConstraints lastWeek = QueryConstraints.builder().timeWindow(TimeWindow.since(daysAgo(7))).build();

            assertTrue(resolver.resolve(List.of(scored(old, 0.5)), lastWeek).isEmpty());
            assertEquals(1, resolver.resolve(List.of(scored(spanning, 0.5)), lastWeek).results().size());
        }

        @Test
        @DisplayName("Minimum confidence drops weak entities")
        void minConfidence() {
            ScoredEntity weak = scored(aggregate("rumor", EntityCategory.CONCEPT, 0.2, "I1", NOW), 0.9);
            ScoredEntity strong = scored(aggregate("fact", EntityCategory.CONCEPT, 0.9, "I2", NOW), 0.1);

            Resolution resolution = resolver.resolve(List.of(weak, strong),
                    QueryConstraints.builder().minConfidence(0.5).build());

            assertEquals(List.of(strong), resolution.results());
        }

        @Test
        @DisplayName("Contradictory constraints yield an empty resolution with the reason")
        void conflict() {
            Resolution resolution = resolver.resolve(List.of(location("louvre", 0.5, "")),
                    QueryConstraints.builder().requestedCount(-1).build());

            assertTrue(resolution.isEmpty());
            assertTrue(resolution.hasConflict());
        }
    }

    @Test
    @DisplayName("Default cap must be positive")
    void rejectsInvalidCap() {
        NormalizationEngine engine = DefaultNormalizationRules.createDefaultEngine();
        assertThrows(IllegalArgumentException.class,
                () -> new ConstraintResolver(new TextMatcher(engine, null), 0));
    }
}
