package com.entity.aggregation.fallback;

import com.entity.aggregation.core.model.AggregatedEntity;
import com.entity.aggregation.core.model.EntityCategory;
import com.entity.aggregation.core.model.QueryConstraints;
import com.entity.aggregation.core.model.ScoreBreakdown;
import com.entity.aggregation.core.model.ScoredEntity;
import com.entity.aggregation.core.model.TimeWindow;
import com.entity.aggregation.resolve.ConstraintResolver;
import com.entity.aggregation.resolve.TextMatcher;
import com.entity.aggregation.rules.DefaultNormalizationRules;
import com.entity.aggregation.rules.NormalizationEngine;
import com.entity.aggregation.rules.SynonymTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.entity.aggregation.testing.EntityFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@DisplayName("FallbackSuggestor Tests")
class FallbackSuggestorTest {

    private static ScoredEntity scored(String key, EntityCategory category, int daysAgo, String snippet) {
        AggregatedEntity entity = AggregatedEntity.of(keyed(key,
                raw(key, category, 0.7, "item-" + key, daysAgo(daysAgo), snippet, 0)));
        return new ScoredEntity(entity, new ScoreBreakdown(0.5, 0, 0, 0, 0.7));
    }

    @Nested
    @DisplayName("Relaxation ladder")
    class Ladder {

        private FallbackSuggestor suggestor;
        private List<ScoredEntity> pool;

        @BeforeEach
        void setUp() {
            NormalizationEngine engine = DefaultNormalizationRules.createDefaultEngine();
            suggestor = new FallbackSuggestor(new ConstraintResolver(new TextMatcher(engine, SynonymTable.empty()), 10));
            pool = List.of(
                    scored("louvre", EntityCategory.LOCATION, 60, "Museum day in Paris"),
                    scored("tate modern", EntityCategory.LOCATION, 90, "Rainy London afternoon"),
                    scored("minimalism", EntityCategory.CONCEPT, 2, "Less is more"),
                    scored("declutter weekly", EntityCategory.ADVICE, 3, "Tip of the day"));
        }

        @Test
        @DisplayName("A too narrow time window suggests dropping it first")
        void timeWindowFirst() {
            QueryConstraints constraints = QueryConstraints.builder()
                    .category(EntityCategory.LOCATION)
                    .timeWindow(TimeWindow.since(daysAgo(7)))
                    .build();

            List<String> suggestions = suggestor.suggest(constraints, pool);

            assertTrue(suggestions.size() >= 2);
            assertTrue(suggestions.get(0).contains("any date"), suggestions.get(0));
            assertTrue(suggestions.get(0).contains("2 saved items match"), suggestions.get(0));
            assertTrue(suggestions.get(suggestions.size() - 1).startsWith("No matching saved content"));
        }

        @Test
        @DisplayName("A place nobody saved suggests searching elsewhere")
        void dropGeographicFilter() {
            QueryConstraints constraints = QueryConstraints.builder()
                    .category(EntityCategory.LOCATION)
                    .geographicFilter("Tokyo")
                    .build();

            List<String> suggestions = suggestor.suggest(constraints, pool);

            assertEquals(2, suggestions.size());
            assertTrue(suggestions.get(0).contains("beyond \"Tokyo\""), suggestions.get(0));
        }

        @Test
        @DisplayName("Each relaxation is tried on its own")
        void independentRungs() {
            QueryConstraints constraints = QueryConstraints.builder()
                    .category(EntityCategory.LOCATION)
                    .geographicFilter("Paris")
                    .timeWindow(TimeWindow.since(daysAgo(7)))
                    .build();

            List<String> suggestions = suggestor.suggest(constraints, pool);

            assertTrue(suggestions.get(0).contains("any date"));
            assertTrue(suggestions.get(0).contains("1 saved item matches"));
            assertTrue(suggestions.stream().noneMatch(s -> s.contains("beyond")));
        }

        @Test
        @DisplayName("An empty category suggests related categories")
        void siblingCategory() {
            List<String> suggestions = suggestor.suggest(
                    QueryConstraints.builder().category(EntityCategory.PRODUCT).build(), pool);

            assertEquals(2, suggestions.size());
            assertTrue(suggestions.get(0).startsWith("Try concepts instead of products"), suggestions.get(0));
        }

        @Test
        @DisplayName("Without a matching related category every category is suggested")
        void anyCategory() {
            List<ScoredEntity> placesOnly = pool.subList(0, 2);

            List<String> suggestions = suggestor.suggest(
                    QueryConstraints.builder().category(EntityCategory.PERSON).build(), placesOnly);

            assertTrue(suggestions.get(0).startsWith("Try all categories instead of only people"), suggestions.get(0));
        }

        @Test
        @DisplayName("Nothing to relax still explains the empty answer")
        void explanationOnly() {
            List<String> suggestions = suggestor.suggest(QueryConstraints.none(), List.of());

            assertEquals(1, suggestions.size());
            assertTrue(suggestions.get(0).startsWith("No matching saved content"));
        }

        @Test
        @DisplayName("An inverted time window is offered to be dropped")
        void invertedWindowRelaxed() {
            QueryConstraints constraints = QueryConstraints.builder()
                    .category(EntityCategory.LOCATION)
                    .timeWindow(TimeWindow.between(daysAgo(1), daysAgo(30)))
                    .build();

            List<String> suggestions = suggestor.suggest(constraints, pool);

            assertEquals(2, suggestions.size());
            assertTrue(suggestions.get(0).startsWith("Try any date"), suggestions.get(0));
            assertTrue(suggestions.get(0).contains("2 saved items match"), suggestions.get(0));
            assertTrue(suggestions.get(1).contains("contradict"), suggestions.get(1));
        }

        @Test
        @DisplayName("A contradiction no relaxation removes is only explained")
        void unresolvableConflict() {
            List<String> suggestions = suggestor.suggest(
                    QueryConstraints.builder().requestedCount(0).timeWindow(TimeWindow.since(daysAgo(7))).build(), pool);

            assertEquals(1, suggestions.size());
            assertTrue(suggestions.get(0).contains("contradict"));
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Failure handling")
    class Failures {

        @Mock
        private ConstraintResolver resolver;

        @Test
        @DisplayName("Never throws and still returns the explanation")
        void totality() {
            when(resolver.filter(any(), any())).thenThrow(new IllegalStateException("boom"));
            FallbackSuggestor suggestor = new FallbackSuggestor(resolver);

            List<String> suggestions = assertDoesNotThrow(() -> suggestor.suggest(
                    QueryConstraints.builder().timeWindow(TimeWindow.since(NOW)).build(),
                    List.of(scored("louvre", EntityCategory.LOCATION, 1, ""))));

            assertEquals(1, suggestions.size());
            assertTrue(suggestions.get(0).startsWith("No matching saved content"));
        }
    }

    @Test
    @DisplayName("Taxonomy broadens concepts to advice and back")
    void taxonomy() {
        CategoryTaxonomy taxonomy = CategoryTaxonomy.defaultTaxonomy();

        assertEquals(List.of(EntityCategory.ADVICE), taxonomy.broaden(EntityCategory.CONCEPT));
        assertEquals(List.of(EntityCategory.CONCEPT), taxonomy.broaden(EntityCategory.ADVICE));
        assertEquals(List.of(EntityCategory.CONCEPT), taxonomy.broaden(EntityCategory.LOCATION));
    }
}
