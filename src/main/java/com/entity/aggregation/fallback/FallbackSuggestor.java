package com.entity.aggregation.fallback;

import com.entity.aggregation.core.model.EntityCategory;
import com.entity.aggregation.core.model.QueryConstraints;
import com.entity.aggregation.core.model.ScoredEntity;
import com.entity.aggregation.resolve.ConstraintResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Suggests how to relax a query that matched nothing.
 *
 * <p>Relaxations are tried against the full candidate pool, each on its own, in this order:</p>
 * <ol>
 *   <li>drop the time window</li>
 *   <li>drop the place filter</li>
 *   <li>switch to a related category, or to any category if no related one matches</li>
 * </ol>
 * Every relaxation that would find at least one saved item becomes a suggestion. Contradictory
 * constraints go through the same steps, so dropping an inverted time window is offered. The
 * "nothing saved matches" explanation always comes last, so the result is never empty.
 */
public class FallbackSuggestor {
    private static final Logger log = LoggerFactory.getLogger(FallbackSuggestor.class);

    private final ConstraintResolver resolver;
    private final CategoryTaxonomy taxonomy;

    public FallbackSuggestor(ConstraintResolver resolver) {
        this(resolver, CategoryTaxonomy.defaultTaxonomy());
    }

    public FallbackSuggestor(ConstraintResolver resolver, CategoryTaxonomy taxonomy) {
        this.resolver = resolver;
        this.taxonomy = taxonomy;
    }

    /**
     * @param constraints the constraints that produced no results
     * @param pool        every scored candidate of the snapshot, unfiltered
     * @return at least one user-facing string; the explanation is always last
     */
    public List<String> suggest(QueryConstraints constraints, List<ScoredEntity> pool) {
        List<String> suggestions = new ArrayList<>();
        try {
            suggestions.addAll(relaxations(constraints, pool));
        } catch (RuntimeException e) {
            // Suggestions are best effort; the explanation below still goes out
            log.warn("Failed to evaluate query relaxations for {}", constraints, e);
            suggestions.clear();
        }
        suggestions.add(explanation(constraints));
        log.debug("Suggested {} relaxations for {}", suggestions.size() - 1, constraints);
        return List.copyOf(suggestions);
    }

    private List<String> relaxations(QueryConstraints constraints, List<ScoredEntity> pool) {
        List<String> found = new ArrayList<>();

        if (constraints.getTimeWindow().isPresent()) {
            int count = count(constraints.withoutTimeWindow(), pool);
            if (count > 0) {
                found.add(String.format("Try any date instead of the selected time range: %s.", items(count)));
            }
        }

        if (constraints.getGeographicFilter().isPresent()) {
            int count = count(constraints.withoutGeographicFilter(), pool);
            if (count > 0) {
                found.add(String.format("Try searching beyond \"%s\": %s.",
                        constraints.getGeographicFilter().get(), items(count)));
            }
        }

        if (constraints.getCategory().isPresent()) {
            EntityCategory category = constraints.getCategory().get();
            boolean broadened = false;
            for (EntityCategory related : taxonomy.broaden(category)) {
                int count = count(constraints.withCategory(related), pool);
                if (count > 0) {
                    broadened = true;
                    found.add(String.format("Try %s instead of %s: %s.",
                            plural(related), plural(category), items(count)));
                }
            }
            if (!broadened) {
                int count = count(constraints.withCategory(null), pool);
                if (count > 0) {
                    found.add(String.format("Try all categories instead of only %s: %s.",
                            plural(category), items(count)));
                }
            }
        }
        return found;
    }

    /**
     * Matches of a relaxed query; zero while the relaxed constraints still contradict each other.
     */
    private int count(QueryConstraints relaxed, List<ScoredEntity> pool) {
        if (relaxed.conflict().isPresent()) {
            return 0;
        }
        return resolver.filter(pool, relaxed).size();
    }

    private static String explanation(QueryConstraints constraints) {
        if (constraints.conflict().isPresent()) {
            return "No matching saved content: the question's filters contradict each other ("
                    + constraints.conflict().get() + ").";
        }
        return constraints.getCategory()
                .map(category -> "No matching saved content: none of your saved posts mention "
                        + plural(category) + " that fit this question.")
                .orElse("No matching saved content: none of your saved posts fit this question.");
    }

    private static String plural(EntityCategory category) {
        switch (category) {
            case PERSON:
                return "people";
            case ADVICE:
                return "advice";
            default:
                return category.getLabel().toLowerCase(Locale.ROOT) + "s";
        }
    }

    private static String items(int count) {
        return count == 1 ? "1 saved item matches" : count + " saved items match";
    }
}
