package com.entity.aggregation.rules;

import com.entity.aggregation.core.model.EntityCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns an entity name into its surface-independent form: diacritics removed, case folded,
 * category rules applied in priority order (lower number first), whitespace collapsed.
 *
 * <p>The rule list is fixed at construction, so an engine is safe to share between threads.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::getPriority)
                .thenComparing(NormalizationRule::getName));
        this.rules = List.copyOf(sorted);
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Normalizes a name for the given category. Returns an empty string for blank input.
     */
    public String normalize(String name, EntityCategory category) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = stripDiacritics(name).toLowerCase(Locale.ROOT);

        for (NormalizationRule rule : rules) {
            if (category == null || rule.appliesTo(category)) {
                String before = result;
                result = rule.apply(result);
                if (!before.equals(result)) {
                    log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
                }
            }
        }

        return WHITESPACE.matcher(result).replaceAll(" ").trim();
    }

    static String stripDiacritics(String input) {
        String decomposed = Normalizer.normalize(input, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }
}
