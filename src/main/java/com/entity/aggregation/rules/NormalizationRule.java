package com.entity.aggregation.rules;

import com.entity.aggregation.core.model.EntityCategory;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One rewrite step of canonical key computation, run on a name that is already
 * diacritic-free and lower-cased.
 *
 * <p>Examples from {@link DefaultNormalizationRules}: {@code (^|\s)[#@]+} drops hashtag and
 * handle markers so {@code #ParisCafe} and {@code ParisCafe} meet; {@code ^the\s+} drops a
 * leading article, but only for {@link EntityCategory#LOCATION} and
 * {@link EntityCategory#PRODUCT}, so "The Louvre" and "Louvre" share a key while a concept
 * such as "the slow life" keeps it.</p>
 *
 * <p>The engine runs rules by ascending {@code priority}, ties by name. Marker stripping sits
 * at 5, category rules around 10-20, punctuation replacement last at 100.</p>
 */
public class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final Set<EntityCategory> categories;
    private final int priority;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = compile(builder.name, builder.pattern);
        this.replacement = builder.replacement;
        this.categories = builder.categories.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(builder.categories));
        this.priority = builder.priority;
    }

    private static Pattern compile(String ruleName, String regex) {
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Rule '" + ruleName + "' has an invalid pattern: " + e.getDescription(), e);
        }
    }

    public String getName() {
        return name;
    }

    public Pattern getPattern() {
        return pattern;
    }

    /**
     * Categories this rule is limited to; empty for rules that run on every category.
     */
    public Set<EntityCategory> getCategories() {
        return categories;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isCategoryScoped() {
        return !categories.isEmpty();
    }

    public boolean appliesTo(EntityCategory category) {
        return categories.isEmpty() || categories.contains(category);
    }

    /**
     * Rewrites every match in {@code name}. Whitespace left behind is collapsed by the engine.
     */
    public String apply(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return pattern.matcher(name).replaceAll(replacement);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NormalizationRule that = (NormalizationRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "NormalizationRule{" + name + " /" + pattern.pattern() + "/ -> '" + replacement + "'" +
                (categories.isEmpty() ? "" : " " + categories) +
                ", priority=" + priority + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement = "";
        private Set<EntityCategory> categories = Set.of();
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        /**
         * Replacement text; group references such as {@code $1} are allowed. Defaults to removal.
         */
        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder categories(EntityCategory... categories) {
            this.categories = Set.of(categories);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the name is blank or the pattern does not compile
         */
        public NormalizationRule build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name is required");
            }
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(replacement, "replacement is required");
            return new NormalizationRule(this);
        }
    }
}
