package com.entity.aggregation.rules;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Versioned alias lookup applied to normalized keys, e.g. {@code ig -> instagram}.
 *
 * <p>Aliases may span several tokens ({@code nyc -> new york city}, {@code la croix -> lacroix}).
 * Lookup scans the key left to right and replaces the longest alias starting at each token.
 * Replacement output is not looked up again, so the mapping always terminates.</p>
 */
public final class SynonymTable {

    private static final SynonymTable EMPTY = new SynonymTable("empty", Map.of());

    private final String version;
    private final Map<String, String> aliases;
    private final Set<String> canonicalForms;
    private final int longestAlias;

    /**
     * @param version identifier of this table revision, part of every canonical key's provenance
     * @param aliases alias to canonical form; both sides must already be normalized
     */
    public SynonymTable(String version, Map<String, String> aliases) {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("version is required");
        }
        Objects.requireNonNull(aliases, "aliases is required");
        this.version = version;
        this.aliases = Collections.unmodifiableMap(new TreeMap<>(aliases));
        this.canonicalForms = Set.copyOf(aliases.values());
        this.longestAlias = aliases.keySet().stream()
                .mapToInt(alias -> alias.split(" ").length)
                .max()
                .orElse(0);
    }

    public static SynonymTable empty() {
        return EMPTY;
    }

    public String getVersion() {
        return version;
    }

    public Map<String, String> getAliases() {
        return aliases;
    }

    public int size() {
        return aliases.size();
    }

    /**
     * Rewrites a normalized key through the alias table.
     */
    public String apply(String normalizedKey) {
        if (normalizedKey == null || normalizedKey.isEmpty() || aliases.isEmpty()) {
            return normalizedKey;
        }
        String whole = aliases.get(normalizedKey);
        if (whole != null) {
            return whole;
        }
        if (canonicalForms.contains(normalizedKey)) {
            return normalizedKey;
        }

        String[] tokens = normalizedKey.split(" ");
        StringBuilder out = new StringBuilder(normalizedKey.length());
        int i = 0;
        while (i < tokens.length) {
            int matched = 0;
            String replacement = null;
            for (int len = Math.min(longestAlias, tokens.length - i); len >= 1; len--) {
                String phrase = String.join(" ", Arrays.copyOfRange(tokens, i, i + len));
                replacement = aliases.get(phrase);
                if (replacement != null) {
                    matched = len;
                    break;
                }
            }
            if (out.length() > 0) {
                out.append(' ');
            }
            if (matched > 0) {
                out.append(replacement);
                i += matched;
            } else {
                out.append(tokens[i]);
                i++;
            }
        }
        return out.toString();
    }

    @Override
    public String toString() {
        return "SynonymTable{version='" + version + "', aliases=" + aliases.size() + '}';
    }
}
