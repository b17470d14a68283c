package com.entity.aggregation.similarity;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Blocks on two complementary keys:
 * <ul>
 *   <li><b>Prefix</b>: first 3 characters ({@code pfx:sta}), catches truncations and typos at the end</li>
 *   <li><b>Smallest token</b>: alphabetically first token ({@code tok:cafe}), catches reordered words</li>
 * </ul>
 */
public class DefaultBlockingKeyStrategy implements BlockingKeyStrategy {

    @Override
    public Set<String> generateKeys(String canonicalKey) {
        Set<String> keys = new LinkedHashSet<>();
        if (canonicalKey == null || canonicalKey.isBlank()) {
            return keys;
        }
        String cleaned = canonicalKey.trim();
        keys.add("pfx:" + cleaned.substring(0, Math.min(3, cleaned.length())));

        Set<String> tokens = TokenSetSimilarity.tokens(cleaned);
        if (!tokens.isEmpty()) {
            keys.add("tok:" + tokens.iterator().next());
        }
        return keys;
    }
}
