package com.entity.aggregation.similarity;

import java.util.Set;
import java.util.TreeSet;

/**
 * Jaccard overlap of the keys' token sets. Insensitive to word order,
 * so "cafe paris" and "paris cafe" score 1.0.
 */
public class TokenSetSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isBlank() || s2.isBlank()) {
            return 0.0;
        }
        Set<String> a = tokens(s1);
        Set<String> b = tokens(s2);

        int shared = 0;
        for (String token : a) {
            if (b.contains(token)) {
                shared++;
            }
        }
        return (double) shared / (a.size() + b.size() - shared);
    }

    @Override
    public String getName() {
        return "Token-Set";
    }

    static Set<String> tokens(String key) {
        Set<String> tokens = new TreeSet<>();
        for (String token : key.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
