package com.entity.aggregation.similarity;

/**
 * Edit-distance similarity: {@code 1 - distance / max(|s1|, |s2|)}.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        return 1.0 - (double) distance(s1, s2) / Math.max(s1.length(), s2.length());
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * Wagner-Fischer with a single row over the shorter string.
     */
    static int distance(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;

        int[] row = new int[shorter.length() + 1];
        for (int i = 0; i < row.length; i++) {
            row[i] = i;
        }
        for (int j = 1; j <= longer.length(); j++) {
            int diagonal = row[0];
            row[0] = j;
            char c = longer.charAt(j - 1);
            for (int i = 1; i < row.length; i++) {
                int above = row[i];
                int substitution = diagonal + (shorter.charAt(i - 1) == c ? 0 : 1);
                row[i] = Math.min(substitution, Math.min(above, row[i - 1]) + 1);
                diagonal = above;
            }
        }
        return row[shorter.length()];
    }
}
