package com.entity.aggregation.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Decides which canonical keys of one category are surface variants of the same entity.
 *
 * <p>Similarity of two keys is the larger of a character score (mean of Levenshtein and
 * Jaro-Winkler) and a token-set score. Keys are clustered as connected components of the
 * "similar enough" graph over blocked candidate pairs. The components depend only on the
 * set of keys, never on the order they were seen in.</p>
 */
public class FuzzyKeyMatcher {
    private static final Logger log = LoggerFactory.getLogger(FuzzyKeyMatcher.class);

    private final FuzzyMatchOptions options;
    private final BlockingKeyStrategy blocking;
    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();
    private final JaroWinklerSimilarity jaroWinkler = new JaroWinklerSimilarity();
    private final TokenSetSimilarity tokenSet = new TokenSetSimilarity();

    public FuzzyKeyMatcher(FuzzyMatchOptions options) {
        this(options, new DefaultBlockingKeyStrategy());
    }

    public FuzzyKeyMatcher(FuzzyMatchOptions options, BlockingKeyStrategy blocking) {
        this.options = options;
        this.blocking = blocking;
    }

    public FuzzyMatchOptions getOptions() {
        return options;
    }

    public double similarity(String a, String b) {
        if (a.equals(b)) {
            return 1.0;
        }
        double character = (levenshtein.compute(a, b) + jaroWinkler.compute(a, b)) / 2.0;
        return Math.max(character, tokenSet.compute(a, b));
    }

    public boolean matches(String a, String b) {
        if (a.equals(b)) {
            return true;
        }
        if (!options.enabled()
                || a.length() < options.minKeyLength() || b.length() < options.minKeyLength()) {
            return false;
        }
        return similarity(a, b) >= options.threshold();
    }

    /**
     * Partitions keys into clusters of matching keys. Every key lands in exactly one cluster;
     * clusters are returned ordered by their smallest key.
     */
    public List<SortedSet<String>> cluster(Collection<String> keys) {
        List<String> sorted = new ArrayList<>(new TreeSet<>(keys));
        int[] parent = new int[sorted.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }

        if (options.enabled() && sorted.size() > 1) {
            Map<String, List<Integer>> blocks = new TreeMap<>();
            for (int i = 0; i < sorted.size(); i++) {
                for (String blockKey : blocking.generateKeys(sorted.get(i))) {
                    blocks.computeIfAbsent(blockKey, k -> new ArrayList<>()).add(i);
                }
            }
            int comparisons = 0;
            for (List<Integer> block : blocks.values()) {
                for (int x = 0; x < block.size(); x++) {
                    for (int y = x + 1; y < block.size(); y++) {
                        int i = block.get(x);
                        int j = block.get(y);
                        if (find(parent, i) == find(parent, j)) {
                            continue;
                        }
                        comparisons++;
                        if (matches(sorted.get(i), sorted.get(j))) {
                            union(parent, i, j);
                            log.debug("Fuzzy match '{}' ~ '{}'", sorted.get(i), sorted.get(j));
                        }
                    }
                }
            }
            log.trace("Fuzzy clustering of {} keys took {} comparisons", sorted.size(), comparisons);
        }

        Map<Integer, SortedSet<String>> byRoot = new TreeMap<>();
        for (int i = 0; i < sorted.size(); i++) {
            byRoot.computeIfAbsent(find(parent, i), r -> new TreeSet<>()).add(sorted.get(i));
        }
        List<SortedSet<String>> clusters = new ArrayList<>(byRoot.values());
        clusters.sort((c1, c2) -> c1.first().compareTo(c2.first()));
        return clusters;
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int i, int j) {
        int ri = find(parent, i);
        int rj = find(parent, j);
        if (ri != rj) {
            parent[Math.max(ri, rj)] = Math.min(ri, rj);
        }
    }
}
