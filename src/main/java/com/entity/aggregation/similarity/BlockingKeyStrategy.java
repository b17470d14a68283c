package com.entity.aggregation.similarity;

import java.util.Set;

/**
 * Generates blocking keys so that fuzzy comparison only runs between keys that share one.
 */
public interface BlockingKeyStrategy {

    Set<String> generateKeys(String canonicalKey);
}
