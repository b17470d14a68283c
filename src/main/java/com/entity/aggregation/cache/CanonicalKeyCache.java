package com.entity.aggregation.cache;

import com.entity.aggregation.core.model.EntityCategory;

import java.util.function.Supplier;

/**
 * Memoizes canonical keys. Canonicalization is a pure function of name, category and
 * synonym table version, so entries never go stale; they are only evicted for size.
 */
public interface CanonicalKeyCache {

    /**
     * Returns the cached key or computes, stores and returns it.
     *
     * @param name         raw entity name
     * @param category     entity category
     * @param tableVersion synonym table version the key is computed with
     * @param loader       computes the key on a miss
     */
    String get(String name, EntityCategory category, String tableVersion, Supplier<String> loader);

    void invalidateAll();

    CacheStats getStats();

    static CanonicalKeyCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineCanonicalKeyCache(config) : new NoOpCanonicalKeyCache();
    }
}
