package com.entity.aggregation.cache;

import com.entity.aggregation.core.model.EntityCategory;

import java.util.function.Supplier;

/**
 * Cache that always computes. Used when caching is disabled.
 */
public class NoOpCanonicalKeyCache implements CanonicalKeyCache {

    @Override
    public String get(String name, EntityCategory category, String tableVersion, Supplier<String> loader) {
        return loader.get();
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
