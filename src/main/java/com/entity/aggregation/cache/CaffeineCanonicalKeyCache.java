package com.entity.aggregation.cache;

import com.entity.aggregation.core.model.EntityCategory;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Caffeine-backed canonical key cache, bounded by size.
 */
public class CaffeineCanonicalKeyCache implements CanonicalKeyCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineCanonicalKeyCache.class);

    private final Cache<CacheKey, String> cache;

    public CaffeineCanonicalKeyCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .build();
        log.info("CaffeineCanonicalKeyCache initialized: maxSize={}", config.maxSize());
    }

    @Override
    public String get(String name, EntityCategory category, String tableVersion, Supplier<String> loader) {
        return cache.get(new CacheKey(name, category, tableVersion), key -> loader.get());
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all canonical key cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    record CacheKey(String name, EntityCategory category, String tableVersion) {}
}
