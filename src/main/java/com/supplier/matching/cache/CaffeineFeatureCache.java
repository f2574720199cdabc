package com.supplier.matching.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.supplier.matching.image.PerceptualHash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed feature cache. Names and image hashes live in separate caches,
 * each bounded by {@link CacheConfig#maxSize()}.
 */
public class CaffeineFeatureCache implements FeatureCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineFeatureCache.class);

    private final Cache<String, String> names;
    private final Cache<String, PerceptualHash> hashes;

    public CaffeineFeatureCache(CacheConfig config) {
        this.names = newCache(config);
        this.hashes = newCache(config);
        log.info("CaffeineFeatureCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    /**
     * Creates the cache described by the config, or a no-op one when it is disabled.
     */
    public static FeatureCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineFeatureCache(config) : new NoOpFeatureCache();
    }

    @Override
    public Optional<String> getNormalizedName(String key) {
        return Optional.ofNullable(names.getIfPresent(key));
    }

    @Override
    public void putNormalizedName(String key, String normalizedName) {
        names.put(key, normalizedName);
    }

    @Override
    public Optional<PerceptualHash> getImageHash(String key) {
        return Optional.ofNullable(hashes.getIfPresent(key));
    }

    @Override
    public void putImageHash(String key, PerceptualHash hash) {
        hashes.put(key, hash);
    }

    @Override
    public void invalidateAll() {
        names.invalidateAll();
        hashes.invalidateAll();
        log.debug("Invalidated all feature cache entries");
    }

    @Override
    public CacheStats getStats() {
        return toStats(names).plus(toStats(hashes));
    }

    private static <V> Cache<String, V> newCache(CacheConfig config) {
        return Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
    }

    private static CacheStats toStats(Cache<String, ?> cache) {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
