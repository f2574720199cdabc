package com.supplier.matching.cache;

import com.supplier.matching.image.PerceptualHash;

import java.util.Optional;

/**
 * Memoization of derived product features across runs.
 * Keys come from {@link ContentKeys}. Implementations must be thread-safe.
 */
public interface FeatureCache {

    /**
     * Gets a cached normalized name.
     *
     * @param key content key from {@link ContentKeys#forName}
     * @return the cached value, or empty if not cached
     */
    Optional<String> getNormalizedName(String key);

    void putNormalizedName(String key, String normalizedName);

    /**
     * Gets a cached perceptual hash.
     *
     * @param key content key from {@link ContentKeys#forImage}
     * @return the cached hash, or empty if not cached
     */
    Optional<PerceptualHash> getImageHash(String key);

    void putImageHash(String key, PerceptualHash hash);

    /**
     * Invalidates all cache entries.
     */
    void invalidateAll();

    /**
     * Returns cache statistics summed over both feature kinds.
     */
    CacheStats getStats();
}
