package com.supplier.matching.cache;

import com.supplier.matching.image.PerceptualHash;

import java.util.Optional;

/**
 * No-op cache implementation. All operations are no-ops.
 * Used as the default when caching is disabled.
 */
public class NoOpFeatureCache implements FeatureCache {

    @Override
    public Optional<String> getNormalizedName(String key) {
        return Optional.empty();
    }

    @Override
    public void putNormalizedName(String key, String normalizedName) {
        // no-op
    }

    @Override
    public Optional<PerceptualHash> getImageHash(String key) {
        return Optional.empty();
    }

    @Override
    public void putImageHash(String key, PerceptualHash hash) {
        // no-op
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
