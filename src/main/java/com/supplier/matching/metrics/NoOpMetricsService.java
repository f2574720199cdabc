package com.supplier.matching.metrics;

import com.supplier.matching.core.model.MatchingMode;
import com.supplier.matching.core.model.WarningType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 * All methods are empty, ensuring the library works without any metrics dependencies.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRunDuration(MatchingMode mode, boolean success, Duration duration) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordCandidatePairs(int count) {
    }

    @Override
    public void recordPairScore(double score) {
    }

    @Override
    public void incrementMatchedPairs(MatchingMode mode, long count) {
    }

    @Override
    public void recordGroupSize(int size) {
    }

    @Override
    public void incrementWarning(WarningType type) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
