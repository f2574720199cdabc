package com.supplier.matching.metrics;

import com.supplier.matching.core.model.MatchingMode;
import com.supplier.matching.core.model.WarningType;

import java.time.Duration;

/**
 * Interface for recording matching metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordRunDuration(MatchingMode mode, boolean success, Duration duration);

    void recordBatchSize(int size);

    void recordCandidatePairs(int count);

    void recordPairScore(double score);

    void incrementMatchedPairs(MatchingMode mode, long count);

    void recordGroupSize(int size);

    void incrementWarning(WarningType type);

    void recordCacheHit();

    void recordCacheMiss();
}
