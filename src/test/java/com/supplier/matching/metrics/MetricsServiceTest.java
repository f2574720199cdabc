package com.supplier.matching.metrics;

import com.supplier.matching.core.model.MatchingMode;
import com.supplier.matching.core.model.WarningType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordRunDuration(MatchingMode.TEXT, true, Duration.ofMillis(100));
                noOp.recordBatchSize(50);
                noOp.recordCandidatePairs(1225);
                noOp.recordPairScore(0.8);
                noOp.incrementMatchedPairs(MatchingMode.HYBRID, 3);
                noOp.recordGroupSize(2);
                noOp.incrementWarning(WarningType.IMAGE_UNAVAILABLE);
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record run duration per mode and outcome")
        void recordRunDuration() {
            metrics.recordRunDuration(MatchingMode.TEXT, true, Duration.ofMillis(150));
            metrics.recordRunDuration(MatchingMode.TEXT, true, Duration.ofMillis(250));
            metrics.recordRunDuration(MatchingMode.TEXT, false, Duration.ofMillis(10));

            Timer success = registry.find("matching.run.duration")
                    .tag("mode", "TEXT")
                    .tag("outcome", "success")
                    .timer();
            assertNotNull(success);
            assertEquals(2, success.count());
            assertEquals(400, success.totalTime(TimeUnit.MILLISECONDS), 1.0);

            Timer failure = registry.find("matching.run.duration").tag("outcome", "failure").timer();
            assertNotNull(failure);
            assertEquals(1, failure.count());
        }

        @Test
        @DisplayName("Should count matched pairs per mode")
        void matchedPairs() {
            metrics.incrementMatchedPairs(MatchingMode.HYBRID, 3);
            metrics.incrementMatchedPairs(MatchingMode.HYBRID, 2);

            Counter counter = registry.find("matching.pairs.matched").tag("mode", "HYBRID").counter();
            assertNotNull(counter);
            assertEquals(5.0, counter.count());
        }

        @Test
        @DisplayName("Should count warnings per type")
        void warnings() {
            metrics.incrementWarning(WarningType.HASH_VERSION_MISMATCH);
            metrics.incrementWarning(WarningType.HASH_VERSION_MISMATCH);
            metrics.incrementWarning(WarningType.CURRENCY_MISMATCH_WITHIN_GROUP);

            assertEquals(2.0, registry.get("matching.warnings")
                    .tag("type", "HASH_VERSION_MISMATCH").counter().count());
            assertEquals(1.0, registry.get("matching.warnings")
                    .tag("type", "CURRENCY_MISMATCH_WITHIN_GROUP").counter().count());
        }

        @Test
        @DisplayName("Should record distributions")
        void distributions() {
            metrics.recordBatchSize(100);
            metrics.recordCandidatePairs(4950);
            metrics.recordPairScore(0.5);
            metrics.recordPairScore(0.9);
            metrics.recordGroupSize(3);

            assertEquals(100.0, registry.get("matching.batch.size").summary().totalAmount());
            assertEquals(4950.0, registry.get("matching.candidate.pairs").summary().totalAmount());
            DistributionSummary scores = registry.get("matching.pair.score").summary();
            assertEquals(2, scores.count());
            assertEquals(0.9, scores.max(), 1e-9);
            assertEquals(3.0, registry.get("matching.group.size").summary().totalAmount());
        }

        @Test
        @DisplayName("Should count cache hits and misses")
        void cacheCounters() {
            metrics.recordCacheHit();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();

            assertEquals(2.0, registry.get("matching.cache.hit").counter().count());
            assertEquals(1.0, registry.get("matching.cache.miss").counter().count());
        }
    }
}
