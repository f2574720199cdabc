package com.supplier.matching.metrics;

import com.supplier.matching.core.model.MatchingMode;
import com.supplier.matching.core.model.WarningType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code matching.run.duration} Timer (tags: mode, outcome)</li>
 *   <li>{@code matching.batch.size} DistributionSummary</li>
 *   <li>{@code matching.candidate.pairs} DistributionSummary</li>
 *   <li>{@code matching.pair.score} DistributionSummary</li>
 *   <li>{@code matching.pairs.matched} Counter (tag: mode)</li>
 *   <li>{@code matching.group.size} DistributionSummary</li>
 *   <li>{@code matching.warnings} Counter (tag: type)</li>
 *   <li>{@code matching.cache.hit} / {@code matching.cache.miss} Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary batchSizeSummary;
    private final DistributionSummary candidatePairsSummary;
    private final DistributionSummary pairScoreSummary;
    private final DistributionSummary groupSizeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.batchSizeSummary = DistributionSummary.builder("matching.batch.size")
                .description("Number of products per matching run")
                .register(registry);
        this.candidatePairsSummary = DistributionSummary.builder("matching.candidate.pairs")
                .description("Number of candidate pairs scored per run")
                .register(registry);
        this.pairScoreSummary = DistributionSummary.builder("matching.pair.score")
                .description("Distribution of hybrid pair scores")
                .register(registry);
        this.groupSizeSummary = DistributionSummary.builder("matching.group.size")
                .description("Number of members per matching group")
                .register(registry);
        this.cacheHitCounter = Counter.builder("matching.cache.hit")
                .description("Number of feature cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("matching.cache.miss")
                .description("Number of feature cache misses")
                .register(registry);
    }

    @Override
    public void recordRunDuration(MatchingMode mode, boolean success, Duration duration) {
        String outcome = success ? "success" : "failure";
        Timer timer = timerCache.computeIfAbsent(mode.name() + ":" + outcome, k ->
                Timer.builder("matching.run.duration")
                        .description("Duration of matching runs")
                        .tag("mode", mode.name())
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordCandidatePairs(int count) {
        candidatePairsSummary.record(count);
    }

    @Override
    public void recordPairScore(double score) {
        pairScoreSummary.record(score);
    }

    @Override
    public void incrementMatchedPairs(MatchingMode mode, long count) {
        Counter counter = counterCache.computeIfAbsent("matched:" + mode.name(), k ->
                Counter.builder("matching.pairs.matched")
                        .description("Number of pairs at or above the threshold")
                        .tag("mode", mode.name())
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void recordGroupSize(int size) {
        groupSizeSummary.record(size);
    }

    @Override
    public void incrementWarning(WarningType type) {
        Counter counter = counterCache.computeIfAbsent("warning:" + type.name(), k ->
                Counter.builder("matching.warnings")
                        .description("Number of data quality warnings")
                        .tag("type", type.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
