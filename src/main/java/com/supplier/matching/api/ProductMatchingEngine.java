package com.supplier.matching.api;

import com.supplier.matching.cache.FeatureCache;
import com.supplier.matching.cache.NoOpFeatureCache;
import com.supplier.matching.candidate.CandidatePair;
import com.supplier.matching.candidate.CandidatePairGenerator;
import com.supplier.matching.cluster.ClusterBuilder;
import com.supplier.matching.core.model.MatchingGroup;
import com.supplier.matching.core.model.MatchingWarning;
import com.supplier.matching.core.model.PairScore;
import com.supplier.matching.core.model.ProductFeatures;
import com.supplier.matching.core.model.RawProduct;
import com.supplier.matching.image.DifferenceHasher;
import com.supplier.matching.image.ImageIoImageLoader;
import com.supplier.matching.image.ImageLoader;
import com.supplier.matching.image.PerceptualHasher;
import com.supplier.matching.logging.LogContext;
import com.supplier.matching.metrics.MetricsService;
import com.supplier.matching.metrics.NoOpMetricsService;
import com.supplier.matching.report.PriceComparisonReporter;
import com.supplier.matching.rules.NormalizationEngine;
import com.supplier.matching.rules.ProductNameRules;
import com.supplier.matching.similarity.BlockingKeyStrategy;
import com.supplier.matching.similarity.PrefixBigramBlockingKeyStrategy;
import com.supplier.matching.summary.GroupSummarizer;
import com.supplier.matching.summary.RepresentativeNameSelector;
import com.supplier.matching.tracing.NoOpTracingService;
import com.supplier.matching.tracing.Span;
import com.supplier.matching.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for batch product matching.
 *
 * <p>A run validates the batch, derives features, generates and scores candidate pairs,
 * clusters matching pairs with union-find, summarizes each group and attaches its price
 * comparison. Scoring is spread over the engine's worker pool once the batch reaches
 * {@link MatchingOptions#getParallelThreshold()} products; results are collected in
 * candidate order, so the output does not depend on the number of workers.</p>
 *
 * <p>Example usage:</p>
 * <pre>
 * try (ProductMatchingEngine engine = ProductMatchingEngine.builder().build()) {
 *     MatchingResult result = engine.run(products, MatchingOptions.textOnly());
 *     result.multiMemberGroups().forEach(g -&gt; ...);
 * }
 * </pre>
 */
public class ProductMatchingEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProductMatchingEngine.class);

    // Pairs scored between two cancellation checks inside a worker chunk.
    private static final int CANCELLATION_CHECK_INTERVAL = 1_024;

    private final NormalizationEngine normalizationEngine;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final FeatureCache featureCache;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final FeatureExtractor featureExtractor;
    private final ProductValidator validator = new ProductValidator();
    private final PriceComparisonReporter reporter = new PriceComparisonReporter();
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    private ProductMatchingEngine(Builder builder) {
        this.normalizationEngine = builder.normalizationEngine != null
                ? builder.normalizationEngine
                : ProductNameRules.createDefaultEngine();
        this.blockingKeyStrategy = builder.blockingKeyStrategy != null
                ? builder.blockingKeyStrategy
                : new PrefixBigramBlockingKeyStrategy();
        this.featureCache = builder.featureCache != null ? builder.featureCache : new NoOpFeatureCache();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        PerceptualHasher hasher = builder.perceptualHasher != null ? builder.perceptualHasher : new DifferenceHasher();
        ImageLoader imageLoader = builder.imageLoader != null ? builder.imageLoader : new ImageIoImageLoader();
        this.featureExtractor = new FeatureExtractor(normalizationEngine, hasher, imageLoader,
                featureCache, metricsService);
        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownsExecutor = false;
        } else {
            this.executor = Executors.newFixedThreadPool(builder.workerThreads, workerThreadFactory());
            this.ownsExecutor = true;
        }
    }

    /**
     * Runs matching with a token that is never cancelled.
     */
    public MatchingResult run(List<RawProduct> products, MatchingOptions options) {
        return run(products, options, CancellationToken.create());
    }

    /**
     * Matches a batch of products.
     *
     * @param products the batch; may be empty
     * @param options  run options
     * @param token    cooperative cancellation flag
     * @return groups, pair scores, warnings and statistics
     * @throws MalformedProductException  if a product is missing a required field or an id repeats
     * @throws MatchingCancelledException if the token was cancelled during the run
     */
    public MatchingResult run(List<RawProduct> products, MatchingOptions options, CancellationToken token) {
        Objects.requireNonNull(products, "products must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(token, "token must not be null");

        String runId = LogContext.generateRunId();
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forRun(runId, options.getMode().name());
             Span span = tracingService.startSpan("matching.run",
                     Map.of("runId", runId, "mode", options.getMode().name()))) {
            span.setAttribute("products", products.size());
            log.info("matching.run.started products={} options={}", products.size(), options);
            try {
                MatchingResult result = doRun(runId, products, options, token, start);
                span.setAttribute("groups", result.groups().size());
                span.setStatus(Span.SpanStatus.OK);
                metricsService.recordRunDuration(options.getMode(), true, elapsed(start));
                log.info("matching.run.completed statistics={}", result.statistics());
                return result;
            } catch (RuntimeException e) {
                span.fail(e);
                metricsService.recordRunDuration(options.getMode(), false, elapsed(start));
                log.warn("matching.run.failed error={}", e.getMessage());
                throw e;
            }
        }
    }

    private MatchingResult doRun(String runId, List<RawProduct> products, MatchingOptions options,
                                 CancellationToken token, long start) {
        token.throwIfCancelled("validate");
        try (Span span = tracingService.startPhase(runId, "validate")) {
            validator.validate(products);
        }
        metricsService.recordBatchSize(products.size());

        token.throwIfCancelled("features");
        FeatureExtractor.Extraction extraction;
        try (Span span = tracingService.startPhase(runId, "features")) {
            extraction = featureExtractor.extract(products, options.getMode());
            span.setAttribute("warnings", extraction.warnings().size());
        }
        List<ProductFeatures> features = extraction.features();

        token.throwIfCancelled("candidates");
        List<CandidatePair> candidates;
        try (Span span = tracingService.startPhase(runId, "candidates")) {
            if (options.isBlockingEnabled()) {
                log.info("candidates.blocking strategy={} pairs without a shared key are not scored",
                        blockingKeyStrategy.getClass().getSimpleName());
            }
            candidates = new CandidatePairGenerator(blockingKeyStrategy)
                    .generate(features, options.isBlockingEnabled());
            span.setAttribute("pairs", candidates.size());
        }
        metricsService.recordCandidatePairs(candidates.size());

        token.throwIfCancelled("score");
        List<PairScorer.ScoredPair> scored;
        try (Span span = tracingService.startPhase(runId, "score")) {
            scored = score(candidates, products.size(), options, token);
        }

        List<PairScore> pairScores = new ArrayList<>(scored.size());
        List<MatchingWarning> warnings = new ArrayList<>(extraction.warnings());
        long matchedPairs = 0;
        for (PairScorer.ScoredPair s : scored) {
            pairScores.add(s.score());
            metricsService.recordPairScore(s.score().hybridScore());
            if (s.score().isMatch()) {
                matchedPairs++;
            }
            if (s.warning() != null) {
                warnings.add(s.warning());
            }
        }
        metricsService.incrementMatchedPairs(options.getMode(), matchedPairs);

        token.throwIfCancelled("cluster");
        List<MatchingGroup> groups;
        try (Span span = tracingService.startPhase(runId, "cluster")) {
            Map<String, String> normalizedById = new HashMap<>();
            features.forEach(f -> normalizedById.put(f.id(), f.normalizedName()));
            RepresentativeNameSelector nameSelector = new RepresentativeNameSelector(
                    p -> normalizedById.getOrDefault(p.getId(), ""));
            ClusterBuilder clusterBuilder = new ClusterBuilder(new GroupSummarizer(nameSelector));
            groups = clusterBuilder.buildGroups(products, pairScores, options.getThreshold()).stream()
                    .map(reporter::attach)
                    .toList();
            span.setAttribute("groups", groups.size());
        }

        int multiMember = 0;
        double confidenceSum = 0.0;
        for (MatchingGroup group : groups) {
            metricsService.recordGroupSize(group.size());
            warnings.addAll(group.getWarnings());
            if (!group.isSingleton()) {
                multiMember++;
                confidenceSum += group.getConfidenceScore();
            }
        }
        warnings.forEach(w -> metricsService.incrementWarning(w.type()));

        int suppliers = (int) products.stream().map(RawProduct::getSupplierId).distinct().count();
        MatchingStatistics statistics = new MatchingStatistics(
                products.size(),
                suppliers,
                candidates.size(),
                matchedPairs,
                groups.size(),
                multiMember,
                multiMember == 0 ? 0.0 : confidenceSum / multiMember,
                warnings.size(),
                elapsed(start).toMillis());

        return new MatchingResult(runId, options, groups, pairScores, warnings, statistics);
    }

    private List<PairScorer.ScoredPair> score(List<CandidatePair> candidates, int batchSize,
                                             MatchingOptions options, CancellationToken token) {
        PairScorer scorer = new PairScorer(options);
        int workers = Math.min(options.getMaxWorkers(), candidates.size());
        if (batchSize < options.getParallelThreshold() || workers <= 1) {
            return scoreChunk(scorer, candidates, token);
        }

        int chunkSize = (candidates.size() + workers - 1) / workers;
        List<Future<List<PairScorer.ScoredPair>>> futures = new ArrayList<>();
        for (int from = 0; from < candidates.size(); from += chunkSize) {
            List<CandidatePair> chunk = candidates.subList(from, Math.min(from + chunkSize, candidates.size()));
            futures.add(executor.submit(LogContext.wrap(() -> scoreChunk(scorer, chunk, token))));
        }
        log.debug("score.parallel pairs={} chunks={}", candidates.size(), futures.size());

        List<PairScorer.ScoredPair> results = new ArrayList<>(candidates.size());
        try {
            for (Future<List<PairScorer.ScoredPair>> future : futures) {
                results.addAll(future.get());
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new MatchingCancelledException("score");
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Pair scoring failed", e.getCause());
        }
        return results;
    }

    private static List<PairScorer.ScoredPair> scoreChunk(PairScorer scorer, List<CandidatePair> chunk,
                                                          CancellationToken token) {
        List<PairScorer.ScoredPair> results = new ArrayList<>(chunk.size());
        for (int i = 0; i < chunk.size(); i++) {
            if (i % CANCELLATION_CHECK_INTERVAL == 0) {
                token.throwIfCancelled("score");
            }
            results.add(scorer.score(chunk.get(i)));
        }
        return results;
    }

    public NormalizationEngine getNormalizationEngine() {
        return normalizationEngine;
    }

    public FeatureCache getFeatureCache() {
        return featureCache;
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "matching-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private NormalizationEngine normalizationEngine;
        private PerceptualHasher perceptualHasher;
        private ImageLoader imageLoader;
        private BlockingKeyStrategy blockingKeyStrategy;
        private FeatureCache featureCache;
        private MetricsService metricsService;
        private TracingService tracingService;
        private ExecutorService executor;
        private int workerThreads = Runtime.getRuntime().availableProcessors();

        /**
         * Sets a custom normalization engine.
         */
        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        /**
         * Sets the perceptual hash algorithm. Defaults to dHash.
         */
        public Builder perceptualHasher(PerceptualHasher perceptualHasher) {
            this.perceptualHasher = perceptualHasher;
            return this;
        }

        public Builder imageLoader(ImageLoader imageLoader) {
            this.imageLoader = imageLoader;
            return this;
        }

        public Builder blockingKeyStrategy(BlockingKeyStrategy blockingKeyStrategy) {
            this.blockingKeyStrategy = blockingKeyStrategy;
            return this;
        }

        public Builder featureCache(FeatureCache featureCache) {
            this.featureCache = featureCache;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Uses an externally managed executor for parallel scoring. It is not shut down
         * when the engine closes.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Size of the engine-owned worker pool.
         */
        public Builder workerThreads(int workerThreads) {
            if (workerThreads <= 0) {
                throw new IllegalArgumentException("workerThreads must be positive");
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public ProductMatchingEngine build() {
            return new ProductMatchingEngine(this);
        }
    }
}
