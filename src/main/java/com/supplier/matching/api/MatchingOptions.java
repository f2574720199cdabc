package com.supplier.matching.api;

import com.supplier.matching.core.model.MatchingMode;
import com.supplier.matching.similarity.HybridWeights;
import com.supplier.matching.similarity.SimilarityWeights;

import java.util.Objects;

/**
 * Options for one matching run.
 * Configures the mode, the match threshold, scoring weights, blocking and parallelism.
 * When no threshold is set, the mode's default applies.
 */
public class MatchingOptions {

    private static final int DEFAULT_PARALLEL_THRESHOLD = 200;
    private static final int DEFAULT_MAX_WORKERS = Runtime.getRuntime().availableProcessors();

    private final MatchingMode mode;
    private final double threshold;
    private final SimilarityWeights similarityWeights;
    private final HybridWeights hybridWeights;
    private final boolean blockingEnabled;
    private final int parallelThreshold;
    private final int maxWorkers;

    private MatchingOptions(Builder builder) {
        this.mode = builder.mode;
        this.threshold = builder.threshold != null ? builder.threshold : builder.mode.getDefaultThreshold();
        this.similarityWeights = builder.similarityWeights;
        this.hybridWeights = builder.hybridWeights;
        this.blockingEnabled = builder.blockingEnabled;
        this.parallelThreshold = builder.parallelThreshold;
        this.maxWorkers = builder.maxWorkers;
    }

    public MatchingMode getMode() {
        return mode;
    }

    public double getThreshold() {
        return threshold;
    }

    public SimilarityWeights getSimilarityWeights() {
        return similarityWeights;
    }

    public HybridWeights getHybridWeights() {
        return hybridWeights;
    }

    public boolean isBlockingEnabled() {
        return blockingEnabled;
    }

    /**
     * Batch size from which pair scoring is spread over worker threads.
     */
    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    /**
     * Creates default options: hybrid mode at 0.75.
     */
    public static MatchingOptions defaults() {
        return builder().build();
    }

    /**
     * Names only, threshold 0.70.
     */
    public static MatchingOptions textOnly() {
        return builder().mode(MatchingMode.TEXT).build();
    }

    /**
     * Names and images, threshold 0.75.
     */
    public static MatchingOptions hybrid() {
        return builder().mode(MatchingMode.HYBRID).build();
    }

    /**
     * Images only, threshold 0.85.
     */
    public static MatchingOptions imageOnly() {
        return builder().mode(MatchingMode.IMAGE).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(MatchingOptions options) {
        return new Builder()
                .mode(options.mode)
                .threshold(options.threshold)
                .similarityWeights(options.similarityWeights)
                .hybridWeights(options.hybridWeights)
                .blockingEnabled(options.blockingEnabled)
                .parallelThreshold(options.parallelThreshold)
                .maxWorkers(options.maxWorkers);
    }

    @Override
    public String toString() {
        return "MatchingOptions{" +
                "mode=" + mode +
                ", threshold=" + threshold +
                ", similarityWeights=" + similarityWeights +
                ", hybridWeights=" + hybridWeights +
                ", blockingEnabled=" + blockingEnabled +
                ", parallelThreshold=" + parallelThreshold +
                ", maxWorkers=" + maxWorkers +
                '}';
    }

    public static class Builder {
        private MatchingMode mode = MatchingMode.HYBRID;
        private Double threshold;
        private SimilarityWeights similarityWeights = SimilarityWeights.defaultWeights();
        private HybridWeights hybridWeights = HybridWeights.defaultWeights();
        private boolean blockingEnabled = false;
        private int parallelThreshold = DEFAULT_PARALLEL_THRESHOLD;
        private int maxWorkers = DEFAULT_MAX_WORKERS;

        public Builder mode(MatchingMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode is required");
            return this;
        }

        public Builder threshold(double threshold) {
            validateThreshold(threshold, "threshold");
            this.threshold = threshold;
            return this;
        }

        public Builder similarityWeights(SimilarityWeights similarityWeights) {
            this.similarityWeights = Objects.requireNonNull(similarityWeights, "similarityWeights is required");
            return this;
        }

        public Builder hybridWeights(HybridWeights hybridWeights) {
            this.hybridWeights = Objects.requireNonNull(hybridWeights, "hybridWeights is required");
            return this;
        }

        /**
         * Only score pairs that share a blocking key. Faster, but may miss matches
         * whose names share no leading bigram.
         */
        public Builder blockingEnabled(boolean blockingEnabled) {
            this.blockingEnabled = blockingEnabled;
            return this;
        }

        public Builder parallelThreshold(int parallelThreshold) {
            if (parallelThreshold < 0) {
                throw new IllegalArgumentException("parallelThreshold must not be negative");
            }
            this.parallelThreshold = parallelThreshold;
            return this;
        }

        public Builder maxWorkers(int maxWorkers) {
            if (maxWorkers <= 0) {
                throw new IllegalArgumentException("maxWorkers must be positive");
            }
            this.maxWorkers = maxWorkers;
            return this;
        }

        public MatchingOptions build() {
            return new MatchingOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }
}
