package com.supplier.matching.similarity;

import com.supplier.matching.core.model.MatchingMode;

import java.util.OptionalDouble;

/**
 * Combines text and image similarity into one matching score.
 * A missing image is treated as "no signal": the score falls back to text alone.
 */
public class HybridScorer {

    private final HybridWeights weights;

    public HybridScorer() {
        this(HybridWeights.defaultWeights());
    }

    public HybridScorer(HybridWeights weights) {
        this.weights = weights;
    }

    /**
     * Hybrid score of a pair.
     */
    public double score(double textSimilarity, OptionalDouble imageSimilarity) {
        if (imageSimilarity.isEmpty()) {
            return clamp(textSimilarity);
        }
        return clamp(weights.textWeight() * textSimilarity
                + weights.imageWeight() * imageSimilarity.getAsDouble());
    }

    /**
     * Score of a pair for the given mode. In {@link MatchingMode#IMAGE} a pair without
     * an image score gets 0.0 and therefore never matches.
     */
    public double score(MatchingMode mode, double textSimilarity, OptionalDouble imageSimilarity) {
        return switch (mode) {
            case TEXT -> clamp(textSimilarity);
            case IMAGE -> clamp(imageSimilarity.orElse(0.0));
            case HYBRID -> score(textSimilarity, imageSimilarity);
        };
    }

    public HybridWeights getWeights() {
        return weights;
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }
}
