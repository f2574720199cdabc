package com.supplier.matching.similarity;

/**
 * Weights of text and image similarity in the hybrid score.
 */
public record HybridWeights(double textWeight, double imageWeight) {

    public HybridWeights {
        if (textWeight < 0 || imageWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = textWeight + imageWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * 0.6 text, 0.4 image. Text is always available; the hash is a coarse confirming signal.
     */
    public static HybridWeights defaultWeights() {
        return new HybridWeights(0.6, 0.4);
    }
}
