package com.supplier.matching.similarity;

/**
 * Weights of the three measures blended into the text similarity score.
 *
 * <p>The defaults were tuned empirically on past supplier data, not derived;
 * recalibrate against labelled pairs before relying on them for a new catalogue.</p>
 */
public record SimilarityWeights(
        double characterWeight,
        double bigramWeight,
        double trigramWeight
) {
    public SimilarityWeights {
        if (characterWeight < 0 || bigramWeight < 0 || trigramWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = characterWeight + bigramWeight + trigramWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Default blend: 0.4 character set, 0.4 bigram, 0.2 trigram.
     * Trigrams get the lowest weight because short Chinese terms yield very few of them.
     */
    public static SimilarityWeights defaultWeights() {
        return new SimilarityWeights(0.4, 0.4, 0.2);
    }

    /**
     * Weights favoring bigrams (order-sensitive, stricter on reordered keywords).
     */
    public static SimilarityWeights bigramFocused() {
        return new SimilarityWeights(0.3, 0.5, 0.2);
    }
}
