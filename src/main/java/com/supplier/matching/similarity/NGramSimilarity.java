package com.supplier.matching.similarity;

/**
 * Jaccard similarity over overlapping character n-grams.
 *
 * <p>A string shorter than {@code n} has no n-grams. In that case the score is 1.0 if both
 * strings are identical and non-empty, otherwise 0.0.</p>
 */
public class NGramSimilarity implements SimilarityAlgorithm {

    private final int n;

    public NGramSimilarity(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be >= 1");
        }
        this.n = n;
    }

    public static NGramSimilarity bigram() {
        return new NGramSimilarity(2);
    }

    public static NGramSimilarity trigram() {
        return new NGramSimilarity(3);
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        return CodePoints.jaccard(CodePoints.ngrams(s1, n), CodePoints.ngrams(s2, n));
    }

    public int getN() {
        return n;
    }

    @Override
    public String getName() {
        return n + "-gram";
    }
}
