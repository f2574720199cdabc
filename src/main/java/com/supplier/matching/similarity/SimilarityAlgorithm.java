package com.supplier.matching.similarity;

/**
 * Interface for string similarity algorithms.
 * All implementations return a score between 0.0 (no similarity) and 1.0 (identical)
 * and are symmetric in their arguments.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two normalized strings.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
