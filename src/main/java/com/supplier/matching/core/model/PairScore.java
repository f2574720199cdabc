package com.supplier.matching.core.model;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Score of one candidate pair. The pair is unordered and stored with
 * {@code productAId < productBId}.
 *
 * @param productAId      lexicographically smaller product id
 * @param productBId      lexicographically larger product id
 * @param textSimilarity  text similarity in [0,1]
 * @param imageSimilarity image similarity in [0,1], or null when not available for this pair
 * @param hybridScore     combined score in [0,1]
 * @param threshold       threshold the pair was judged against
 */
public record PairScore(
        String productAId,
        String productBId,
        double textSimilarity,
        Double imageSimilarity,
        double hybridScore,
        double threshold
) {
    public PairScore {
        Objects.requireNonNull(productAId, "productAId is required");
        Objects.requireNonNull(productBId, "productBId is required");
        if (productAId.compareTo(productBId) >= 0) {
            throw new IllegalArgumentException(
                    "productAId must sort before productBId: " + productAId + " / " + productBId);
        }
        validateScore(textSimilarity, "textSimilarity");
        if (imageSimilarity != null) {
            validateScore(imageSimilarity, "imageSimilarity");
        }
        validateScore(hybridScore, "hybridScore");
    }

    /**
     * Creates a pair score, ordering the two ids.
     */
    public static PairScore of(String idA, String idB, double textSimilarity, Double imageSimilarity,
                               double hybridScore, double threshold) {
        if (idA.compareTo(idB) <= 0) {
            return new PairScore(idA, idB, textSimilarity, imageSimilarity, hybridScore, threshold);
        }
        return new PairScore(idB, idA, textSimilarity, imageSimilarity, hybridScore, threshold);
    }

    /**
     * A score equal to the threshold is a match.
     */
    public boolean isMatch() {
        return hybridScore >= threshold;
    }

    public OptionalDouble image() {
        return imageSimilarity != null ? OptionalDouble.of(imageSimilarity) : OptionalDouble.empty();
    }

    public boolean involves(String productId) {
        return productAId.equals(productId) || productBId.equals(productId);
    }

    private static void validateScore(double value, String name) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0, got " + value);
        }
    }
}
