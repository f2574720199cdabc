package com.supplier.matching.similarity;

import com.supplier.matching.image.HashVersionMismatchException;
import com.supplier.matching.image.PerceptualHash;

import java.util.OptionalDouble;

/**
 * Image similarity from perceptual hashes: {@code 1 - hamming / bitLength}.
 */
public class ImageSimilarityScorer {

    /**
     * Compares two hashes.
     *
     * @return the similarity, or empty when either hash is missing
     * @throws HashVersionMismatchException if the hashes have different lengths
     */
    public OptionalDouble compute(PerceptualHash hash1, PerceptualHash hash2) {
        if (hash1 == null || hash2 == null) {
            return OptionalDouble.empty();
        }
        int distance = hash1.hammingDistance(hash2);
        return OptionalDouble.of(1.0 - ((double) distance / hash1.bitLength()));
    }
}
