package com.supplier.matching.image;

import java.awt.image.BufferedImage;

/**
 * Strategy for computing perceptual hashes. All hashes compared within one run
 * must come from the same strategy and version.
 */
public interface PerceptualHasher {

    /**
     * Computes the hash of an image.
     *
     * @param image decoded image, never null
     * @return fixed-length hash
     */
    PerceptualHash hash(BufferedImage image);

    /**
     * Identifies the algorithm and its version, e.g. {@code dhash-v1}.
     * Used to key memoized hashes.
     */
    String getVersion();
}
