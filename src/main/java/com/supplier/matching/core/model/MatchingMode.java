package com.supplier.matching.core.model;

/**
 * Which similarity signals drive a matching run, with the threshold each mode
 * has historically been run with.
 */
public enum MatchingMode {
    /** Name similarity only. */
    TEXT(0.70),
    /** Perceptual image hash only; pairs without two images never match. */
    IMAGE(0.85),
    /** Weighted text + image, falling back to text when an image is missing. */
    HYBRID(0.75);

    private final double defaultThreshold;

    MatchingMode(double defaultThreshold) {
        this.defaultThreshold = defaultThreshold;
    }

    public double getDefaultThreshold() {
        return defaultThreshold;
    }
}
