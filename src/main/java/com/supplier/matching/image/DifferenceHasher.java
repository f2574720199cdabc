package com.supplier.matching.image;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Difference hash (dHash): 9x8 luminance grid, one bit per horizontally adjacent
 * pair set when the left cell is brighter than the right one. Gradient based, so it
 * tolerates uniform brightness and contrast changes better than {@link AverageHasher}.
 */
public class DifferenceHasher implements PerceptualHasher {

    private static final int WIDTH = 9;
    private static final int HEIGHT = 8;

    @Override
    public PerceptualHash hash(BufferedImage image) {
        Objects.requireNonNull(image, "image is required");
        int[][] samples = ImageSampling.grayscaleGrid(image, WIDTH, HEIGHT);

        boolean[] bits = new boolean[(WIDTH - 1) * HEIGHT];
        int bit = 0;
        for (int y = 0; y < HEIGHT; y++) {
            for (int x = 0; x < WIDTH - 1; x++) {
                bits[bit++] = samples[y][x] > samples[y][x + 1];
            }
        }
        return PerceptualHash.fromBits(bits);
    }

    @Override
    public String getVersion() {
        return "dhash-v1";
    }
}
