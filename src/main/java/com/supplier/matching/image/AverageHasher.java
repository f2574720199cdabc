package com.supplier.matching.image;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Average hash (aHash): 8x8 luminance grid, one bit per cell set when the cell is
 * brighter than the grid mean.
 */
public class AverageHasher implements PerceptualHasher {

    private static final int GRID = 8;

    @Override
    public PerceptualHash hash(BufferedImage image) {
        Objects.requireNonNull(image, "image is required");
        int[][] samples = ImageSampling.grayscaleGrid(image, GRID, GRID);

        double sum = 0;
        for (int[] row : samples) {
            for (int sample : row) {
                sum += sample;
            }
        }
        double avg = sum / (GRID * GRID);

        boolean[] bits = new boolean[GRID * GRID];
        int bit = 0;
        for (int y = 0; y < GRID; y++) {
            for (int x = 0; x < GRID; x++) {
                bits[bit++] = samples[y][x] > avg;
            }
        }
        return PerceptualHash.fromBits(bits);
    }

    @Override
    public String getVersion() {
        return "ahash-v1";
    }
}
