package com.supplier.matching.image;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;

/**
 * Downsampling helpers shared by the hash strategies.
 */
final class ImageSampling {

    private ImageSampling() {
    }

    /**
     * Scales the image to {@code width x height} and returns its luminance samples,
     * row by row.
     */
    static int[][] grayscaleGrid(BufferedImage image, int width, int height) {
        BufferedImage gray = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = gray.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(image, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }

        Raster raster = gray.getRaster();
        int[][] samples = new int[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                samples[y][x] = raster.getSample(x, y, 0);
            }
        }
        return samples;
    }
}
