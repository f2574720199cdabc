package com.supplier.matching.image;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

class PerceptualHasherTest {

    /**
     * Horizontal gradient from white on the left to black on the right.
     */
    static BufferedImage gradient(int width, int height, boolean darkToLight) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int x = 0; x < width; x++) {
            int v = 255 - (x * 255 / (width - 1));
            if (darkToLight) {
                v = 255 - v;
            }
            int rgb = new Color(v, v, v).getRGB();
            for (int y = 0; y < height; y++) {
                image.setRGB(x, y, rgb);
            }
        }
        return image;
    }

    static BufferedImage leftHalfWhite(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.BLACK);
        g.fillRect(0, 0, width, height);
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, width / 2, height);
        g.dispose();
        return image;
    }

    @Nested
    @DisplayName("DifferenceHasher")
    class DifferenceTests {

        private final DifferenceHasher hasher = new DifferenceHasher();

        @Test
        @DisplayName("Produces 64 bits")
        void bitLength() {
            assertEquals(64, hasher.hash(gradient(90, 80, false)).bitLength());
            assertEquals("dhash-v1", hasher.getVersion());
        }

        @Test
        @DisplayName("Resized copies hash identically or nearly so")
        void scaleInvariant() {
            PerceptualHash small = hasher.hash(gradient(90, 80, false));
            PerceptualHash large = hasher.hash(gradient(900, 800, false));
            assertTrue(small.hammingDistance(large) <= 4,
                    "distance " + small.hammingDistance(large));
        }

        @Test
        @DisplayName("Opposite gradients are far apart")
        void oppositeGradients() {
            PerceptualHash a = hasher.hash(gradient(180, 160, false));
            PerceptualHash b = hasher.hash(gradient(180, 160, true));
            assertTrue(a.hammingDistance(b) > 48, "distance " + a.hammingDistance(b));
        }
    }

    @Nested
    @DisplayName("AverageHasher")
    class AverageTests {

        private final AverageHasher hasher = new AverageHasher();

        @Test
        @DisplayName("Bright cells set bits")
        void brightCells() {
            PerceptualHash hash = hasher.hash(leftHalfWhite(64, 64));
            assertEquals(64, hash.bitLength());
            assertTrue(hash.bit(0));
            assertFalse(hash.bit(7));
            assertEquals("f0f0f0f0f0f0f0f0", hash.toHex());
            assertEquals("ahash-v1", hasher.getVersion());
        }

        @Test
        @DisplayName("Same image hashes identically")
        void deterministic() {
            assertEquals(hasher.hash(leftHalfWhite(120, 100)), hasher.hash(leftHalfWhite(120, 100)));
        }

        @Test
        @DisplayName("Null image is rejected")
        void nullImage() {
            assertThrows(NullPointerException.class, () -> hasher.hash(null));
        }
    }
}
