package com.supplier.matching.similarity;

import com.supplier.matching.core.model.MatchingMode;
import com.supplier.matching.image.HashVersionMismatchException;
import com.supplier.matching.image.PerceptualHash;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class HybridScorerTest {

    @Nested
    @DisplayName("ImageSimilarityScorer")
    class ImageTests {

        private final ImageSimilarityScorer scorer = new ImageSimilarityScorer();

        @Test
        @DisplayName("Similarity is 1 - hamming / bit length")
        void hammingRatio() {
            PerceptualHash a = PerceptualHash.ofLong(0L);
            PerceptualHash b = PerceptualHash.ofLong(0xFFL);
            assertEquals(1.0 - 8.0 / 64.0, scorer.compute(a, b).getAsDouble(), 1e-9);
        }

        @Test
        @DisplayName("Identical hashes score 1.0, symmetric")
        void identicalAndSymmetric() {
            PerceptualHash a = PerceptualHash.fromHex("f0f0f0f0f0f0f0f0");
            PerceptualHash b = PerceptualHash.fromHex("f0f0f0f0f0f0f0ff");
            assertEquals(1.0, scorer.compute(a, a).getAsDouble());
            assertEquals(scorer.compute(a, b).getAsDouble(), scorer.compute(b, a).getAsDouble());
        }

        @Test
        @DisplayName("All-zero against all-one hash scores exactly 0.0 and keeps hybrid in range")
        void oppositeHashes() {
            PerceptualHash zeros = PerceptualHash.ofLong(0L);
            PerceptualHash ones = PerceptualHash.ofLong(-1L);

            OptionalDouble image = scorer.compute(zeros, ones);
            assertEquals(0.0, image.getAsDouble());
            assertEquals(0.0, scorer.compute(ones, zeros).getAsDouble());

            HybridScorer hybrid = new HybridScorer();
            for (double text : new double[]{0.0, 0.5, 1.0}) {
                double score = hybrid.score(text, image);
                assertTrue(score >= 0.0 && score <= 1.0, "hybrid out of range: " + score);
                assertEquals(0.6 * text, score, 1e-9);
            }
            assertEquals(0.0, hybrid.score(MatchingMode.IMAGE, 1.0, image));
        }

        @Test
        @DisplayName("Missing hash yields no score")
        void missingHash() {
            assertTrue(scorer.compute(null, PerceptualHash.ofLong(1L)).isEmpty());
            assertTrue(scorer.compute(PerceptualHash.ofLong(1L), null).isEmpty());
        }

        @Test
        @DisplayName("Different bit lengths throw HashVersionMismatchException")
        void lengthMismatch() {
            PerceptualHash h64 = PerceptualHash.ofLong(1L);
            PerceptualHash h256 = PerceptualHash.fromHex("0".repeat(64));
            HashVersionMismatchException e = assertThrows(HashVersionMismatchException.class,
                    () -> scorer.compute(h64, h256));
            assertEquals(64, e.getLeftBitLength());
            assertEquals(256, e.getRightBitLength());
        }
    }

    @Nested
    @DisplayName("HybridScorer")
    class HybridTests {

        private final HybridScorer scorer = new HybridScorer();

        @Test
        @DisplayName("0.6 text + 0.4 image when the image is present")
        void weighted() {
            assertEquals(0.6 * 0.8 + 0.4 * 0.5, scorer.score(0.8, OptionalDouble.of(0.5)), 1e-9);
        }

        @Test
        @DisplayName("Text alone when the image is missing")
        void textFallback() {
            assertEquals(0.754, scorer.score(0.754, OptionalDouble.empty()), 1e-9);
        }

        @Test
        @DisplayName("TEXT mode ignores the image")
        void textMode() {
            assertEquals(0.8, scorer.score(MatchingMode.TEXT, 0.8, OptionalDouble.of(0.1)), 1e-9);
        }

        @Test
        @DisplayName("IMAGE mode scores 0 without an image")
        void imageMode() {
            assertEquals(0.9, scorer.score(MatchingMode.IMAGE, 0.2, OptionalDouble.of(0.9)), 1e-9);
            assertEquals(0.0, scorer.score(MatchingMode.IMAGE, 0.99, OptionalDouble.empty()));
        }

        @Test
        @DisplayName("Custom weights apply in HYBRID mode")
        void customWeights() {
            HybridScorer imageHeavy = new HybridScorer(new HybridWeights(0.3, 0.7));
            assertEquals(0.3 * 0.5 + 0.7 * 1.0,
                    imageHeavy.score(MatchingMode.HYBRID, 0.5, OptionalDouble.of(1.0)), 1e-9);
        }

        @Test
        @DisplayName("Hybrid weights must sum to 1")
        void invalidWeights() {
            assertThrows(IllegalArgumentException.class, () -> new HybridWeights(0.6, 0.6));
        }
    }
}
