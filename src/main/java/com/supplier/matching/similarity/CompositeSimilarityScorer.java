package com.supplier.matching.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Text similarity of two normalized product names.
 * Formula: score = w1*characterJaccard + w2*bigram + w3*trigram
 */
public class CompositeSimilarityScorer implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(CompositeSimilarityScorer.class);

    private final CharacterJaccardSimilarity characterJaccard;
    private final NGramSimilarity bigram;
    private final NGramSimilarity trigram;
    private final SimilarityWeights weights;

    public CompositeSimilarityScorer() {
        this(SimilarityWeights.defaultWeights());
    }

    public CompositeSimilarityScorer(SimilarityWeights weights) {
        this.characterJaccard = new CharacterJaccardSimilarity();
        this.bigram = NGramSimilarity.bigram();
        this.trigram = NGramSimilarity.trigram();
        this.weights = weights;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }

        SimilarityBreakdown breakdown = computeWithBreakdown(s1, s2);

        log.debug("Similarity scores for '{}' vs '{}': character={}, bigram={}, trigram={}, composite={}",
                s1, s2, breakdown.characterScore(), breakdown.bigramScore(),
                breakdown.trigramScore(), breakdown.compositeScore());

        return breakdown.compositeScore();
    }

    @Override
    public String getName() {
        return "Composite";
    }

    /**
     * Computes detailed similarity breakdown.
     */
    public SimilarityBreakdown computeWithBreakdown(String s1, String s2) {
        double characterScore = characterJaccard.compute(s1, s2);
        double bigramScore = bigram.compute(s1, s2);
        double trigramScore = trigram.compute(s1, s2);
        double compositeScore = weights.characterWeight() * characterScore
                + weights.bigramWeight() * bigramScore
                + weights.trigramWeight() * trigramScore;

        return new SimilarityBreakdown(characterScore, bigramScore, trigramScore,
                clamp(compositeScore), weights);
    }

    public SimilarityWeights getWeights() {
        return weights;
    }

    /**
     * Creates a new scorer with updated weights.
     */
    public CompositeSimilarityScorer withWeights(SimilarityWeights newWeights) {
        return new CompositeSimilarityScorer(newWeights);
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }

    /**
     * Detailed breakdown of similarity scores from each measure.
     */
    public record SimilarityBreakdown(
            double characterScore,
            double bigramScore,
            double trigramScore,
            double compositeScore,
            SimilarityWeights weights
    ) {
        @Override
        public String toString() {
            return String.format(
                    "SimilarityBreakdown{character=%.4f (w=%.2f), bigram=%.4f (w=%.2f), trigram=%.4f (w=%.2f), composite=%.4f}",
                    characterScore, weights.characterWeight(),
                    bigramScore, weights.bigramWeight(),
                    trigramScore, weights.trigramWeight(),
                    compositeScore
            );
        }
    }
}
