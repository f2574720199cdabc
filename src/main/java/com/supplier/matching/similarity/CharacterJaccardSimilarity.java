package com.supplier.matching.similarity;

/**
 * Jaccard similarity over the sets of characters of two strings.
 * Word order does not matter, which suits listings where suppliers append or reorder
 * keywords. Two empty strings score 0.0, not 1.0.
 */
public class CharacterJaccardSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        return CodePoints.jaccard(CodePoints.characterSet(s1), CodePoints.characterSet(s2));
    }

    @Override
    public String getName() {
        return "Character-Jaccard";
    }
}
