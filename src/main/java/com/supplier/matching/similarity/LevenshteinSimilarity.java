package com.supplier.matching.similarity;

/**
 * Levenshtein distance-based similarity.
 * Computes similarity as 1 - (edit_distance / max_length), counting code points.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }

        int[] a = CodePoints.of(s1);
        int[] b = CodePoints.of(s2);
        int distance = distance(a, b);
        return 1.0 - ((double) distance / Math.max(a.length, b.length));
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * Edit distance between two strings, in code points.
     */
    public static int distance(String s1, String s2) {
        return distance(CodePoints.of(s1 != null ? s1 : ""), CodePoints.of(s2 != null ? s2 : ""));
    }

    /**
     * Wagner-Fischer algorithm with O(min(m,n)) space.
     */
    private static int distance(int[] s1, int[] s2) {
        if (s1.length > s2.length) {
            int[] temp = s1;
            s1 = s2;
            s2 = temp;
        }

        int m = s1.length;
        int n = s2.length;

        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];

        for (int i = 0; i <= m; i++) {
            previousRow[i] = i;
        }

        for (int j = 1; j <= n; j++) {
            currentRow[0] = j;

            for (int i = 1; i <= m; i++) {
                int cost = s1[i - 1] == s2[j - 1] ? 0 : 1;
                currentRow[i] = Math.min(
                        Math.min(currentRow[i - 1] + 1, previousRow[i] + 1),
                        previousRow[i - 1] + cost
                );
            }

            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }

        return previousRow[m];
    }
}
