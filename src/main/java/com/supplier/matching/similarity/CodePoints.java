package com.supplier.matching.similarity;

import java.util.HashSet;
import java.util.Set;

/**
 * Code point based tokenization, so characters outside the BMP count as one character.
 */
final class CodePoints {

    private CodePoints() {
    }

    static int[] of(String s) {
        return s.codePoints().toArray();
    }

    static Set<Integer> characterSet(String s) {
        Set<Integer> set = new HashSet<>();
        s.codePoints().forEach(set::add);
        return set;
    }

    /**
     * Overlapping windows of {@code n} code points, step 1.
     */
    static Set<String> ngrams(String s, int n) {
        int[] cps = of(s);
        Set<String> grams = new HashSet<>();
        for (int i = 0; i + n <= cps.length; i++) {
            grams.add(new String(cps, i, n));
        }
        return grams;
    }

    static <T> double jaccard(Set<T> a, Set<T> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        int intersectionSize = 0;
        for (T item : a) {
            if (b.contains(item)) {
                intersectionSize++;
            }
        }
        // |union| = |A| + |B| - |intersection|
        int unionSize = a.size() + b.size() - intersectionSize;
        return (double) intersectionSize / unionSize;
    }
}
