package com.supplier.matching.similarity;

import com.supplier.matching.core.model.ProductFeatures;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Blocks on the leading bigrams of the normalized name (e.g. {@code bg:无线}).
 * Using more than one leading bigram keeps listings together when a supplier prepends
 * a single extra character.
 */
public class PrefixBigramBlockingKeyStrategy implements BlockingKeyStrategy {

    private static final int DEFAULT_LEADING_BIGRAMS = 2;

    private final int leadingBigrams;

    public PrefixBigramBlockingKeyStrategy() {
        this(DEFAULT_LEADING_BIGRAMS);
    }

    public PrefixBigramBlockingKeyStrategy(int leadingBigrams) {
        if (leadingBigrams < 1) {
            throw new IllegalArgumentException("leadingBigrams must be >= 1");
        }
        this.leadingBigrams = leadingBigrams;
    }

    @Override
    public Set<String> generateKeys(ProductFeatures features) {
        Set<String> keys = new LinkedHashSet<>();
        String name = features.normalizedName();
        if (name.isEmpty()) {
            return keys;
        }

        int[] cps = CodePoints.of(name);
        if (cps.length < 2) {
            keys.add("bg:" + name);
            return keys;
        }
        for (int i = 0; i < leadingBigrams && i + 2 <= cps.length; i++) {
            keys.add("bg:" + new String(cps, i, 2));
        }
        return keys;
    }
}
