package com.supplier.matching.similarity;

import com.supplier.matching.core.model.ProductFeatures;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Combines two strategies so that products must share a key from both,
 * e.g. the same leading bigram and a compatible price band.
 */
public class ConjunctiveBlockingKeyStrategy implements BlockingKeyStrategy {

    private final BlockingKeyStrategy first;
    private final BlockingKeyStrategy second;

    public ConjunctiveBlockingKeyStrategy(BlockingKeyStrategy first, BlockingKeyStrategy second) {
        this.first = first;
        this.second = second;
    }

    @Override
    public Set<String> generateKeys(ProductFeatures features) {
        Set<String> firstKeys = first.generateKeys(features);
        Set<String> secondKeys = second.generateKeys(features);
        Set<String> keys = new LinkedHashSet<>();
        for (String a : firstKeys) {
            for (String b : secondKeys) {
                keys.add(a + "&" + b);
            }
        }
        return keys;
    }
}
