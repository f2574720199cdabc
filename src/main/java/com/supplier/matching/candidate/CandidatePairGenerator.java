package com.supplier.matching.candidate;

import com.supplier.matching.core.model.ProductFeatures;
import com.supplier.matching.similarity.BlockingKeyStrategy;
import com.supplier.matching.similarity.PrefixBigramBlockingKeyStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Produces the product pairs to score for a batch.
 *
 * <p>Pairs from the same supplier are never produced. Without blocking every
 * cross-supplier pair is emitted (O(n²), fine up to a few thousand products). With
 * blocking only pairs sharing a key are emitted; products for which the strategy yields
 * no key are paired with everything so they are not dropped silently.</p>
 *
 * <p>Output order follows input order ({@code i < j}) and does not depend on hash
 * iteration order.</p>
 */
public class CandidatePairGenerator {
    private static final Logger log = LoggerFactory.getLogger(CandidatePairGenerator.class);

    private final BlockingKeyStrategy blockingKeyStrategy;

    public CandidatePairGenerator() {
        this(new PrefixBigramBlockingKeyStrategy());
    }

    public CandidatePairGenerator(BlockingKeyStrategy blockingKeyStrategy) {
        this.blockingKeyStrategy = blockingKeyStrategy;
    }

    /**
     * Generates candidate pairs.
     *
     * @param products        features of every product in the batch, in input order
     * @param blockingEnabled whether to restrict pairs to shared blocking keys
     * @return candidate pairs, never null
     */
    public List<CandidatePair> generate(List<ProductFeatures> products, boolean blockingEnabled) {
        if (products == null || products.size() < 2) {
            return List.of();
        }
        List<CandidatePair> pairs = blockingEnabled ? blocked(products) : allPairs(products);

        long naiveCount = (long) products.size() * (products.size() - 1) / 2;
        log.debug("candidates.generated products={} pairs={} blocking={} naivePairs={}",
                products.size(), pairs.size(), blockingEnabled, naiveCount);
        return pairs;
    }

    private List<CandidatePair> allPairs(List<ProductFeatures> products) {
        List<CandidatePair> pairs = new ArrayList<>();
        for (int i = 0; i < products.size(); i++) {
            for (int j = i + 1; j < products.size(); j++) {
                addIfCrossSupplier(pairs, products.get(i), products.get(j));
            }
        }
        return pairs;
    }

    private List<CandidatePair> blocked(List<ProductFeatures> products) {
        int n = products.size();
        Map<String, List<Integer>> blocks = new LinkedHashMap<>();
        List<Integer> unkeyed = new ArrayList<>();

        for (int i = 0; i < n; i++) {
            Set<String> keys = blockingKeyStrategy.generateKeys(products.get(i));
            if (keys.isEmpty()) {
                unkeyed.add(i);
                continue;
            }
            for (String key : keys) {
                blocks.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
            }
        }

        // partners.get(i) holds j > i to pair with i
        List<BitSet> partners = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            partners.add(new BitSet(n));
        }
        for (List<Integer> block : blocks.values()) {
            for (int x = 0; x < block.size(); x++) {
                for (int y = x + 1; y < block.size(); y++) {
                    link(partners, block.get(x), block.get(y));
                }
            }
        }
        for (int i : unkeyed) {
            for (int j = 0; j < n; j++) {
                if (i != j) {
                    link(partners, i, j);
                }
            }
        }

        List<CandidatePair> pairs = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            BitSet row = partners.get(i);
            for (int j = row.nextSetBit(0); j >= 0; j = row.nextSetBit(j + 1)) {
                addIfCrossSupplier(pairs, products.get(i), products.get(j));
            }
        }
        if (!unkeyed.isEmpty()) {
            log.debug("candidates.unkeyed count={} paired with whole batch", unkeyed.size());
        }
        return pairs;
    }

    private static void link(List<BitSet> partners, int a, int b) {
        partners.get(Math.min(a, b)).set(Math.max(a, b));
    }

    private static void addIfCrossSupplier(List<CandidatePair> pairs, ProductFeatures a, ProductFeatures b) {
        if (!a.supplierId().equals(b.supplierId())) {
            pairs.add(new CandidatePair(a, b));
        }
    }

    public BlockingKeyStrategy getBlockingKeyStrategy() {
        return blockingKeyStrategy;
    }
}
