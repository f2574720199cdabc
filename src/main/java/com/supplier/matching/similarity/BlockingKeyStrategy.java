package com.supplier.matching.similarity;

import com.supplier.matching.core.model.ProductFeatures;

import java.util.Set;

/**
 * Strategy interface for generating blocking keys for products.
 * Blocking keys are used to narrow the candidate set for pairwise scoring,
 * avoiding the full O(n²) comparison of a batch.
 *
 * <p>Products that share at least one blocking key are considered potential
 * candidates for matching. Blocking trades recall for speed: a true match whose
 * keys do not overlap is never scored.</p>
 */
public interface BlockingKeyStrategy {

    /**
     * Generates a set of blocking keys for a product.
     *
     * @param features the product's derived features
     * @return set of blocking keys (never null, may be empty)
     */
    Set<String> generateKeys(ProductFeatures features);
}
