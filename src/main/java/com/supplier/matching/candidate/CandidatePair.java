package com.supplier.matching.candidate;

import com.supplier.matching.core.model.ProductFeatures;

import java.util.Objects;

/**
 * Two products from different suppliers worth scoring.
 * Ordered so that {@code first.id() < second.id()}.
 */
public record CandidatePair(ProductFeatures first, ProductFeatures second) {

    public CandidatePair {
        Objects.requireNonNull(first, "first is required");
        Objects.requireNonNull(second, "second is required");
        if (first.id().compareTo(second.id()) > 0) {
            ProductFeatures tmp = first;
            first = second;
            second = tmp;
        }
    }

    public String key() {
        return first.id() + "|" + second.id();
    }
}
