package com.supplier.matching.core.model;

import com.supplier.matching.image.PerceptualHash;

import java.util.Objects;
import java.util.Optional;

/**
 * Values derived from a {@link RawProduct} for one run: its normalized name and,
 * when an image was available, its perceptual hash.
 *
 * @param product        the source listing
 * @param normalizedName normalized name, possibly empty
 * @param perceptualHash image hash, or null when the product has no usable image
 */
public record ProductFeatures(RawProduct product, String normalizedName, PerceptualHash perceptualHash) {

    public ProductFeatures {
        Objects.requireNonNull(product, "product is required");
        normalizedName = normalizedName != null ? normalizedName : "";
    }

    public String id() {
        return product.getId();
    }

    public String supplierId() {
        return product.getSupplierId();
    }

    public Optional<PerceptualHash> hash() {
        return Optional.ofNullable(perceptualHash);
    }
}
