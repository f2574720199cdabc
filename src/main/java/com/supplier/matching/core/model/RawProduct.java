package com.supplier.matching.core.model;

import com.supplier.matching.image.PerceptualHash;

import java.util.Objects;
import java.util.Optional;

/**
 * One supplier listing as handed over by the import layer.
 * Immutable during a matching run; values derived from it (normalized name,
 * perceptual hash) live in per-run features, never on this object.
 */
public class RawProduct {
    private final String id;
    private final String supplierId;
    private final String name;
    private final Money price;
    private final String url;
    private final String imageRef;
    private final PerceptualHash perceptualHash;
    private final String normalizedName;

    private RawProduct(Builder builder) {
        this.id = builder.id;
        this.supplierId = builder.supplierId;
        this.name = builder.name;
        this.price = builder.price;
        this.url = builder.url;
        this.imageRef = builder.imageRef;
        this.perceptualHash = builder.perceptualHash;
        this.normalizedName = builder.normalizedName;
    }

    public String getId() {
        return id;
    }

    public String getSupplierId() {
        return supplierId;
    }

    public String getName() {
        return name;
    }

    public Money getPrice() {
        return price;
    }

    public String getUrl() {
        return url;
    }

    public Optional<String> getImageRef() {
        return Optional.ofNullable(imageRef).filter(ref -> !ref.isBlank());
    }

    /**
     * Hash precomputed by the caller's storage layer, if any.
     */
    public Optional<PerceptualHash> getPerceptualHash() {
        return Optional.ofNullable(perceptualHash);
    }

    /**
     * Normalized name cached by the caller's storage layer, if any.
     */
    public Optional<String> getNormalizedName() {
        return Optional.ofNullable(normalizedName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RawProduct that = (RawProduct) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "RawProduct{" +
                "id='" + id + '\'' +
                ", supplierId='" + supplierId + '\'' +
                ", name='" + name + '\'' +
                ", price=" + price +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(RawProduct product) {
        return new Builder()
                .id(product.id)
                .supplierId(product.supplierId)
                .name(product.name)
                .price(product.price)
                .url(product.url)
                .imageRef(product.imageRef)
                .perceptualHash(product.perceptualHash)
                .normalizedName(product.normalizedName);
    }

    public static class Builder {
        private String id;
        private String supplierId;
        private String name;
        private Money price;
        private String url;
        private String imageRef;
        private PerceptualHash perceptualHash;
        private String normalizedName;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder supplierId(String supplierId) {
            this.supplierId = supplierId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder price(Money price) {
            this.price = price;
            return this;
        }

        public Builder price(String amount, String currency) {
            this.price = Money.of(amount, currency);
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder imageRef(String imageRef) {
            this.imageRef = imageRef;
            return this;
        }

        public Builder perceptualHash(PerceptualHash perceptualHash) {
            this.perceptualHash = perceptualHash;
            return this;
        }

        public Builder normalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
            return this;
        }

        /**
         * Builds the product without validating required fields.
         * Validation happens at the engine boundary so that a malformed record
         * can be reported with its position in the batch.
         */
        public RawProduct build() {
            return new RawProduct(this);
        }
    }
}
