package com.supplier.matching.similarity;

import com.supplier.matching.core.model.Money;
import com.supplier.matching.core.model.ProductFeatures;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Blocks on price: prices are placed on logarithmic bands whose width equals the
 * tolerance, and each product emits its own band and the next one. Any two prices of
 * the same currency within the tolerance (default ±30%) therefore share a key; some
 * pairs up to twice the tolerance apart do too.
 */
public class PriceBandBlockingKeyStrategy implements BlockingKeyStrategy {

    private static final double DEFAULT_TOLERANCE = 0.30;

    private final double bandWidth;

    public PriceBandBlockingKeyStrategy() {
        this(DEFAULT_TOLERANCE);
    }

    /**
     * @param tolerance relative price difference that must still share a key, in (0,1)
     */
    public PriceBandBlockingKeyStrategy(double tolerance) {
        if (tolerance <= 0.0 || tolerance >= 1.0) {
            throw new IllegalArgumentException("tolerance must be between 0 and 1 (exclusive)");
        }
        // Two prices are within tolerance when min/max >= 1 - tolerance
        this.bandWidth = -Math.log(1.0 - tolerance);
    }

    @Override
    public Set<String> generateKeys(ProductFeatures features) {
        Set<String> keys = new LinkedHashSet<>();
        Money price = features.product().getPrice();
        if (price == null) {
            return keys;
        }
        if (price.isZero()) {
            keys.add("price:" + price.currency() + ":zero");
            return keys;
        }

        long band = (long) Math.floor(Math.log(price.amount().doubleValue()) / bandWidth);
        keys.add("price:" + price.currency() + ":" + band);
        keys.add("price:" + price.currency() + ":" + (band + 1));
        return keys;
    }
}
