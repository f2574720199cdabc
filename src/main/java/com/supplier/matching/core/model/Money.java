package com.supplier.matching.core.model;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;

/**
 * A price tagged with its currency.
 * No conversion is ever performed; the currency is carried so that mixed-currency
 * groups can be reported instead of silently averaged.
 *
 * @param amount   non-negative amount in the supplier's currency
 * @param currency currency code (e.g. {@code CNY}), informational only
 */
public record Money(BigDecimal amount, String currency) {

    public Money {
        Objects.requireNonNull(amount, "amount is required");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be non-negative, got " + amount);
        }
        currency = currency != null ? currency.trim().toUpperCase(Locale.ROOT) : "";
    }

    public static Money of(String amount, String currency) {
        return new Money(new BigDecimal(amount), currency);
    }

    public static Money of(long amount, String currency) {
        return new Money(BigDecimal.valueOf(amount), currency);
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    public boolean sameCurrency(Money other) {
        return currency.equals(other.currency);
    }

    @Override
    public String toString() {
        return amount.toPlainString() + " " + currency;
    }
}
