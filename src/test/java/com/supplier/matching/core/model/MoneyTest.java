package com.supplier.matching.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Money Tests")
class MoneyTest {

    @Test
    @DisplayName("Zero is a valid amount")
    void zeroAllowed() {
        Money free = Money.of(0, "CNY");
        assertTrue(free.isZero());
    }

    @Test
    @DisplayName("Negative amounts are rejected")
    void negativeRejected() {
        assertThrows(IllegalArgumentException.class, () -> Money.of("-0.01", "CNY"));
    }

    @Test
    @DisplayName("Currency is trimmed and upper-cased")
    void currencyNormalized() {
        Money money = Money.of("12.50", " cny ");
        assertEquals("CNY", money.currency());
        assertEquals(new BigDecimal("12.50"), money.amount());
        assertTrue(money.sameCurrency(Money.of(1, "CNY")));
        assertFalse(money.sameCurrency(Money.of(1, "USD")));
    }

    @Test
    @DisplayName("Currency case folding ignores the default locale")
    void currencyLocaleIndependent() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            Money rupees = Money.of("10", "inr");
            assertEquals("INR", rupees.currency());
            assertTrue(rupees.sameCurrency(Money.of("10", "INR")));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("Amount is required")
    void amountRequired() {
        assertThrows(NullPointerException.class, () -> new Money(null, "CNY"));
    }
}
