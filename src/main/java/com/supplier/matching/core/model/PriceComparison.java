package com.supplier.matching.core.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Price comparison derived from a matching group.
 *
 * @param groupId         group id
 * @param bestMemberId    cheapest member
 * @param minPrice        lowest price
 * @param maxPrice        highest price
 * @param currency        common currency, or null when members disagree
 * @param savingsAbsolute {@code maxPrice - minPrice}
 * @param savingsPercent  savings relative to the highest price, in percent; 0 when the highest price is 0
 * @param rankedMembers   members ordered by price, then supplier id
 */
public record PriceComparison(
        String groupId,
        String bestMemberId,
        BigDecimal minPrice,
        BigDecimal maxPrice,
        String currency,
        BigDecimal savingsAbsolute,
        double savingsPercent,
        List<RankedMember> rankedMembers
) {
    public PriceComparison {
        rankedMembers = rankedMembers != null ? List.copyOf(rankedMembers) : List.of();
    }

    public boolean hasSavings() {
        return savingsAbsolute.signum() > 0;
    }
}
