package com.supplier.matching.core.model;

import java.math.BigDecimal;

/**
 * One line of a price comparison.
 *
 * @param rank            1-based position, cheapest first
 * @param productId       product id
 * @param supplierId      supplier id
 * @param name            original listing name
 * @param price           listing price
 * @param url             listing url, passed through
 * @param deltaFromBest   price minus the group's best price
 */
public record RankedMember(
        int rank,
        String productId,
        String supplierId,
        String name,
        Money price,
        String url,
        BigDecimal deltaFromBest
) {
}
