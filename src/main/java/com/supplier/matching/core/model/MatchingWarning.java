package com.supplier.matching.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A data-quality warning raised during a run. Warnings never abort the run.
 *
 * @param type       warning kind
 * @param groupId    group the warning belongs to, or null for pair/product level warnings
 * @param productIds products involved
 * @param message    human readable description
 */
public record MatchingWarning(
        WarningType type,
        String groupId,
        List<String> productIds,
        String message
) {
    public MatchingWarning {
        Objects.requireNonNull(type, "type is required");
        productIds = productIds != null ? List.copyOf(productIds) : List.of();
    }

    public static MatchingWarning hashVersionMismatch(String productAId, String productBId, String message) {
        return new MatchingWarning(WarningType.HASH_VERSION_MISMATCH, null,
                List.of(productAId, productBId), message);
    }

    public static MatchingWarning imageUnavailable(String productId, String message) {
        return new MatchingWarning(WarningType.IMAGE_UNAVAILABLE, null, List.of(productId), message);
    }

    public static MatchingWarning currencyMismatch(String groupId, List<String> productIds, String message) {
        return new MatchingWarning(WarningType.CURRENCY_MISMATCH_WITHIN_GROUP, groupId, productIds, message);
    }
}
