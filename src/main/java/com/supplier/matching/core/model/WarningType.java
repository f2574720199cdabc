package com.supplier.matching.core.model;

/**
 * Kinds of recoverable data-quality conditions surfaced with a matching result.
 */
public enum WarningType {
    HASH_VERSION_MISMATCH,
    CURRENCY_MISMATCH_WITHIN_GROUP,
    IMAGE_UNAVAILABLE
}
