package com.supplier.matching.api;

/**
 * Thrown before scoring when an input record is unusable. The whole run fails;
 * partially excluding records would distort group counts.
 */
public class MalformedProductException extends RuntimeException {

    private final int index;
    private final String productId;
    private final String field;

    public MalformedProductException(int index, String productId, String field, String reason) {
        super("Malformed product at index " + index
                + (productId != null ? " (id=" + productId + ")" : "")
                + ": " + field + " " + reason);
        this.index = index;
        this.productId = productId;
        this.field = field;
    }

    /**
     * Position of the offending record in the input list.
     */
    public int getIndex() {
        return index;
    }

    /**
     * Id of the offending record, or null when the id itself is missing.
     */
    public String getProductId() {
        return productId;
    }

    public String getField() {
        return field;
    }
}
