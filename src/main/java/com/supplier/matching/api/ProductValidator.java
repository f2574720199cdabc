package com.supplier.matching.api;

import com.supplier.matching.core.model.RawProduct;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Boundary checks on a batch. A product needs an id, a supplier id, a name and a
 * price; ids must be unique. Negative amounts are already rejected by
 * {@link com.supplier.matching.core.model.Money}.
 */
public class ProductValidator {

    /**
     * @throws MalformedProductException for the first offending record
     */
    public void validate(List<RawProduct> products) {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < products.size(); i++) {
            RawProduct product = products.get(i);
            if (product == null) {
                throw new MalformedProductException(i, null, "product", "is null");
            }
            String id = product.getId();
            if (isBlank(id)) {
                throw new MalformedProductException(i, null, "id", "is missing");
            }
            if (isBlank(product.getSupplierId())) {
                throw new MalformedProductException(i, id, "supplierId", "is missing");
            }
            if (product.getName() == null) {
                throw new MalformedProductException(i, id, "name", "is missing");
            }
            if (product.getPrice() == null) {
                throw new MalformedProductException(i, id, "price", "is missing");
            }
            if (!seen.add(id)) {
                throw new MalformedProductException(i, id, "id", "is duplicated");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
