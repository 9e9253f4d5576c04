package com.components.bom.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One quantity tier of a catalog price list.
 *
 * @param quantity minimum order quantity the price applies from
 * @param price    unit price at that tier
 * @param currency ISO currency code as reported by the catalog, may be {@code null}
 */
public record PriceBreak(int quantity, BigDecimal price, String currency) {

    public PriceBreak {
        Objects.requireNonNull(price, "price");
        if (quantity < 1) {
            throw new IllegalArgumentException("price break quantity must be positive: " + quantity);
        }
    }
}
