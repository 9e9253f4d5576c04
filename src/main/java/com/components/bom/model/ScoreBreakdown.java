package com.components.bom.model;

import java.math.BigDecimal;

/**
 * Per-criterion sub-scores behind a candidate's total, kept for explainability.
 * Every sub-score lies in {@code [0, 1]}.
 *
 * @param stock            availability against the required quantity
 * @param price            price relative to the cheapest candidate of the set
 * @param lifecycle        production status
 * @param packageMatch     package / footprint compatibility
 * @param resolvedPrice    unit price at the required quantity, {@code null} if unknown
 * @param requiredQuantity quantity the stock and price criteria were evaluated for
 */
public record ScoreBreakdown(
        double stock,
        double price,
        double lifecycle,
        double packageMatch,
        BigDecimal resolvedPrice,
        int requiredQuantity
) {
}
