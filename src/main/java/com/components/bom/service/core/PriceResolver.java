package com.components.bom.service.core;

import com.components.bom.model.Candidate;
import com.components.bom.model.PriceBreak;

import java.math.BigDecimal;
import java.util.List;

/**
 * Resolves the unit price a candidate costs when ordering a given quantity.
 */
public final class PriceResolver {

    private PriceResolver() {
    }

    /**
     * Picks the break with the greatest quantity not above {@code quantity}. When the quantity is
     * below every break the smallest break applies; without breaks the candidate's unit price is
     * used.
     *
     * @param candidate candidate with breaks sorted by quantity
     * @param quantity  required quantity, values below 1 are treated as 1
     * @return the unit price, or {@code null} when the candidate has no price at all
     */
    public static BigDecimal priceAt(final Candidate candidate, final int quantity) {
        List<PriceBreak> breaks = candidate.priceBreaks();
        if (breaks.isEmpty()) {
            return candidate.unitPrice();
        }
        int n = Math.max(1, quantity);
        PriceBreak chosen = breaks.get(0);
        for (PriceBreak pb : breaks) {
            if (pb.quantity() > n) {
                break;
            }
            chosen = pb;
        }
        return chosen.price();
    }
}
