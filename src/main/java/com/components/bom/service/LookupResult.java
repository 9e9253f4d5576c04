package com.components.bom.service;

import com.components.bom.model.ScoredCandidate;
import com.components.bom.parser.CandidateBatch;

import java.util.List;

/**
 * Outcome of a catalog lookup for one line item.
 *
 * @param lineItemId id of the line item
 * @param strategy   search that produced the candidates
 * @param searchKey  MPN or keyword sent to the catalog, {@code null} for {@link LookupStrategy#NONE}
 * @param ranked     ranked candidates, best first
 * @param rejected   catalog records that could not be normalized
 */
public record LookupResult(
        int lineItemId,
        LookupStrategy strategy,
        String searchKey,
        List<ScoredCandidate> ranked,
        List<CandidateBatch.Rejected> rejected
) {

    public LookupResult {
        ranked = ranked == null ? List.of() : List.copyOf(ranked);
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
    }

    public static LookupResult none(final int lineItemId) {
        return new LookupResult(lineItemId, LookupStrategy.NONE, null, List.of(), List.of());
    }
}
