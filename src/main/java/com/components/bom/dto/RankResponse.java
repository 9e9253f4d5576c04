package com.components.bom.dto;

import com.components.bom.model.ScoredCandidate;
import com.components.bom.parser.CandidateBatch;
import com.components.bom.service.LookupResult;
import com.components.bom.service.LookupStrategy;

import java.util.List;

/**
 * Ranking of one line item.
 *
 * @param lineItemId line item id
 * @param strategy   catalog search used, {@code null} when the caller supplied the records
 * @param searchKey  MPN or keyword searched, {@code null} when the caller supplied the records
 * @param ranked     candidates, best first
 * @param rejected   records that could not be normalized
 */
public record RankResponse(
        int lineItemId,
        LookupStrategy strategy,
        String searchKey,
        List<ScoredCandidate> ranked,
        List<CandidateBatch.Rejected> rejected
) {

    public static RankResponse from(final LookupResult result) {
        return new RankResponse(result.lineItemId(), result.strategy(), result.searchKey(),
                result.ranked(), result.rejected());
    }
}
