package com.components.bom.parser;

import com.components.bom.model.Candidate;

import java.util.List;

/**
 * Normalized result set of one catalog search.
 *
 * @param candidates usable candidates in fetch order
 * @param rejected   records that were skipped
 */
public record CandidateBatch(List<Candidate> candidates, List<Rejected> rejected) {

    public CandidateBatch {
        candidates = List.copyOf(candidates);
        rejected = List.copyOf(rejected);
    }

    /**
     * A skipped record.
     *
     * @param index  position of the record in the raw result set
     * @param reason why it could not be used
     */
    public record Rejected(int index, String reason) {
    }
}
