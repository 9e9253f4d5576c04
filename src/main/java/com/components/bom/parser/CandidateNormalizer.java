package com.components.bom.parser;

import com.components.bom.exception.CandidateParseException;
import com.components.bom.model.Candidate;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a catalog-specific search record into a canonical {@link Candidate}.
 */
@FunctionalInterface
public interface CandidateNormalizer {

    /**
     * @param record one raw record exactly as the catalog returned it
     * @return the canonical candidate
     * @throws CandidateParseException if the record has no manufacturer part number
     */
    Candidate normalize(JsonNode record);

    /**
     * Normalizes a whole result set. Records that cannot be normalized are reported in
     * {@link CandidateBatch#rejected()} and do not affect the others.
     *
     * @param records raw records in fetch order
     * @return candidates in fetch order plus the rejected records
     */
    default CandidateBatch normalizeAll(final List<JsonNode> records) {
        List<Candidate> candidates = new ArrayList<>();
        List<CandidateBatch.Rejected> rejected = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            try {
                candidates.add(normalize(records.get(i)));
            } catch (CandidateParseException ex) {
                rejected.add(new CandidateBatch.Rejected(i, ex.getMessage()));
            }
        }
        if (!rejected.isEmpty()) {
            Logger log = LoggerFactory.getLogger(getClass());
            log.warn("Skipped {} of {} catalog records: {}", rejected.size(), records.size(), rejected);
        }
        return new CandidateBatch(candidates, rejected);
    }
}
