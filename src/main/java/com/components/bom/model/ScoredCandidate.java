package com.components.bom.model;

/**
 * A candidate together with its weighted total score.
 *
 * @param candidate the ranked candidate, unchanged
 * @param score     weighted sum of the sub-scores
 * @param breakdown the sub-scores that produced {@code score}
 */
public record ScoredCandidate(Candidate candidate, double score, ScoreBreakdown breakdown) {

    public String candidateId() {
        return candidate.candidateId();
    }
}
