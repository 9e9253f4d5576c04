package com.components.bom.exception;

/**
 * Thrown when a raw catalog record lacks the identity fields needed to rank or select it.
 * Callers skip the record and continue with the rest of the result set.
 */
public class CandidateParseException extends RuntimeException {

    public CandidateParseException(final String message) {
        super(message);
    }
}
