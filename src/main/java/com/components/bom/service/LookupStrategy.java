package com.components.bom.service;

/**
 * How the candidates of a lookup were found.
 */
public enum LookupStrategy {
    /** Exact manufacturer part number search. */
    MPN,
    /** Free-text search with a generated or heuristic keyword. */
    KEYWORD,
    /** Nothing to search by. */
    NONE
}
