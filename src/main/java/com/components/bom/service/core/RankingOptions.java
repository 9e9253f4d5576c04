package com.components.bom.service.core;

/**
 * Filters applied before candidates are scored.
 *
 * @param allowObsolete    keep candidates whose lifecycle is obsolete
 * @param excludeZeroStock drop candidates with no stock instead of only scoring them low
 * @param maxResults       keep only the best N candidates; {@code 0} keeps all
 */
public record RankingOptions(boolean allowObsolete, boolean excludeZeroStock, int maxResults) {

    public RankingOptions {
        if (maxResults < 0) {
            throw new IllegalArgumentException("maxResults must not be negative: " + maxResults);
        }
    }

    public static RankingOptions defaults() {
        return new RankingOptions(false, false, 0);
    }
}
