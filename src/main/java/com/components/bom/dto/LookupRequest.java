package com.components.bom.dto;

import jakarta.validation.constraints.Min;

/**
 * Optional search keyword and ranking overrides for a catalog lookup.
 *
 * @param keyword          search text typed by the user; replaces the MPN and generated keyword
 *                         searches of a single-item lookup, ignored by the whole-BOM lookup
 * @param allowObsolete    overrides {@code ranking.allow-obsolete} when set
 * @param excludeZeroStock overrides {@code ranking.exclude-zero-stock} when set
 * @param maxResults       overrides {@code ranking.max-results} when set
 */
public record LookupRequest(
        String keyword,
        Boolean allowObsolete,
        Boolean excludeZeroStock,
        @Min(0) Integer maxResults
) {
}
