package com.components.bom.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request payload for ranking caller-supplied catalog records against a line item.
 *
 * @param candidates       raw catalog records, e.g. the {@code Parts} array of a Mouser search
 * @param allowObsolete    overrides {@code ranking.allow-obsolete} when set
 * @param excludeZeroStock overrides {@code ranking.exclude-zero-stock} when set
 * @param maxResults       overrides {@code ranking.max-results} when set
 */
public record RankRequest(
        @NotNull List<JsonNode> candidates,
        Boolean allowObsolete,
        Boolean excludeZeroStock,
        @Min(0) Integer maxResults
) {
}
