package com.components.bom.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A catalog search result in canonical shape, independent of the vendor that returned it.
 *
 * @param candidateId     identity used for selection (distributor part number when known)
 * @param partNumber      manufacturer part number, always present
 * @param manufacturer    manufacturer name, may be {@code null}
 * @param description     catalog description, may be {@code null}
 * @param packageCode     package / footprint text, may be {@code null}
 * @param unitPrice       reference unit price, {@code null} when the catalog gave no price
 * @param priceBreaks     quantity tiers ordered by quantity
 * @param stockQuantity   units on hand, never negative
 * @param lifecycleStatus production status
 * @param attributes      remaining vendor attributes (datasheet, URLs, parametrics, ...)
 */
public record Candidate(
        String candidateId,
        String partNumber,
        String manufacturer,
        String description,
        @JsonProperty("package") String packageCode,
        BigDecimal unitPrice,
        List<PriceBreak> priceBreaks,
        int stockQuantity,
        LifecycleStatus lifecycleStatus,
        Map<String, String> attributes
) {

    public static final String ATTR_PRODUCT_URL = "ProductDetailUrl";
    public static final String ATTR_DATASHEET_URL = "DataSheetUrl";

    public Candidate {
        Objects.requireNonNull(candidateId, "candidateId");
        Objects.requireNonNull(partNumber, "partNumber");
        priceBreaks = priceBreaks == null
                ? List.of()
                : priceBreaks.stream().sorted(Comparator.comparingInt(PriceBreak::quantity)).toList();
        stockQuantity = Math.max(0, stockQuantity);
        lifecycleStatus = lifecycleStatus == null ? LifecycleStatus.UNKNOWN : lifecycleStatus;
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public String attribute(final String name) {
        return attributes.get(name);
    }
}
