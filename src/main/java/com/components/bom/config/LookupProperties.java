package com.components.bom.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Catalog lookup settings, bound from the {@code lookup} prefix.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "lookup")
public class LookupProperties {

    /** Line items looked up in parallel by a whole-BOM lookup. */
    @Min(1)
    private int concurrency = 4;

    /** Records requested from a keyword search. */
    @Min(1)
    private int keywordMaxResults = 50;

    /** Retry with a keyword search when the MPN search finds nothing. */
    private boolean keywordFallbackOnEmptyMpnResult = true;

    /** Tokens kept in a heuristic keyword. */
    @Min(1)
    private int keywordMaxTokens = 5;
}
