package com.components.bom.config;

import com.components.bom.service.core.RankingOptions;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Ranking defaults, bound from the {@code ranking} prefix.
 *
 * <p>Example application.yml snippet:
 * <pre>
 * ranking:
 *   allow-obsolete: false
 *   exclude-zero-stock: false
 *   max-results: 0
 *   package-aliases:
 *     - [SOT-23, SOT-23-3, TO-236]
 *     - [SOIC-8, SO-8]
 * </pre>
 * </p>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "ranking")
public class RankingProperties {

    /** Keep obsolete candidates in the ranking. */
    private boolean allowObsolete;

    /** Drop candidates without stock instead of ranking them low. */
    private boolean excludeZeroStock;

    /** Best N candidates to keep; 0 keeps all. */
    @Min(0)
    private int maxResults;

    /**
     * Groups of package names that fit the same footprint.
     */
    private List<List<String>> packageAliases = new ArrayList<>();

    /**
     * Builds ranking options from these defaults, overridden by any non-null request value.
     *
     * @param allowObsolete    request override or {@code null}
     * @param excludeZeroStock request override or {@code null}
     * @param maxResults       request override or {@code null}
     * @return effective options
     */
    public RankingOptions toOptions(final Boolean allowObsolete,
                                    final Boolean excludeZeroStock,
                                    final Integer maxResults) {
        return new RankingOptions(
                allowObsolete != null ? allowObsolete : this.allowObsolete,
                excludeZeroStock != null ? excludeZeroStock : this.excludeZeroStock,
                maxResults != null ? maxResults : this.maxResults);
    }

    public RankingOptions toOptions() {
        return toOptions(null, null, null);
    }
}
