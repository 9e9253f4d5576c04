package com.components.bom.model;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Set;

/**
 * Vendor-reported production status of a part.
 */
public enum LifecycleStatus {

    ACTIVE,
    /** Not Recommended for New Designs. */
    NRND,
    OBSOLETE,
    UNKNOWN;

    private static final Set<String> ACTIVE_TEXT = Set.of(
            "ACTIVE", "LIFEBUY", "NEW", "NEW PRODUCT", "NEW AT MOUSER", "PRODUCTION", "IN PRODUCTION");

    private static final Set<String> NRND_TEXT = Set.of(
            "NRND", "NOT RECOMMENDED FOR NEW DESIGNS", "NOT RECOMMENDED FOR NEW DESIGN",
            "LAST TIME BUY", "LTB");

    private static final Set<String> OBSOLETE_TEXT = Set.of(
            "OBSOLETE", "EOL", "END OF LIFE", "END OF LIFE (EOL)", "DISCONTINUED");

    /**
     * Maps free-form catalog text to a status. Blank or unrecognised text is {@link #UNKNOWN}.
     *
     * @param text lifecycle text as delivered by the catalog
     * @return the matching status, never {@code null}
     */
    public static LifecycleStatus fromVendorText(final String text) {
        if (StringUtils.isBlank(text)) {
            return UNKNOWN;
        }
        String normalized = StringUtils.normalizeSpace(text).toUpperCase(Locale.ROOT);
        if (ACTIVE_TEXT.contains(normalized)) {
            return ACTIVE;
        }
        if (NRND_TEXT.contains(normalized)) {
            return NRND;
        }
        if (OBSOLETE_TEXT.contains(normalized)) {
            return OBSOLETE;
        }
        return UNKNOWN;
    }
}
