package com.components.bom.parser;

import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Parsing of catalog price text such as {@code "$1,234.50"}, {@code "0,10 €"} or {@code "0.012"}.
 */
public final class Prices {

    private Prices() {
    }

    /**
     * @param text price text with optional currency symbol and grouping separators
     * @return the non-negative amount, or empty when the text holds no number
     */
    public static Optional<BigDecimal> parse(final String text) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        String digits = text.replaceAll("[^0-9.,]", "");
        if (digits.isEmpty() || !StringUtils.containsAny(digits, "0123456789")) {
            return Optional.empty();
        }

        int lastDot = digits.lastIndexOf('.');
        int lastComma = digits.lastIndexOf(',');
        String plain;
        if (lastDot >= 0 && lastComma >= 0) {
            // whichever separator comes last is the decimal mark
            char decimal = lastDot > lastComma ? '.' : ',';
            char grouping = decimal == '.' ? ',' : '.';
            plain = digits.replace(String.valueOf(grouping), "").replace(decimal, '.');
        } else if (lastComma >= 0) {
            boolean grouping = StringUtils.countMatches(digits, ',') > 1
                    || digits.length() - lastComma - 1 == 3 && !digits.startsWith("0,");
            plain = grouping ? digits.replace(",", "") : digits.replace(',', '.');
        } else {
            plain = StringUtils.countMatches(digits, '.') > 1 ? digits.replace(".", "") : digits;
        }

        try {
            return Optional.of(new BigDecimal(plain));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
