package com.components.bom.parser;

import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversions of raw spreadsheet / CSV cell values into normalized text.
 */
public final class CellValues {

    /** Whole number, optionally followed by a zero fraction as spreadsheets emit ("4.0"). */
    private static final Pattern WHOLE_NUMBER = Pattern.compile("^\\+?(\\d{1,9})(?:[.,]0+)?$");

    private CellValues() {
    }

    /**
     * Renders a cell as trimmed text. Blank cells are <em>absent</em> and come back as
     * {@code null}, never as an empty string.
     *
     * @param cell raw cell value
     * @return trimmed text, or {@code null} for an empty cell
     */
    public static String asText(final Object cell) {
        if (cell == null) {
            return null;
        }
        String text;
        if (cell instanceof Double || cell instanceof Float) {
            double d = ((Number) cell).doubleValue();
            text = Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15
                    ? Long.toString((long) d)
                    : cell.toString();
        } else if (cell instanceof BigDecimal decimal) {
            text = decimal.stripTrailingZeros().toPlainString();
        } else {
            text = cell.toString();
        }
        return StringUtils.trimToNull(text);
    }

    /**
     * Parses a quantity cell.
     *
     * @param text normalized cell text
     * @return the quantity, or {@code null} when the text is absent or not a whole number
     */
    public static Integer parseQuantity(final String text) {
        if (text == null) {
            return null;
        }
        Matcher m = WHOLE_NUMBER.matcher(text.trim());
        return m.matches() ? Integer.valueOf(m.group(1)) : null;
    }
}
