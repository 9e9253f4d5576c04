package com.components.bom.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One body row of an input BOM table, addressed by column index.
 * <p>
 * Cells are whatever the table reader produced (text, numbers, booleans or {@code null}).
 * Rows only live for the duration of one consolidation run.
 * </p>
 *
 * @param rowNumber 1-based position of the row in the source, used in issue reports
 * @param cells     cell values in column order; may be shorter or longer than the header
 */
public record RawRow(int rowNumber, List<Object> cells) {

    public RawRow {
        cells = cells == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(cells));
    }

    public static RawRow of(final int rowNumber, final Object... cells) {
        return new RawRow(rowNumber, cells == null ? null : Arrays.asList(cells));
    }

    /**
     * Builds a row from a header-keyed mapping, as produced by readers that return one map per
     * row. Columns absent from the map become empty cells.
     *
     * @param rowNumber 1-based row number
     * @param header    the header row the mapping was keyed by
     * @param byHeader  header text to cell value
     * @return the positional row
     */
    public static RawRow fromHeaderMap(final int rowNumber,
                                       final List<String> header,
                                       final Map<String, ?> byHeader) {
        List<Object> values = new ArrayList<>(header.size());
        for (String column : header) {
            values.add(byHeader == null ? null : byHeader.get(column));
        }
        return new RawRow(rowNumber, values);
    }

    /**
     * @param index zero-based column index
     * @return the cell value, or {@code null} when the row has no such column
     */
    public Object cell(final int index) {
        return index >= 0 && index < cells.size() ? cells.get(index) : null;
    }
}
