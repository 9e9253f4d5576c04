package com.components.bom.dto;

import com.components.bom.model.RawRow;
import jakarta.validation.constraints.NotEmpty;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Request payload for opening a BOM session.
 * <p>
 * Body rows may be sent positionally ({@code rows}, one array per row in header order) or keyed
 * by header text ({@code records}, one object per row, as spreadsheet readers often produce).
 * Row numbers in issue reports count the header as row 1.
 * </p>
 *
 * @param sourceName file or sheet name, informational only
 * @param header     header row; must not be empty
 * @param rows       positional body rows, may be {@code null}
 * @param records    header-keyed body rows, appended after {@code rows}; may be {@code null}
 */
public record BomUploadRequest(
        String sourceName,
        @NotEmpty List<String> header,
        List<List<Object>> rows,
        List<Map<String, Object>> records
) {

    /**
     * @return all body rows in positional form, numbered from 2
     */
    public List<RawRow> toRawRows() {
        List<RawRow> result = new ArrayList<>();
        int rowNumber = 2;
        if (rows != null) {
            for (List<Object> row : rows) {
                result.add(new RawRow(rowNumber++, row));
            }
        }
        if (records != null) {
            for (Map<String, Object> record : records) {
                result.add(RawRow.fromHeaderMap(rowNumber++, header, record));
            }
        }
        return result;
    }
}
