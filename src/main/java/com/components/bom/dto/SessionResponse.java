package com.components.bom.dto;

import com.components.bom.model.RowIssue;
import com.components.bom.parser.ColumnMapping;
import com.components.bom.session.BomSession;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Summary of an opened BOM session.
 *
 * @param sessionId  id to use in later requests
 * @param sourceName file or sheet name as sent
 * @param openedAt   when the session was opened
 * @param columns    how each header column was mapped
 * @param lineItems  consolidated line items
 * @param rowIssues  non-fatal problems found in body rows
 */
public record SessionResponse(
        String sessionId,
        String sourceName,
        Instant openedAt,
        List<Column> columns,
        List<LineItemView> lineItems,
        List<RowIssue> rowIssues
) {

    public static SessionResponse from(final BomSession session) {
        ColumnMapping mapping = session.getColumns();
        List<Column> columns = new ArrayList<>(mapping.size());
        for (int i = 0; i < mapping.size(); i++) {
            columns.add(new Column(i, mapping.headers().get(i), mapping.keyAt(i).label(),
                    mapping.keyAt(i).isOther(), mapping.duplicateColumns().contains(i)));
        }
        return new SessionResponse(session.getId(), session.getSourceName(), session.getOpenedAt(), columns,
                session.lineItems().stream().map(LineItemView::from).toList(),
                session.getRowIssues());
    }

    /**
     * @param index     zero-based column index
     * @param header    header text as received
     * @param field     canonical field label, or the column name for unmapped columns
     * @param other     column matched no canonical field
     * @param duplicate column duplicated an earlier canonical column
     */
    public record Column(int index, String header, String field, boolean other, boolean duplicate) {
    }
}
