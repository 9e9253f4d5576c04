package com.components.bom.service.core;

import com.components.bom.model.LineItem;
import com.components.bom.model.RowIssue;

import java.util.List;

/**
 * Output of one consolidation run.
 *
 * @param lineItems consolidated items in first-seen order
 * @param issues    non-fatal row problems, in row order
 */
public record ConsolidationResult(List<LineItem> lineItems, List<RowIssue> issues) {

    public ConsolidationResult {
        lineItems = List.copyOf(lineItems);
        issues = List.copyOf(issues);
    }
}
