package com.components.bom.model;

/**
 * Non-fatal problem found while reading a single BOM row.
 *
 * @param rowNumber source row number
 * @param message   human readable description
 */
public record RowIssue(int rowNumber, String message) {
}
