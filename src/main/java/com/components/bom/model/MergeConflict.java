package com.components.bom.model;

/**
 * Records that two rows merged into the same line item disagreed on a field.
 * The first non-empty value is kept; the other is reported here and never fails the run.
 *
 * @param field          the field in conflict
 * @param keptValue      value retained on the line item
 * @param discardedValue value seen later and not applied
 * @param rowNumber      source row that carried the discarded value
 */
public record MergeConflict(FieldKey field, String keptValue, String discardedValue, int rowNumber) {
}
