package com.components.bom.model;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <h2>Consolidated BOM line item</h2>
 *
 * <p>The durable unit of a BOM: every raw row describing the same logical part is folded into
 * one {@code LineItem}. Identity, fields, designators and quantity are fixed once consolidation
 * finishes; only {@link #getSelectedCandidateId() the selection} changes afterwards, when the
 * selection layer commits a candidate.</p>
 */
@Getter
public class LineItem {

    /**
     * Selection marker used when the user decides no catalog part fits the line item.
     */
    public static final String NOT_AVAILABLE = "NA";

    /**
     * Sequential 1-based id, assigned in first-seen order of the merge key.
     */
    private final int id;

    /**
     * Normalized field values; absent fields have no entry.
     */
    private final Map<FieldKey, String> fields;

    /**
     * De-duplicated designators in natural order.
     */
    private final List<String> refDesList;

    /**
     * Quantity needed per assembly.
     */
    private final int quantity;

    /**
     * Disagreements between merged rows.
     */
    private final List<MergeConflict> conflicts;

    /**
     * Candidate id chosen by the user, {@link #NOT_AVAILABLE}, or {@code null}.
     */
    private volatile String selectedCandidateId;

    public LineItem(final int id,
                    final Map<FieldKey, String> fields,
                    final List<String> refDesList,
                    final int quantity,
                    final List<MergeConflict> conflicts) {
        this.id = id;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields)));
        this.refDesList = List.copyOf(refDesList);
        this.quantity = quantity;
        this.conflicts = List.copyOf(conflicts);
    }

    public Optional<String> field(final FieldKey key) {
        return Optional.ofNullable(fields.get(key));
    }

    public Optional<String> mpn() {
        return field(FieldKey.MPN);
    }

    public Optional<String> value() {
        return field(FieldKey.VALUE);
    }

    public Optional<String> packageCode() {
        return field(FieldKey.PACKAGE);
    }

    public Optional<String> description() {
        return field(FieldKey.DESCRIPTION);
    }

    public boolean hasSelection() {
        return selectedCandidateId != null;
    }

    public boolean isNotAvailable() {
        return NOT_AVAILABLE.equals(selectedCandidateId);
    }

    /**
     * Designators joined the way BOM exports expect them, e.g. {@code "R1, R2, R10"}.
     */
    public String refDesText() {
        return String.join(", ", refDesList);
    }

    public void setSelectedCandidateId(final String selectedCandidateId) {
        this.selectedCandidateId = selectedCandidateId;
    }

    @Override
    public String toString() {
        return "LineItem{id=" + id + ", fields=" + fields + ", refDes=" + refDesList
                + ", quantity=" + quantity + '}';
    }
}
