package com.components.bom.service.core;

import com.components.bom.model.FieldKey;
import com.components.bom.model.LineItem;
import com.components.bom.model.RawRow;
import com.components.bom.parser.ColumnMapping;
import com.components.bom.parser.SchemaNormalizer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LineItemConsolidatorTest {

    private final LineItemConsolidator consolidator = new LineItemConsolidator();
    private final ColumnMapping mapping = new SchemaNormalizer().normalize(
            List.of("RefDes", "MPN", "Value", "Package", "Description", "Qty"));

    @Test
    void rowsWithSameMpnMergeIntoOneItem() {
        ConsolidationResult result = consolidator.consolidate(mapping, List.of(
                RawRow.of(2, "R1", "RC0603FR-071KL"),
                RawRow.of(3, "R2", "RC0603FR-071KL")));

        assertThat(result.lineItems()).hasSize(1);
        LineItem item = result.lineItems().get(0);
        assertThat(item.getRefDesList()).containsExactly("R1", "R2");
        assertThat(item.getQuantity()).isEqualTo(2);
        assertThat(item.mpn()).contains("RC0603FR-071KL");
        assertThat(result.issues()).isEmpty();
    }

    @Test
    void rowsWithoutMpnMergeByValueAndPackage() {
        ConsolidationResult result = consolidator.consolidate(mapping, List.of(
                RawRow.of(2, "C1, C2", null, "100nF", "0603"),
                RawRow.of(3, "C10", null, "100NF", " 0603 "),
                RawRow.of(4, "C3", null, "100nF", "0805")));

        assertThat(result.lineItems()).hasSize(2);
        assertThat(result.lineItems().get(0).getRefDesList()).containsExactly("C1", "C2", "C10");
        assertThat(result.lineItems().get(0).getQuantity()).isEqualTo(3);
        assertThat(result.lineItems().get(1).getRefDesList()).containsExactly("C3");
    }

    @Test
    void designatorsAreSplitDeduplicatedAndNaturallyOrdered() {
        ConsolidationResult result = consolidator.consolidate(mapping, List.of(
                RawRow.of(2, "r10; R2", "GRM188R71H104KA93D"),
                RawRow.of(3, "R1 R2", "GRM188R71H104KA93D")));

        LineItem item = result.lineItems().get(0);
        assertThat(item.getRefDesList()).containsExactly("R1", "R2", "R10");
        assertThat(item.refDesText()).isEqualTo("R1, R2, R10");
        assertThat(item.getQuantity()).isEqualTo(3);
    }

    @Test
    void firstValueWinsAndDisagreementIsRecorded() {
        ConsolidationResult result = consolidator.consolidate(mapping, List.of(
                RawRow.of(2, "U1", "LM358", null, "SOIC-8", "Dual op amp"),
                RawRow.of(3, "U2", "LM358", null, "DIP-8", "dual op amp")));

        LineItem item = result.lineItems().get(0);
        assertThat(item.packageCode()).contains("SOIC-8");
        assertThat(item.getConflicts()).hasSize(1);
        assertThat(item.getConflicts().get(0).field()).isEqualTo(FieldKey.PACKAGE);
        assertThat(item.getConflicts().get(0).discardedValue()).isEqualTo("DIP-8");
        assertThat(item.getConflicts().get(0).rowNumber()).isEqualTo(3);
    }

    @Test
    void explicitQuantityIsSummedAndNeverBelowDesignatorCount() {
        ConsolidationResult result = consolidator.consolidate(mapping, List.of(
                RawRow.of(2, null, "BAT54", null, null, null, 4),
                RawRow.of(3, null, "BAT54", null, null, null, "2.0"),
                RawRow.of(4, "D1, D2, D3", "ABC123", null, null, null, 1)));

        assertThat(result.lineItems().get(0).getQuantity()).isEqualTo(6);
        assertThat(result.lineItems().get(1).getQuantity()).isEqualTo(3);
    }

    @Test
    void consolidationIsOrderIndependent() {
        List<RawRow> rows = List.of(
                RawRow.of(2, "R1", "RC0603FR-071KL", "1k", "0603"),
                RawRow.of(3, "C1", null, "100nF", "0603"),
                RawRow.of(4, "R2", "RC0603FR-071KL", "1k", "0603"),
                RawRow.of(5, "C2", null, "100nF", "0603"),
                RawRow.of(6, "U1", "LM358", null, "SOIC-8"));
        List<RawRow> shuffled = new ArrayList<>(rows);
        Collections.reverse(shuffled);

        assertThat(signature(consolidator.consolidate(mapping, shuffled)))
                .containsExactlyInAnyOrderElementsOf(signature(consolidator.consolidate(mapping, rows)));
    }

    @Test
    void consolidationIsDeterministic() {
        List<RawRow> rows = List.of(
                RawRow.of(2, "R1", "RC0603FR-071KL"),
                RawRow.of(3, "R2", "RC0603FR-071KL"),
                RawRow.of(4, "C1", null, "100nF", "0603"));

        assertThat(signature(consolidator.consolidate(mapping, rows)))
                .containsExactlyElementsOf(signature(consolidator.consolidate(mapping, rows)));
    }

    @Test
    void repeatedRowsChangeNothing() {
        List<RawRow> rows = List.of(
                RawRow.of(2, "R1", "RC0603FR-071KL", "1k", "0603"),
                RawRow.of(3, "R2", "RC0603FR-071KL", "1k", "0603"),
                RawRow.of(4, "C1, C2", null, "100nF", "0603"),
                RawRow.of(5, null, "BAT54", null, "SOD-323", null, 4));
        List<RawRow> twice = new ArrayList<>(rows);
        twice.addAll(rows);

        List<LineItem> once = consolidator.consolidate(mapping, rows).lineItems();
        List<LineItem> again = consolidator.consolidate(mapping, twice).lineItems();

        assertThat(again).hasSameSizeAs(once);
        for (int i = 0; i < once.size(); i++) {
            assertThat(again.get(i).getRefDesList()).isEqualTo(once.get(i).getRefDesList());
            assertThat(again.get(i).getFields()).isEqualTo(once.get(i).getFields());
            assertThat(again.get(i).getQuantity()).isEqualTo(once.get(i).getQuantity());
        }
        assertThat(again.get(2).getQuantity()).isEqualTo(4);
    }

    @Test
    void malformedRowsAreDegradedAndReported() {
        ConsolidationResult result = consolidator.consolidate(mapping, List.of(
                RawRow.of(2, "R1", "RC0603FR-071KL", null, null, null, "lots"),
                RawRow.of(3, "X1", null, null, null, null, null, "extra"),
                RawRow.of(4),
                RawRow.of(5, "R5", "ERJ-3EKF1001V")));

        assertThat(result.lineItems()).extracting(LineItem::getRefDesList)
                .containsExactly(List.of("R1"), List.of("X1"), List.of("R5"));
        assertThat(result.issues()).extracting(issue -> issue.rowNumber())
                .contains(2, 3);
    }

    @Test
    void emptyInputYieldsNoItems() {
        assertThat(consolidator.consolidate(mapping, List.of()).lineItems()).isEmpty();
        assertThat(consolidator.consolidate(mapping, null).lineItems()).isEmpty();
    }

    private static List<String> signature(final ConsolidationResult result) {
        return result.lineItems().stream()
                .map(i -> i.getFields() + "|" + i.getRefDesList() + "|" + i.getQuantity())
                .toList();
    }
}
