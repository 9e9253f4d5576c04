package com.components.bom.service.core;

import com.components.bom.model.FieldKey;
import com.components.bom.model.LineItem;
import com.components.bom.model.MergeConflict;
import com.components.bom.model.RawRow;
import com.components.bom.model.RowIssue;
import com.components.bom.parser.CellValues;
import com.components.bom.parser.ColumnMapping;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * <h2>Line-item consolidator</h2>
 *
 * <p>Folds raw BOM rows into unique {@link LineItem}s and aggregates their reference
 * designators.</p>
 *
 * <h3>Merge key</h3>
 * <ul>
 *   <li>MPN (trimmed, upper case) identifies a part. Once an item exists for an MPN, every later
 *       row with that MPN joins it whatever its Value or Package says.</li>
 *   <li>A row without MPN joins the first item with the same (Value, Package) pair (trimmed,
 *       case-folded). An MPN row whose MPN is new may join an item that has no MPN yet through
 *       the same pair; that item then carries the MPN.</li>
 *   <li>Rows with neither MPN, Value nor Package are keyed by their remaining fields, so only
 *       identical rows merge.</li>
 * </ul>
 *
 * <h3>Field conflicts</h3>
 * <p>The first non-empty value of a field wins. A different later value is recorded as a
 * {@link MergeConflict} on the item; consolidation never stops because of it.</p>
 *
 * <p>Malformed rows are degraded (unreadable cells dropped, designators treated as absent) and
 * reported as {@link RowIssue}s; one bad row never blocks the rest of the file.</p>
 */
@Slf4j
@Component
public class LineItemConsolidator {

    private static final Pattern REF_DES_SEPARATORS = Pattern.compile("[,;\\s]+");

    /**
     * Consolidates the body rows of one BOM table.
     *
     * @param mapping header mapping produced by the schema normalizer
     * @param rows    body rows in file order
     * @return consolidated items in first-seen order plus any row issues
     */
    public ConsolidationResult consolidate(final ColumnMapping mapping, final List<RawRow> rows) {
        Objects.requireNonNull(mapping, "mapping");

        List<Group> groups = new ArrayList<>();
        Map<String, Group> byMpn = new HashMap<>();
        List<RowIssue> issues = new ArrayList<>();
        int skipped = 0;

        for (RawRow row : rows == null ? List.<RawRow>of() : rows) {
            if (row == null) {
                skipped++;
                continue;
            }
            RowValues values = extract(mapping, row, issues);
            if (values.isEmpty()) {
                skipped++;
                continue;
            }

            Group group = findGroup(values, groups, byMpn);
            if (group == null) {
                group = new Group(values);
                groups.add(group);
                if (!values.hasIdentity()) {
                    issues.add(new RowIssue(row.rowNumber(),
                            "No MPN, Value, Package or other identifying field; kept as a separate line item"));
                }
            }
            group.absorb(values);
            if (values.mpnKey != null) {
                byMpn.putIfAbsent(values.mpnKey, group);
            }
        }

        List<LineItem> items = new ArrayList<>(groups.size());
        for (int i = 0; i < groups.size(); i++) {
            items.add(groups.get(i).toLineItem(i + 1));
        }
        log.info("Consolidated {} BOM rows into {} line items ({} empty rows skipped, {} issues)",
                rows == null ? 0 : rows.size(), items.size(), skipped, issues.size());
        return new ConsolidationResult(items, issues);
    }

    private static Group findGroup(final RowValues values,
                                   final List<Group> groups,
                                   final Map<String, Group> byMpn) {
        if (values.mpnKey != null) {
            Group existing = byMpn.get(values.mpnKey);
            if (existing != null || values.vpKey == null) {
                return existing;
            }
            return groups.stream()
                    .filter(g -> g.mpnKey == null && values.vpKey.equals(g.vpKey))
                    .findFirst()
                    .orElse(null);
        }
        if (values.vpKey != null) {
            return groups.stream()
                    .filter(g -> values.vpKey.equals(g.vpKey))
                    .findFirst()
                    .orElse(null);
        }
        if (values.fallbackKey != null) {
            return groups.stream()
                    .filter(g -> g.mpnKey == null && g.vpKey == null && values.fallbackKey.equals(g.fallbackKey))
                    .findFirst()
                    .orElse(null);
        }
        return null;
    }

    private static RowValues extract(final ColumnMapping mapping, final RawRow row, final List<RowIssue> issues) {
        Map<FieldKey, String> fields = new LinkedHashMap<>();
        List<String> refDes = new ArrayList<>();

        for (int col = 0; col < mapping.size(); col++) {
            FieldKey key = mapping.keyAt(col);
            String text;
            try {
                text = CellValues.asText(row.cell(col));
            } catch (RuntimeException ex) {
                log.warn("Row {}: unreadable {} cell dropped: {}", row.rowNumber(), key, ex.toString());
                issues.add(new RowIssue(row.rowNumber(), "Unreadable " + key + " cell dropped"));
                continue;
            }
            if (text == null) {
                continue;
            }
            if (FieldKey.REF_DES.equals(key)) {
                refDes.addAll(splitRefDes(text));
            } else {
                fields.put(key, text);
            }
        }

        if (hasExtraCells(row, mapping.size())) {
            issues.add(new RowIssue(row.rowNumber(),
                    "Row has more cells than the header; extra cells ignored"));
        }

        Integer quantity = null;
        String quantityText = fields.get(FieldKey.QUANTITY);
        if (quantityText != null) {
            quantity = CellValues.parseQuantity(quantityText);
            if (quantity == null) {
                issues.add(new RowIssue(row.rowNumber(),
                        "Quantity '" + quantityText + "' is not a whole number; ignored"));
            }
        }
        return new RowValues(row.rowNumber(), fields, refDes, quantity);
    }

    private static boolean hasExtraCells(final RawRow row, final int columns) {
        for (int col = columns; col < row.cells().size(); col++) {
            Object cell = row.cell(col);
            if (cell != null && !cell.toString().isBlank()) {
                return true;
            }
        }
        return false;
    }

    static List<String> splitRefDes(final String text) {
        return Arrays.stream(REF_DES_SEPARATORS.split(text))
                .filter(token -> !token.isEmpty())
                .map(token -> token.toUpperCase(Locale.ROOT))
                .toList();
    }

    private static String fold(final String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Value/Package pair; a {@code null} component means the field was absent.
     */
    private record ValuePackageKey(String value, String packageCode) {
    }

    /**
     * Fields of one row, already normalized.
     */
    private static final class RowValues {

        private final int rowNumber;
        private final Map<FieldKey, String> fields;
        private final List<String> refDes;
        private final Integer quantity;
        private final String mpnKey;
        private final ValuePackageKey vpKey;
        private final SortedMap<String, String> fallbackKey;

        RowValues(final int rowNumber,
                  final Map<FieldKey, String> fields,
                  final List<String> refDes,
                  final Integer quantity) {
            this.rowNumber = rowNumber;
            this.fields = fields;
            this.refDes = refDes;
            this.quantity = quantity;

            String mpn = fields.get(FieldKey.MPN);
            this.mpnKey = mpn == null ? null : mpn.trim().toUpperCase(Locale.ROOT);

            String value = fold(fields.get(FieldKey.VALUE));
            String pkg = fold(fields.get(FieldKey.PACKAGE));
            this.vpKey = value == null && pkg == null ? null : new ValuePackageKey(value, pkg);

            SortedMap<String, String> rest = new TreeMap<>();
            fields.forEach((key, text) -> {
                if (!FieldKey.QUANTITY.equals(key)) {
                    rest.put(key.label().toLowerCase(Locale.ROOT), fold(text));
                }
            });
            this.fallbackKey = mpnKey == null && vpKey == null && !rest.isEmpty() ? rest : null;
        }

        boolean isEmpty() {
            return fields.isEmpty() && refDes.isEmpty();
        }

        boolean hasIdentity() {
            return mpnKey != null || vpKey != null || fallbackKey != null;
        }
    }

    /**
     * Line item under construction.
     */
    private static final class Group {

        private String mpnKey;
        private final ValuePackageKey vpKey;
        private final SortedMap<String, String> fallbackKey;
        private final Map<FieldKey, String> fields = new LinkedHashMap<>();
        private final Set<String> refDes = new LinkedHashSet<>();
        private final List<MergeConflict> conflicts = new ArrayList<>();
        private final Set<Map<FieldKey, String>> rowsWithoutRefDes = new HashSet<>();
        private long explicitQuantity;
        private boolean hasExplicitQuantity;
        private int rowCount;

        Group(final RowValues first) {
            this.mpnKey = first.mpnKey;
            this.vpKey = first.vpKey;
            this.fallbackKey = first.fallbackKey;
        }

        void absorb(final RowValues row) {
            if (mpnKey == null) {
                mpnKey = row.mpnKey;
            }

            // a repeated row adds neither designators nor quantity
            boolean duplicateRow;
            if (row.refDes.isEmpty()) {
                Map<FieldKey, String> folded = new HashMap<>();
                row.fields.forEach((key, value) -> folded.put(key, fold(value)));
                duplicateRow = !rowsWithoutRefDes.add(folded);
            } else {
                boolean newDesignator = false;
                for (String token : row.refDes) {
                    newDesignator |= refDes.add(token);
                }
                duplicateRow = !newDesignator;
            }
            if (!duplicateRow) {
                rowCount++;
                if (row.quantity != null) {
                    explicitQuantity += row.quantity;
                    hasExplicitQuantity = true;
                }
            }

            row.fields.forEach((key, value) -> {
                String kept = fields.get(key);
                if (kept == null) {
                    fields.put(key, value);
                } else if (!FieldKey.QUANTITY.equals(key) && !kept.equalsIgnoreCase(value)) {
                    conflicts.add(new MergeConflict(key, kept, value, row.rowNumber));
                    log.debug("Row {}: {} '{}' conflicts with kept '{}'", row.rowNumber, key, value, kept);
                }
            });
        }

        LineItem toLineItem(final int id) {
            List<String> sorted = new ArrayList<>(refDes);
            sorted.sort(RefDesOrder.INSTANCE);

            int quantity;
            if (hasExplicitQuantity) {
                quantity = (int) Math.min(Integer.MAX_VALUE, Math.max(explicitQuantity, sorted.size()));
            } else {
                quantity = sorted.isEmpty() ? rowCount : sorted.size();
            }
            return new LineItem(id, fields, sorted, quantity, conflicts);
        }
    }
}
