package com.components.bom.parser;

import com.components.bom.exception.BomSchemaException;
import com.components.bom.model.FieldKey;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * <h2>BOM header normalizer</h2>
 *
 * <p>Maps the header row of an arbitrary BOM table onto the canonical {@link FieldKey} set.
 * Matching ignores case, whitespace and underscores and uses a fixed alias table, so
 * {@code "Ref"}, {@code "Reference Designator"} and {@code "DESIGNATOR"} all become
 * {@link FieldKey#REF_DES}.</p>
 *
 * <p>Rules:</p>
 * <ol>
 *   <li>Headers without an alias are kept as {@code Other(header)}; blank headers become
 *       {@code Other("col_<index>")}.</li>
 *   <li>When several columns resolve to the same canonical key the first one wins and the later
 *       ones are demoted to {@code Other(header)} and reported as duplicates.</li>
 *   <li>{@code Other} names are unique per table ({@code Notes}, {@code Notes_2}, ...).</li>
 * </ol>
 */
@Slf4j
@Component
public class SchemaNormalizer {

    private static final Map<String, FieldKey.Kind> ALIASES = buildAliases();

    /** Other columns never reuse a canonical label, so field labels stay unique per item. */
    private static final Set<String> CANONICAL_LABELS = EnumSet.complementOf(EnumSet.of(FieldKey.Kind.OTHER))
            .stream()
            .map(k -> k.getLabel().toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());

    /**
     * Resolves the header row of one BOM table.
     *
     * @param header header cells in column order
     * @return the column mapping, one key per header cell
     * @throws BomSchemaException if the header is missing, empty or entirely blank
     */
    public ColumnMapping normalize(final List<String> header) {
        if (header == null || header.isEmpty()) {
            throw new BomSchemaException("BOM header row is empty");
        }
        if (header.stream().allMatch(StringUtils::isBlank)) {
            throw new BomSchemaException("BOM header row has no usable columns");
        }

        List<String> originals = new ArrayList<>(header.size());
        List<FieldKey> keys = new ArrayList<>(header.size());
        Set<FieldKey.Kind> taken = EnumSet.noneOf(FieldKey.Kind.class);
        Set<String> otherNames = new HashSet<>(CANONICAL_LABELS);
        Set<Integer> duplicates = new LinkedHashSet<>();

        for (int col = 0; col < header.size(); col++) {
            String original = StringUtils.trimToEmpty(header.get(col));
            originals.add(original);

            String name = original.isEmpty() ? "col_" + col : original;
            FieldKey.Kind kind = ALIASES.get(aliasKey(name));

            if (kind != null && taken.add(kind)) {
                keys.add(FieldKey.of(kind));
                continue;
            }
            if (kind != null) {
                duplicates.add(col);
                log.debug("Column {} '{}' duplicates {}; kept as Other", col, original, kind.getLabel());
            }
            keys.add(FieldKey.other(uniqueName(name, otherNames)));
        }

        ColumnMapping mapping = new ColumnMapping(originals, keys, duplicates);
        log.info("Mapped {} BOM columns → {}", keys.size(), keys);
        return mapping;
    }

    /**
     * Lookup key for the alias table: lower case, whitespace and underscores removed.
     */
    static String aliasKey(final String header) {
        return StringUtils.deleteWhitespace(header)
                .replace("_", "")
                .toLowerCase(Locale.ROOT);
    }

    private static String uniqueName(final String name, final Set<String> used) {
        String candidate = name;
        int suffix = 2;
        while (!used.add(candidate.toLowerCase(Locale.ROOT))) {
            candidate = name + "_" + suffix++;
        }
        return candidate;
    }

    private static Map<String, FieldKey.Kind> buildAliases() {
        Map<String, FieldKey.Kind> map = new HashMap<>();
        register(map, FieldKey.Kind.REF_DES,
                "refdes", "ref", "reference", "reference designator", "designator", "designators",
                "ref des");
        register(map, FieldKey.Kind.MPN,
                "mpn", "manufacturer part number", "part number", "part#", "mfr part number",
                "mfr part#", "mfg part number", "manufacturer pn");
        register(map, FieldKey.Kind.VALUE, "value", "component value", "val");
        register(map, FieldKey.Kind.PACKAGE, "package", "footprint", "case", "case code", "size");
        register(map, FieldKey.Kind.VOLTAGE, "voltage", "voltage rating", "v rating", "v");
        register(map, FieldKey.Kind.TOLERANCE, "tolerance", "tol");
        register(map, FieldKey.Kind.POWER, "power", "power rating", "wattage", "w");
        register(map, FieldKey.Kind.DESCRIPTION, "description", "desc", "comment", "notes");
        register(map, FieldKey.Kind.QUANTITY, "quantity", "qty", "qty per board");
        return Map.copyOf(map);
    }

    private static void register(final Map<String, FieldKey.Kind> map,
                                 final FieldKey.Kind kind,
                                 final String... aliases) {
        for (String alias : aliases) {
            map.put(aliasKey(alias), kind);
        }
    }
}
