package com.components.bom.parser;

import com.components.bom.model.FieldKey;

import java.util.List;
import java.util.Set;

/**
 * Result of header normalization: the canonical {@link FieldKey} of every source column.
 *
 * @param headers          original header texts, by column index
 * @param keys             canonical key per column index, same size as {@code headers}
 * @param duplicateColumns indexes of columns that resolved to an already taken canonical key
 *                         and were demoted to {@link FieldKey.Kind#OTHER}
 */
public record ColumnMapping(List<String> headers, List<FieldKey> keys, Set<Integer> duplicateColumns) {

    public ColumnMapping {
        if (headers.size() != keys.size()) {
            throw new IllegalArgumentException("headers and keys differ in size");
        }
        headers = List.copyOf(headers);
        keys = List.copyOf(keys);
        duplicateColumns = Set.copyOf(duplicateColumns);
    }

    public int size() {
        return keys.size();
    }

    public FieldKey keyAt(final int column) {
        return keys.get(column);
    }

    /**
     * @param key canonical key
     * @return index of the column mapped to {@code key}, or {@code -1}
     */
    public int indexOf(final FieldKey key) {
        return keys.indexOf(key);
    }
}
