package com.components.bom.dto;

import com.components.bom.model.LineItem;
import com.components.bom.model.MergeConflict;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON view of a line item.
 */
public record LineItemView(
        int id,
        Map<String, String> fields,
        List<String> refDes,
        int quantity,
        List<MergeConflict> conflicts,
        String selectedCandidateId
) {

    public static LineItemView from(final LineItem item) {
        Map<String, String> fields = new LinkedHashMap<>();
        item.getFields().forEach((key, value) -> fields.put(key.label(), value));
        return new LineItemView(item.getId(), fields, item.getRefDesList(), item.getQuantity(),
                item.getConflicts(), item.getSelectedCandidateId());
    }
}
