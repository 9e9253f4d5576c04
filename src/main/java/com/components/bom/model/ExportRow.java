package com.components.bom.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One output line handed to the export writer: the BOM line item merged with the catalog part
 * the user selected for it.
 */
@JsonPropertyOrder({"refDes", "quantity", "description", "packageCode", "mpn",
        "distributorPartNumber", "manufacturer", "value", "voltage", "stock", "unitPrice",
        "lifecycle", "productUrl"})
public record ExportRow(
        String refDes,
        int quantity,
        String description,
        String packageCode,
        String mpn,
        String distributorPartNumber,
        String manufacturer,
        String value,
        String voltage,
        Integer stock,
        BigDecimal unitPrice,
        LifecycleStatus lifecycle,
        String productUrl
) {

    /**
     * Column-titled view for tabular writers, in export column order.
     * Missing values are rendered as empty strings.
     *
     * @return ordered column title to cell text
     */
    public Map<String, String> asColumns() {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("REFDES", text(refDes));
        columns.put("Quantity", Integer.toString(quantity));
        columns.put("Description", text(description));
        columns.put("Package", text(packageCode));
        columns.put("MPN", text(mpn));
        columns.put("Distributor Part Number", text(distributorPartNumber));
        columns.put("Manufacturer", text(manufacturer));
        columns.put("Value", text(value));
        columns.put("Voltage", text(voltage));
        columns.put("Stock", stock == null ? "" : stock.toString());
        columns.put("Price", unitPrice == null ? "" : unitPrice.toPlainString());
        columns.put("Lifecycle", lifecycle == null ? "" : lifecycle.name());
        columns.put("Product URL", text(productUrl));
        return columns;
    }

    private static String text(final String value) {
        return value == null ? "" : value;
    }
}
