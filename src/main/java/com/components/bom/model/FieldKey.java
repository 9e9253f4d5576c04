package com.components.bom.model;

import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

import java.util.Objects;

/**
 * Canonical BOM field a source column is mapped to.
 * <p>
 * The nine well-known fields are exposed as constants; every other column is kept as
 * {@link Kind#OTHER} together with its original header text, so no input column is ever
 * dropped during normalization.
 * </p>
 *
 * @param kind      canonical kind of the field
 * @param otherName original header name, only set (and required) for {@link Kind#OTHER}
 */
public record FieldKey(Kind kind, String otherName) {

    public static final FieldKey REF_DES = new FieldKey(Kind.REF_DES, null);
    public static final FieldKey MPN = new FieldKey(Kind.MPN, null);
    public static final FieldKey VALUE = new FieldKey(Kind.VALUE, null);
    public static final FieldKey PACKAGE = new FieldKey(Kind.PACKAGE, null);
    public static final FieldKey VOLTAGE = new FieldKey(Kind.VOLTAGE, null);
    public static final FieldKey TOLERANCE = new FieldKey(Kind.TOLERANCE, null);
    public static final FieldKey POWER = new FieldKey(Kind.POWER, null);
    public static final FieldKey DESCRIPTION = new FieldKey(Kind.DESCRIPTION, null);
    public static final FieldKey QUANTITY = new FieldKey(Kind.QUANTITY, null);

    public FieldKey {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.OTHER && StringUtils.isBlank(otherName)) {
            throw new IllegalArgumentException("Other field requires a column name");
        }
        if (kind != Kind.OTHER && otherName != null) {
            throw new IllegalArgumentException("Only Other fields carry a column name");
        }
    }

    /**
     * Creates a pass-through key for a column that matched no alias.
     *
     * @param name original (trimmed) header text
     * @return an {@link Kind#OTHER} key
     */
    public static FieldKey other(final String name) {
        return new FieldKey(Kind.OTHER, name);
    }

    /**
     * Returns the constant for a canonical kind.
     *
     * @param kind any kind except {@link Kind#OTHER}
     * @return the shared key instance
     */
    public static FieldKey of(final Kind kind) {
        return switch (kind) {
            case REF_DES -> REF_DES;
            case MPN -> MPN;
            case VALUE -> VALUE;
            case PACKAGE -> PACKAGE;
            case VOLTAGE -> VOLTAGE;
            case TOLERANCE -> TOLERANCE;
            case POWER -> POWER;
            case DESCRIPTION -> DESCRIPTION;
            case QUANTITY -> QUANTITY;
            case OTHER -> throw new IllegalArgumentException("Use FieldKey.other(name) for Other columns");
        };
    }

    public boolean isOther() {
        return kind == Kind.OTHER;
    }

    /**
     * Display label, e.g. {@code "RefDes"} or the original header of an Other column.
     * Also used as the JSON representation, including as a map key.
     */
    @JsonValue
    public String label() {
        return isOther() ? otherName : kind.getLabel();
    }

    @Override
    public String toString() {
        return label();
    }

    /**
     * The canonical field kinds.
     */
    public enum Kind {
        REF_DES("RefDes"),
        MPN("MPN"),
        VALUE("Value"),
        PACKAGE("Package"),
        VOLTAGE("Voltage"),
        TOLERANCE("Tolerance"),
        POWER("Power"),
        DESCRIPTION("Description"),
        QUANTITY("Quantity"),
        OTHER("Other");

        private final String label;

        Kind(final String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }
}
