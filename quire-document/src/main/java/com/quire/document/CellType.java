package com.quire.document;

/**
 * Kind of a notebook cell. Only {@link #CODE} cells carry outputs and an execution count.
 * Cell types this model does not know (e.g. future nbformat additions) map to {@link #UNKNOWN};
 * the original type string is kept on the cell so it is written back unchanged.
 */
public enum CellType {
    CODE("code"),
    MARKDOWN("markdown"),
    RAW("raw"),
    UNKNOWN("");

    private final String value;

    CellType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static CellType fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        for (CellType t : values()) {
            if (t != UNKNOWN && t.value.equals(value.trim())) {
                return t;
            }
        }
        return UNKNOWN;
    }
}
