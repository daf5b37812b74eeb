package com.quire.document.output;

/**
 * Output kinds of a code cell, from the {@code output_type} field. Kinds this model does not know
 * map to {@link #UNKNOWN} and are kept as {@link DataOutput}.
 */
public enum OutputType {
    ERROR("error"),
    STREAM("stream"),
    EXECUTE_RESULT("execute_result"),
    DISPLAY_DATA("display_data"),
    UPDATE_DISPLAY_DATA("update_display_data"),
    UNKNOWN("");

    private final String value;

    OutputType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static OutputType fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        for (OutputType t : values()) {
            if (t != UNKNOWN && t.value.equals(value.trim())) {
                return t;
            }
        }
        return UNKNOWN;
    }
}
