package com.quire.engine;

/**
 * Execution status recorded in a cell's {@code quire.status} metadata while a managed engine runs.
 */
public enum CellStatus {
    /** Not yet started. */
    PENDING("pending"),
    /** Currently executing. */
    RUNNING("running"),
    /** Finished without an exception. */
    COMPLETED("completed"),
    /** Raised an exception. */
    FAILED("failed");

    private final String value;

    CellStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static CellStatus fromValue(Object value) {
        if (value != null) {
            for (CellStatus s : values()) {
                if (s.value.equals(value.toString())) {
                    return s;
                }
            }
        }
        return PENDING;
    }
}
