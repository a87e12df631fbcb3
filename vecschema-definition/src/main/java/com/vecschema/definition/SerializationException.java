package com.vecschema.definition;

/**
 * Thrown when converting between rows, records and containers fails: a hook threw or returned
 * nothing, or a row carries fields the definition does not declare.
 */
public final class SerializationException extends VectorSchemaException {

    /** Row index value when the failing row cannot be determined. */
    public static final int UNKNOWN_ROW = -1;

    private final int rowIndex;

    public SerializationException(String message) {
        this(UNKNOWN_ROW, message, null);
    }

    public SerializationException(String message, Throwable cause) {
        this(UNKNOWN_ROW, message, cause);
    }

    public SerializationException(int rowIndex, String message) {
        this(rowIndex, message, null);
    }

    public SerializationException(int rowIndex, String message, Throwable cause) {
        super(rowIndex >= 0 ? "Row " + rowIndex + ": " + message : message, cause);
        this.rowIndex = rowIndex;
    }

    /** Index of the offending row, or {@link #UNKNOWN_ROW}. */
    public int getRowIndex() {
        return rowIndex;
    }

    public boolean hasRowIndex() {
        return rowIndex >= 0;
    }
}
