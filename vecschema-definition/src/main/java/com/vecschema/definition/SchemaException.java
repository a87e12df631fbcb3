package com.vecschema.definition;

/**
 * Thrown when a single field declaration is malformed: unknown role token, unknown metadata key,
 * metadata value of the wrong kind, missing name, or an attribute that does not apply to the role.
 */
public final class SchemaException extends VectorSchemaException {

    private final String fieldName;

    public SchemaException(String fieldName, String message) {
        super(fieldName != null ? "Field '" + fieldName + "': " + message : message);
        this.fieldName = fieldName;
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
        this.fieldName = null;
    }

    /** Name of the offending field (property or storage name), or null when not field-specific. */
    public String getFieldName() {
        return fieldName;
    }
}
