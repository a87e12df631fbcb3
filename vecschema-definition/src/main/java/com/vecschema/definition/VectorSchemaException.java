package com.vecschema.definition;

/**
 * Base type of all schema errors. Raised synchronously at definition build or conversion time and
 * never retried: an invalid schema stays invalid.
 */
public abstract class VectorSchemaException extends RuntimeException {

    protected VectorSchemaException(String message) {
        super(message);
    }

    protected VectorSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
