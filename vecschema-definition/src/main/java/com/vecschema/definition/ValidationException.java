package com.vecschema.definition;

/**
 * Thrown when a collection definition violates an aggregate invariant. The message always contains
 * {@link Violation#getDescription()} of the broken invariant.
 */
public final class ValidationException extends VectorSchemaException {

    /** Aggregate invariants checked when a definition is built. */
    public enum Violation {
        NO_KEY_FIELD("no key field"),
        MULTIPLE_KEY_FIELDS("multiple key fields"),
        DUPLICATE_STORAGE_NAME("duplicate storage name"),
        MISSING_DIMENSIONS("vector field missing dimensions"),
        NON_POSITIVE_DIMENSIONS("non-positive dimensions"),
        NO_VECTOR_FIELD("no vector field"),
        INCOMPLETE_CONTAINER_HOOKS("incomplete container hooks"),
        HOOKS_WITHOUT_CONTAINER_MODE("container hooks without container mode");

        private final String description;

        Violation(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Violation violation;

    public ValidationException(Violation violation, String detail) {
        super(detail == null || detail.isBlank()
                ? "Invalid collection definition: " + violation.getDescription()
                : "Invalid collection definition: " + violation.getDescription() + " (" + detail + ")");
        this.violation = violation;
    }

    public Violation getViolation() {
        return violation;
    }
}
