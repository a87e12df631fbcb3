package com.vecschema.definition;

import com.vecschema.definition.ValidationException.Violation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Aggregate checks run once when a {@link CollectionDefinition} is built, whether the fields came
 * from schema extraction or from {@link CollectionDefinitionBuilder}. Per-field checks happen
 * earlier, in {@link FieldDefinition.Builder#build()}.
 */
public final class DefinitionValidator {

    private DefinitionValidator() {
    }

    /**
     * Validates the field list and container settings.
     *
     * @param fields        ordered fields
     * @param containerMode whether the definition describes rows of a bulk container
     * @param hasToHook     whether a toContainer hook was supplied
     * @param hasFromHook   whether a fromContainer hook was supplied
     * @throws ValidationException naming the first violated invariant
     */
    public static void validate(List<FieldDefinition> fields, boolean containerMode, boolean hasToHook, boolean hasFromHook) {
        validateKey(fields);
        validateStorageNames(fields);
        validateVectors(fields);
        if (hasToHook != hasFromHook) {
            throw new ValidationException(Violation.INCOMPLETE_CONTAINER_HOOKS,
                    (hasToHook ? "fromContainer" : "toContainer") + " is missing");
        }
        if (hasToHook && !containerMode) {
            throw new ValidationException(Violation.HOOKS_WITHOUT_CONTAINER_MODE, null);
        }
    }

    private static void validateKey(List<FieldDefinition> fields) {
        List<String> keys = new ArrayList<>();
        for (FieldDefinition f : fields) {
            if (f.isKey()) keys.add(f.getStorageName());
        }
        if (keys.isEmpty()) {
            throw new ValidationException(Violation.NO_KEY_FIELD, null);
        }
        if (keys.size() > 1) {
            throw new ValidationException(Violation.MULTIPLE_KEY_FIELDS, String.join(", ", keys));
        }
    }

    private static void validateStorageNames(List<FieldDefinition> fields) {
        Set<String> seen = new HashSet<>();
        for (FieldDefinition f : fields) {
            if (!seen.add(f.getStorageName())) {
                throw new ValidationException(Violation.DUPLICATE_STORAGE_NAME, f.getStorageName());
            }
        }
    }

    private static void validateVectors(List<FieldDefinition> fields) {
        boolean anyVector = false;
        for (FieldDefinition f : fields) {
            if (!f.isVector()) continue;
            anyVector = true;
            if (f.getDimensions() == null) {
                throw new ValidationException(Violation.MISSING_DIMENSIONS, f.getStorageName());
            }
            if (f.getDimensions() <= 0) {
                throw new ValidationException(Violation.NON_POSITIVE_DIMENSIONS,
                        f.getStorageName() + "=" + f.getDimensions());
            }
        }
        if (!anyVector) {
            throw new ValidationException(Violation.NO_VECTOR_FIELD, null);
        }
    }
}
