package com.vecschema.extraction;

import com.vecschema.definition.container.ContainerHooks;

import java.util.List;
import java.util.Map;

/**
 * Describes the fields of a record type so a schema can be extracted without inspecting the type
 * itself. Implemented by hand ({@link SimpleRecordDescriptor}) or derived from annotations
 * ({@link AnnotatedRecordDescriptor}).
 *
 * @param <T> record type
 */
public interface RecordTypeDescriptor<T> {

    /** Identity of the record type; the registry caches definitions by it. */
    Class<T> recordType();

    /** All declared fields in declaration order, schema and non-schema alike. */
    List<DeclaredField<T>> declaredFields();

    /**
     * Creates a record from property values ({@code propertyName → value}); properties missing from the
     * map are left at whatever the record type uses when a value is not given.
     *
     * @throws UnsupportedOperationException if the descriptor cannot construct records
     */
    default T newRecord(Map<String, Object> values) {
        throw new UnsupportedOperationException("Record construction not supported for " + recordType().getName());
    }

    default boolean containerMode() {
        return false;
    }

    /** Container hooks for container-mode types; null = default row-list representation. */
    default ContainerHooks containerHooks() {
        return null;
    }
}
