package com.vecschema.extraction;

import com.vecschema.definition.CollectionDefinition;
import com.vecschema.definition.FieldDefinition;
import com.vecschema.definition.SerializationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Converts records of one type to rows keyed by storage name and back, following a collection
 * definition extracted from the same descriptor.
 * <p>
 * Values pass through unchanged: a vector field holding source text instead of an embedding stays
 * text. When a row omits a field that has a default factory, the factory is invoked for that record.
 *
 * @param <T> record type
 */
public final class RecordMapper<T> {

    private final RecordTypeDescriptor<T> descriptor;
    private final CollectionDefinition definition;
    private final Map<String, Function<? super T, ?>> accessors;

    private RecordMapper(RecordTypeDescriptor<T> descriptor, CollectionDefinition definition) {
        this.descriptor = descriptor;
        this.definition = definition;
        Map<String, DeclaredField<T>> byName = new HashMap<>();
        for (DeclaredField<T> f : descriptor.declaredFields()) byName.put(f.getName(), f);
        this.accessors = new LinkedHashMap<>();
        for (FieldDefinition f : definition.getFields()) {
            String property = f.getPropertyName();
            DeclaredField<T> declared = property != null ? byName.get(property) : null;
            if (declared == null) {
                throw new IllegalArgumentException("Field " + f.getStorageName() + " is not declared on "
                        + descriptor.recordType().getName());
            }
            accessors.put(f.getStorageName(), declared.getAccessor());
        }
    }

    /**
     * @throws IllegalArgumentException if a definition field has no matching declared field
     */
    public static <T> RecordMapper<T> of(RecordTypeDescriptor<T> descriptor, CollectionDefinition definition) {
        return new RecordMapper<>(Objects.requireNonNull(descriptor, "descriptor"),
                Objects.requireNonNull(definition, "definition"));
    }

    public CollectionDefinition getDefinition() {
        return definition;
    }

    /**
     * Reads the schema fields of a record into a row.
     *
     * @throws SerializationException if a field has no accessor or the accessor fails
     */
    public Map<String, Object> toRow(T record) {
        return toRow(record, SerializationException.UNKNOWN_ROW);
    }

    public List<Map<String, Object>> toRows(List<? extends T> records) {
        Objects.requireNonNull(records, "records");
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            rows.add(toRow(records.get(i), i));
        }
        return Collections.unmodifiableList(rows);
    }

    /**
     * Builds a record from a row, filling omitted fields from their default factories.
     *
     * @throws SerializationException if the row has undeclared fields or record construction fails
     */
    public T fromRow(Map<String, ?> row) {
        return fromRow(row, SerializationException.UNKNOWN_ROW);
    }

    public List<T> fromRows(List<? extends Map<String, ?>> rows) {
        Objects.requireNonNull(rows, "rows");
        List<T> records = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            records.add(fromRow(rows.get(i), i));
        }
        return Collections.unmodifiableList(records);
    }

    /** Records to one container value through the definition's container conversion. */
    public Object toContainer(List<? extends T> records) {
        return definition.toContainer(toRows(records));
    }

    /** Container value to records through the definition's container conversion. */
    public List<T> fromContainer(Object container) {
        return fromRows(definition.fromContainer(container));
    }

    private Map<String, Object> toRow(T record, int index) {
        if (record == null) {
            throw new SerializationException(index, "null record");
        }
        Map<String, Object> row = new LinkedHashMap<>();
        for (Map.Entry<String, Function<? super T, ?>> e : accessors.entrySet()) {
            Function<? super T, ?> accessor = e.getValue();
            if (accessor == null) {
                throw new SerializationException(index, "No accessor for field " + e.getKey());
            }
            try {
                row.put(e.getKey(), accessor.apply(record));
            } catch (SerializationException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                throw new SerializationException(index, "Reading field " + e.getKey() + " failed: " + ex.getMessage(), ex);
            }
        }
        return row;
    }

    private T fromRow(Map<String, ?> row, int index) {
        if (row == null) {
            throw new SerializationException(index, "null row");
        }
        for (String name : row.keySet()) {
            if (!accessors.containsKey(name)) {
                throw new SerializationException(index, "Unknown field '" + name + "'; declared fields are "
                        + definition.getStorageNames());
            }
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (FieldDefinition f : definition.getFields()) {
            if (row.containsKey(f.getStorageName())) {
                values.put(f.getPropertyName(), row.get(f.getStorageName()));
            } else if (f.hasDefault()) {
                values.put(f.getPropertyName(), f.newDefaultValue());
            }
        }
        try {
            return descriptor.newRecord(values);
        } catch (SerializationException e) {
            if (e.hasRowIndex() || index < 0) throw e;
            throw new SerializationException(index, e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new SerializationException(index, "Cannot construct " + descriptor.recordType().getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }
}
