package com.vecschema.extraction;

import com.vecschema.definition.container.ContainerHooks;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Hand-written {@link RecordTypeDescriptor}: the record type lists its own fields, accessors and
 * factory instead of being inspected reflectively.
 * <pre>{@code
 * RecordTypeDescriptor<Doc> d = SimpleRecordDescriptor.builder(Doc.class)
 *         .field("id", String.class, FieldMetadata.of("key"), Doc::id)
 *         .field("content", String.class, FieldMetadata.of("data"), Doc::content)
 *         .field("embedding", float[].class, FieldMetadata.of("vector").with("dimensions", 5), Doc::embedding)
 *         .factory(v -> new Doc((String) v.get("id"), (String) v.get("content"), (float[]) v.get("embedding")))
 *         .build();
 * }</pre>
 *
 * @param <T> record type
 */
public final class SimpleRecordDescriptor<T> implements RecordTypeDescriptor<T> {

    private final Class<T> recordType;
    private final List<DeclaredField<T>> fields;
    private final Function<Map<String, Object>, ? extends T> factory;
    private final boolean containerMode;
    private final ContainerHooks containerHooks;

    private SimpleRecordDescriptor(Builder<T> b) {
        this.recordType = b.recordType;
        this.fields = Collections.unmodifiableList(new ArrayList<>(b.fields));
        this.factory = b.factory;
        this.containerMode = b.containerMode;
        this.containerHooks = b.containerHooks;
    }

    public static <T> Builder<T> builder(Class<T> recordType) {
        return new Builder<>(recordType);
    }

    @Override
    public Class<T> recordType() {
        return recordType;
    }

    @Override
    public List<DeclaredField<T>> declaredFields() {
        return fields;
    }

    @Override
    public T newRecord(Map<String, Object> values) {
        if (factory == null) {
            return RecordTypeDescriptor.super.newRecord(values);
        }
        return factory.apply(values);
    }

    @Override
    public boolean containerMode() {
        return containerMode;
    }

    @Override
    public ContainerHooks containerHooks() {
        return containerHooks;
    }

    public static final class Builder<T> {
        private final Class<T> recordType;
        private final List<DeclaredField<T>> fields = new ArrayList<>();
        private Function<Map<String, Object>, ? extends T> factory;
        private boolean containerMode;
        private ContainerHooks containerHooks;

        private Builder(Class<T> recordType) {
            this.recordType = Objects.requireNonNull(recordType, "recordType");
        }

        public Builder<T> field(DeclaredField<T> field) {
            fields.add(Objects.requireNonNull(field, "field"));
            return this;
        }

        /** Schema field (or non-schema attribute when {@code metadata} is null) with an accessor. */
        public Builder<T> field(String name, Type valueType, FieldMetadata metadata, Function<? super T, ?> accessor) {
            return field(DeclaredField.<T>builder(name)
                    .valueTypes(valueType)
                    .metadata(metadata)
                    .accessor(accessor)
                    .build());
        }

        /** Creates records from {@code propertyName → value}; null = descriptor cannot construct records. */
        public Builder<T> factory(Function<Map<String, Object>, ? extends T> factory) {
            this.factory = factory;
            return this;
        }

        public Builder<T> containerMode(boolean containerMode) {
            this.containerMode = containerMode;
            return this;
        }

        public Builder<T> containerHooks(ContainerHooks containerHooks) {
            this.containerHooks = containerHooks;
            return this;
        }

        public SimpleRecordDescriptor<T> build() {
            return new SimpleRecordDescriptor<>(this);
        }
    }
}
