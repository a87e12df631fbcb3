package com.vecschema.extraction;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * One field as declared on a record type: its name, the value types it accepts, optional schema
 * metadata (fields without metadata are not part of the schema), an optional default factory and an
 * optional accessor used when mapping records to rows.
 *
 * @param <T> record type
 */
public final class DeclaredField<T> {

    private final String name;
    private final List<Type> valueTypes;
    private final FieldMetadata metadata;
    private final Supplier<?> defaultFactory;
    private final Function<? super T, ?> accessor;

    private DeclaredField(Builder<T> b) {
        this.name = b.name;
        this.valueTypes = Collections.unmodifiableList(new ArrayList<>(b.valueTypes));
        this.metadata = b.metadata;
        this.defaultFactory = b.defaultFactory;
        this.accessor = b.accessor;
    }

    public static <T> Builder<T> builder(String name) {
        return new Builder<>(name);
    }

    public String getName() {
        return name;
    }

    /** Accepted value types; more than one means the field holds any of them (e.g. a vector or its source text). */
    public List<Type> getValueTypes() {
        return valueTypes;
    }

    /** Schema metadata, or null for a non-schema attribute. */
    public FieldMetadata getMetadata() {
        return metadata;
    }

    public Supplier<?> getDefaultFactory() {
        return defaultFactory;
    }

    public Function<? super T, ?> getAccessor() {
        return accessor;
    }

    public boolean isSchemaField() {
        return metadata != null;
    }

    @Override
    public String toString() {
        return "DeclaredField{" + name + ", types=" + valueTypes + (metadata != null ? ", " + metadata : "") + "}";
    }

    public static final class Builder<T> {
        private final String name;
        private final List<Type> valueTypes = new ArrayList<>();
        private FieldMetadata metadata;
        private Supplier<?> defaultFactory;
        private Function<? super T, ?> accessor;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Declared field name must be non-blank");
            }
        }

        public Builder<T> valueTypes(Type... types) {
            for (Type t : types) valueTypes.add(Objects.requireNonNull(t, "value type"));
            return this;
        }

        public Builder<T> metadata(FieldMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder<T> defaultFactory(Supplier<?> defaultFactory) {
            this.defaultFactory = defaultFactory;
            return this;
        }

        public Builder<T> accessor(Function<? super T, ?> accessor) {
            this.accessor = accessor;
            return this;
        }

        public DeclaredField<T> build() {
            return new DeclaredField<>(this);
        }
    }
}
