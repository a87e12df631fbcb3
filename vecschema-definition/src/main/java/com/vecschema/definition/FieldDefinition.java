package com.vecschema.definition;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Immutable description of one schema field.
 * <p>
 * {@code storageName} falls back to {@code propertyName}; at least one of them is required. Vector
 * attributes (dimensions, index kind, distance function) are only accepted on {@link FieldRole#VECTOR}
 * fields and indexing flags only on {@link FieldRole#DATA} fields; anything else is a
 * {@link SchemaException} when the field is built. Whether a vector field actually declares
 * dimensions is checked later, with the other aggregate invariants, by {@link DefinitionValidator}.
 */
public final class FieldDefinition {

    private final FieldRole role;
    private final String propertyName;
    private final String storageName;
    private final String valueType;
    private final Integer dimensions;
    private final String indexKind;
    private final String distanceFunction;
    private final boolean fullTextIndexed;
    private final boolean filterable;
    private final Supplier<?> defaultFactory;

    private FieldDefinition(Builder b) {
        this.role = b.role;
        this.propertyName = b.propertyName;
        this.storageName = b.storageName != null ? b.storageName : b.propertyName;
        this.valueType = b.valueType;
        this.dimensions = b.dimensions;
        this.indexKind = b.indexKind;
        this.distanceFunction = b.distanceFunction;
        this.fullTextIndexed = b.fullTextIndexed;
        this.filterable = b.filterable;
        this.defaultFactory = b.defaultFactory;
    }

    public static Builder builder(FieldRole role) {
        return new Builder(role);
    }

    public static Builder key(String storageName) {
        return builder(FieldRole.KEY).storageName(storageName);
    }

    public static Builder data(String storageName) {
        return builder(FieldRole.DATA).storageName(storageName);
    }

    public static Builder vector(String storageName, int dimensions) {
        return builder(FieldRole.VECTOR).storageName(storageName).dimensions(dimensions);
    }

    public FieldRole getRole() {
        return role;
    }

    public boolean isKey() {
        return role == FieldRole.KEY;
    }

    public boolean isData() {
        return role == FieldRole.DATA;
    }

    public boolean isVector() {
        return role == FieldRole.VECTOR;
    }

    /** In-memory attribute name on the record type; null for manual/tabular definitions. */
    public String getPropertyName() {
        return propertyName;
    }

    /** Name used with the backing store; never null. */
    public String getStorageName() {
        return storageName;
    }

    /** Semantic value type tag; null when neither declared nor inferable. */
    public String getValueType() {
        return valueType;
    }

    /** Vector dimensionality; null for non-vector fields (and for vector fields that fail validation). */
    public Integer getDimensions() {
        return dimensions;
    }

    public String getIndexKind() {
        return indexKind;
    }

    public String getDistanceFunction() {
        return distanceFunction;
    }

    public boolean isFullTextIndexed() {
        return fullTextIndexed;
    }

    public boolean isFilterable() {
        return filterable;
    }

    public boolean hasDefault() {
        return defaultFactory != null;
    }

    /**
     * Returns a freshly produced default value by invoking the factory.
     *
     * @throws IllegalStateException if the field has no default
     */
    public Object newDefaultValue() {
        if (defaultFactory == null) {
            throw new IllegalStateException("Field " + storageName + " has no default");
        }
        return defaultFactory.get();
    }

    /** Returns a builder pre-filled with this field's attributes. */
    public Builder toBuilder() {
        Builder b = new Builder(role);
        b.propertyName = propertyName;
        b.storageName = storageName;
        b.valueType = valueType;
        b.dimensions = dimensions;
        b.indexKind = indexKind;
        b.distanceFunction = distanceFunction;
        b.fullTextIndexed = fullTextIndexed;
        b.filterable = filterable;
        b.defaultFactory = defaultFactory;
        return b;
    }

    /** Structural equality; the default factory counts only by presence. */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FieldDefinition that = (FieldDefinition) o;
        return role == that.role
                && fullTextIndexed == that.fullTextIndexed
                && filterable == that.filterable
                && hasDefault() == that.hasDefault()
                && Objects.equals(propertyName, that.propertyName)
                && Objects.equals(storageName, that.storageName)
                && Objects.equals(valueType, that.valueType)
                && Objects.equals(dimensions, that.dimensions)
                && Objects.equals(indexKind, that.indexKind)
                && Objects.equals(distanceFunction, that.distanceFunction);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, propertyName, storageName, valueType, dimensions, indexKind,
                distanceFunction, fullTextIndexed, filterable, hasDefault());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FieldDefinition{")
                .append(role.getToken()).append(' ').append(storageName);
        if (propertyName != null && !propertyName.equals(storageName)) sb.append(" (property ").append(propertyName).append(')');
        if (valueType != null) sb.append(", type=").append(valueType);
        if (dimensions != null) sb.append(", dimensions=").append(dimensions);
        if (indexKind != null) sb.append(", indexKind=").append(indexKind);
        if (distanceFunction != null) sb.append(", distanceFunction=").append(distanceFunction);
        if (fullTextIndexed) sb.append(", fullTextIndexed");
        if (filterable) sb.append(", filterable");
        return sb.append('}').toString();
    }

    public static final class Builder {
        private final FieldRole role;
        private String propertyName;
        private String storageName;
        private String valueType;
        private Integer dimensions;
        private String indexKind;
        private String distanceFunction;
        private boolean fullTextIndexed;
        private boolean filterable;
        private Supplier<?> defaultFactory;

        private Builder(FieldRole role) {
            this.role = Objects.requireNonNull(role, "role");
        }

        public Builder propertyName(String propertyName) {
            this.propertyName = blankToNull(propertyName);
            return this;
        }

        public Builder storageName(String storageName) {
            this.storageName = blankToNull(storageName);
            return this;
        }

        public Builder valueType(String valueType) {
            this.valueType = blankToNull(valueType);
            return this;
        }

        public Builder dimensions(Integer dimensions) {
            this.dimensions = dimensions;
            return this;
        }

        public Builder indexKind(String indexKind) {
            this.indexKind = blankToNull(indexKind);
            return this;
        }

        public Builder distanceFunction(String distanceFunction) {
            this.distanceFunction = blankToNull(distanceFunction);
            return this;
        }

        public Builder fullTextIndexed(boolean fullTextIndexed) {
            this.fullTextIndexed = fullTextIndexed;
            return this;
        }

        public Builder filterable(boolean filterable) {
            this.filterable = filterable;
            return this;
        }

        /** Factory invoked once per record constructed without this field's value; null = no default. */
        public Builder defaultFactory(Supplier<?> defaultFactory) {
            this.defaultFactory = defaultFactory;
            return this;
        }

        /**
         * Builds the field.
         *
         * @throws SchemaException if neither name is set or an attribute does not apply to the role
         */
        public FieldDefinition build() {
            String name = storageName != null ? storageName : propertyName;
            if (name == null) {
                throw new SchemaException(null, role.getToken() + " field has neither a property name nor a storage name");
            }
            if (role != FieldRole.VECTOR) {
                rejectIfSet(name, "dimensions", dimensions);
                rejectIfSet(name, "indexKind", indexKind);
                rejectIfSet(name, "distanceFunction", distanceFunction);
            }
            if (role != FieldRole.DATA) {
                if (fullTextIndexed) rejectIfSet(name, "isFullTextIndexed", Boolean.TRUE);
                if (filterable) rejectIfSet(name, "isFilterable", Boolean.TRUE);
            }
            return new FieldDefinition(this);
        }

        private void rejectIfSet(String name, String attribute, Object value) {
            if (value != null) {
                throw new SchemaException(name, attribute + " is not applicable to a " + role.getToken() + " field");
            }
        }

        private static String blankToNull(String s) {
            return s == null || s.isBlank() ? null : s.trim();
        }
    }
}
