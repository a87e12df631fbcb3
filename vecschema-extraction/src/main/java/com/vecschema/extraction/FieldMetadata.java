package com.vecschema.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Schema metadata attached to a declared field: a role token ("key", "data", "vector") followed by
 * attribute keys. Recognized keys are the constants below; anything else is rejected at extraction.
 * <pre>{@code
 * FieldMetadata.of("vector").with(FieldMetadata.DIMENSIONS, 5).with(FieldMetadata.INDEX_KIND, "hnsw")
 * }</pre>
 */
public final class FieldMetadata {

    public static final String NAME = "name";
    public static final String TYPE = "type";
    public static final String DIMENSIONS = "dimensions";
    public static final String INDEX_KIND = "indexKind";
    public static final String DISTANCE_FUNCTION = "distanceFunction";
    public static final String IS_FULL_TEXT_INDEXED = "isFullTextIndexed";
    public static final String IS_FILTERABLE = "isFilterable";

    private final String roleToken;
    private final Map<String, Object> attributes;

    private FieldMetadata(String roleToken, Map<String, Object> attributes) {
        this.roleToken = roleToken;
        this.attributes = Collections.unmodifiableMap(attributes);
    }

    /** Metadata with only a role token. The token is resolved (and rejected if unknown) at extraction. */
    public static FieldMetadata of(String roleToken) {
        return new FieldMetadata(roleToken, new LinkedHashMap<>());
    }

    /** Metadata with a role token and attributes, in the given order. */
    public static FieldMetadata of(String roleToken, Map<String, ?> attributes) {
        Objects.requireNonNull(attributes, "attributes");
        return new FieldMetadata(roleToken, new LinkedHashMap<>(attributes));
    }

    /** Returns a copy with one more attribute (replacing an earlier value for the same key). */
    public FieldMetadata with(String key, Object value) {
        Objects.requireNonNull(key, "key");
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        copy.put(key, value);
        return new FieldMetadata(roleToken, copy);
    }

    public String getRoleToken() {
        return roleToken;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FieldMetadata that = (FieldMetadata) o;
        return Objects.equals(roleToken, that.roleToken) && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(roleToken, attributes);
    }

    @Override
    public String toString() {
        return "FieldMetadata{" + roleToken + (attributes.isEmpty() ? "" : ", " + attributes) + "}";
    }
}
