package com.vecschema.definition.json;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** JSON form of one field: role token plus storage metadata. Unset attributes are omitted. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"role", "name", "propertyName", "type", "dimensions", "indexKind", "distanceFunction",
        "isFullTextIndexed", "isFilterable"})
public final class FieldSpec {

    private final String role;
    private final String name;
    private final String propertyName;
    private final String type;
    private final Integer dimensions;
    private final String indexKind;
    private final String distanceFunction;
    private final Boolean fullTextIndexed;
    private final Boolean filterable;

    @JsonCreator
    public FieldSpec(
            @JsonProperty("role") String role,
            @JsonProperty("name") String name,
            @JsonProperty("propertyName") String propertyName,
            @JsonProperty("type") String type,
            @JsonProperty("dimensions") Integer dimensions,
            @JsonProperty("indexKind") String indexKind,
            @JsonProperty("distanceFunction") String distanceFunction,
            @JsonProperty("isFullTextIndexed") Boolean fullTextIndexed,
            @JsonProperty("isFilterable") Boolean filterable) {
        this.role = role;
        this.name = name;
        this.propertyName = propertyName;
        this.type = type;
        this.dimensions = dimensions;
        this.indexKind = indexKind;
        this.distanceFunction = distanceFunction;
        this.fullTextIndexed = Boolean.TRUE.equals(fullTextIndexed) ? Boolean.TRUE : null;
        this.filterable = Boolean.TRUE.equals(filterable) ? Boolean.TRUE : null;
    }

    @JsonProperty("role")
    public String getRole() {
        return role;
    }

    /** Storage name. */
    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("propertyName")
    public String getPropertyName() {
        return propertyName;
    }

    @JsonProperty("type")
    public String getType() {
        return type;
    }

    @JsonProperty("dimensions")
    public Integer getDimensions() {
        return dimensions;
    }

    @JsonProperty("indexKind")
    public String getIndexKind() {
        return indexKind;
    }

    @JsonProperty("distanceFunction")
    public String getDistanceFunction() {
        return distanceFunction;
    }

    @JsonProperty("isFullTextIndexed")
    public Boolean getFullTextIndexed() {
        return fullTextIndexed;
    }

    @JsonProperty("isFilterable")
    public Boolean getFilterable() {
        return filterable;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FieldSpec that = (FieldSpec) o;
        return Objects.equals(role, that.role) && Objects.equals(name, that.name)
                && Objects.equals(propertyName, that.propertyName) && Objects.equals(type, that.type)
                && Objects.equals(dimensions, that.dimensions) && Objects.equals(indexKind, that.indexKind)
                && Objects.equals(distanceFunction, that.distanceFunction)
                && Objects.equals(fullTextIndexed, that.fullTextIndexed) && Objects.equals(filterable, that.filterable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, name, propertyName, type, dimensions, indexKind, distanceFunction, fullTextIndexed, filterable);
    }
}
