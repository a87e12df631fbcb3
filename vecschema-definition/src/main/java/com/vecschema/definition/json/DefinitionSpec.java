package com.vecschema.definition.json;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** JSON form of a collection definition: container-mode flag and ordered fields. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DefinitionSpec {

    private final boolean containerMode;
    private final List<FieldSpec> fields;

    @JsonCreator
    public DefinitionSpec(
            @JsonProperty("containerMode") Boolean containerMode,
            @JsonProperty("fields") List<FieldSpec> fields) {
        this.containerMode = Boolean.TRUE.equals(containerMode);
        this.fields = fields != null ? Collections.unmodifiableList(new ArrayList<>(fields)) : List.of();
    }

    /** {@code true}, or null when the definition is not in container mode. */
    @JsonProperty("containerMode")
    public Boolean getContainerMode() {
        return containerMode ? Boolean.TRUE : null;
    }

    @JsonProperty("fields")
    public List<FieldSpec> getFields() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DefinitionSpec that = (DefinitionSpec) o;
        return containerMode == that.containerMode && Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(containerMode, fields);
    }
}
