package com.vecschema.definition.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.vecschema.definition.CollectionDefinition;
import com.vecschema.definition.CollectionDefinitionBuilder;
import com.vecschema.definition.FieldDefinition;
import com.vecschema.definition.FieldRole;
import com.vecschema.definition.SchemaException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JSON serialization of collection definitions, e.g. for declaring a schema to a storage client or
 * keeping manual definitions in files. Null attributes are omitted.
 * <p>
 * Container hooks and default factories are code, not data: they are not written, and a definition
 * read back uses the default row-list container representation and has no defaults.
 */
public final class CollectionDefinitionJson {

    private static final ObjectMapper MAPPER = newMapper();

    private CollectionDefinitionJson() {
    }

    /** Numbers and flags must be given as JSON integers and booleans; no coercion from strings or fractions. */
    private static ObjectMapper newMapper() {
        ObjectMapper mapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        mapper.coercionConfigFor(LogicalType.Integer)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Boolean)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail);
        return mapper;
    }

    /**
     * Parses and validates a definition.
     *
     * @throws SchemaException                              if the JSON is malformed or a field is invalid
     * @throws com.vecschema.definition.ValidationException if the fields violate an aggregate invariant
     */
    public static CollectionDefinition fromJson(String json) {
        Objects.requireNonNull(json, "json");
        DefinitionSpec spec;
        try {
            spec = MAPPER.readValue(json, DefinitionSpec.class);
        } catch (JsonProcessingException e) {
            throw new SchemaException("Malformed collection definition JSON: " + e.getOriginalMessage(), e);
        }
        return fromSpec(spec);
    }

    public static String toJson(CollectionDefinition definition) {
        try {
            return MAPPER.writeValueAsString(toSpec(definition));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static String toJsonPretty(CollectionDefinition definition) {
        try {
            return MAPPER.writer().with(SerializationFeature.INDENT_OUTPUT).writeValueAsString(toSpec(definition));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static CollectionDefinition fromSpec(DefinitionSpec spec) {
        Objects.requireNonNull(spec, "spec");
        CollectionDefinitionBuilder builder = CollectionDefinition.builder().containerMode(Boolean.TRUE.equals(spec.getContainerMode()));
        for (FieldSpec f : spec.getFields()) {
            if (f == null) {
                throw new SchemaException(null, "null entry in fields");
            }
            String label = f.getName() != null ? f.getName() : f.getPropertyName();
            FieldRole role = FieldRole.fromToken(f.getRole(), label);
            builder.field(FieldDefinition.builder(role)
                    .storageName(f.getName())
                    .propertyName(f.getPropertyName())
                    .valueType(f.getType())
                    .dimensions(f.getDimensions())
                    .indexKind(f.getIndexKind())
                    .distanceFunction(f.getDistanceFunction())
                    .fullTextIndexed(Boolean.TRUE.equals(f.getFullTextIndexed()))
                    .filterable(Boolean.TRUE.equals(f.getFilterable()))
                    .build());
        }
        return builder.build();
    }

    public static DefinitionSpec toSpec(CollectionDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        List<FieldSpec> fields = new ArrayList<>();
        for (FieldDefinition f : definition.getFields()) {
            fields.add(new FieldSpec(
                    f.getRole().getToken(),
                    f.getStorageName(),
                    f.getPropertyName(),
                    f.getValueType(),
                    f.getDimensions(),
                    f.getIndexKind(),
                    f.getDistanceFunction(),
                    f.isFullTextIndexed(),
                    f.isFilterable()));
        }
        return new DefinitionSpec(definition.isContainerMode() ? Boolean.TRUE : null, fields);
    }
}
