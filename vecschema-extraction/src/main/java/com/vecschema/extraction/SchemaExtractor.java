package com.vecschema.extraction;

import com.vecschema.definition.CollectionDefinition;
import com.vecschema.definition.CollectionDefinitionBuilder;
import com.vecschema.definition.FieldDefinition;
import com.vecschema.definition.FieldRole;
import com.vecschema.definition.SchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Derives a {@link CollectionDefinition} from a {@link RecordTypeDescriptor}.
 * <p>
 * Fields without metadata are skipped. For the others the role token selects the {@link FieldRole}
 * and the remaining metadata attributes are merged onto the field; an unspecified {@code type} is
 * inferred from the declared value types ({@link ValueTypes#infer}). Aggregate invariants are checked
 * after all fields are processed. Pure computation: callers should cache the result, normally through
 * the definition registry.
 */
public final class SchemaExtractor {

    private static final Logger log = LoggerFactory.getLogger(SchemaExtractor.class);

    private SchemaExtractor() {
    }

    /**
     * Extracts and validates the collection definition of a record type.
     *
     * @throws SchemaException                              on an unknown role token or malformed metadata
     * @throws com.vecschema.definition.ValidationException if an aggregate invariant is violated
     */
    public static CollectionDefinition extract(RecordTypeDescriptor<?> descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        List<FieldDefinition> fields = extractFields(descriptor);
        CollectionDefinitionBuilder builder = CollectionDefinition.builder()
                .fields(fields)
                .containerMode(descriptor.containerMode());
        if (descriptor.containerHooks() != null) {
            builder.containerHooks(descriptor.containerHooks());
        }
        CollectionDefinition definition = builder.build();
        log.debug("Extracted collection definition for {}: key={} data={} vectors={}",
                descriptor.recordType().getName(), definition.getKeyName(),
                definition.getDataFieldNames(), definition.getVectorFieldNames());
        return definition;
    }

    /**
     * Converts the schema fields of a descriptor, in order, without aggregate validation.
     *
     * @throws SchemaException on an unknown role token or malformed metadata
     */
    public static List<FieldDefinition> extractFields(RecordTypeDescriptor<?> descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        List<FieldDefinition> out = new ArrayList<>();
        for (DeclaredField<?> declared : descriptor.declaredFields()) {
            if (!declared.isSchemaField()) {
                log.trace("Skipping non-schema field {}.{}", descriptor.recordType().getSimpleName(), declared.getName());
                continue;
            }
            out.add(toFieldDefinition(declared));
        }
        return Collections.unmodifiableList(out);
    }

    static FieldDefinition toFieldDefinition(DeclaredField<?> declared) {
        String fieldName = declared.getName();
        FieldMetadata metadata = declared.getMetadata();
        FieldRole role = FieldRole.fromToken(metadata.getRoleToken(), fieldName);
        FieldDefinition.Builder b = FieldDefinition.builder(role)
                .propertyName(fieldName)
                .defaultFactory(declared.getDefaultFactory());
        String valueType = null;
        for (Map.Entry<String, Object> e : metadata.getAttributes().entrySet()) {
            Object value = e.getValue();
            switch (e.getKey()) {
                case FieldMetadata.NAME -> b.storageName(stringValue(fieldName, e.getKey(), value));
                case FieldMetadata.TYPE -> valueType = stringValue(fieldName, e.getKey(), value);
                case FieldMetadata.DIMENSIONS -> b.dimensions(intValue(fieldName, e.getKey(), value));
                case FieldMetadata.INDEX_KIND -> b.indexKind(stringValue(fieldName, e.getKey(), value));
                case FieldMetadata.DISTANCE_FUNCTION -> b.distanceFunction(stringValue(fieldName, e.getKey(), value));
                case FieldMetadata.IS_FULL_TEXT_INDEXED -> b.fullTextIndexed(booleanValue(fieldName, e.getKey(), value));
                case FieldMetadata.IS_FILTERABLE -> b.filterable(booleanValue(fieldName, e.getKey(), value));
                default -> throw new SchemaException(fieldName, "Unknown metadata key '" + e.getKey() + "'");
            }
        }
        b.valueType(valueType != null ? valueType : ValueTypes.infer(declared.getValueTypes()));
        return b.build();
    }

    private static String stringValue(String field, String key, Object value) {
        if (value == null) return null;
        if (!(value instanceof String)) {
            throw new SchemaException(field, "Metadata '" + key + "' must be a string but was " + value.getClass().getSimpleName());
        }
        return (String) value;
    }

    private static Integer intValue(String field, String key, Object value) {
        if (value == null) return null;
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Long) {
            long l = (Long) value;
            if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) return (int) l;
        }
        throw new SchemaException(field, "Metadata '" + key + "' must be an integer but was " + value);
    }

    private static boolean booleanValue(String field, String key, Object value) {
        if (value == null) return false;
        if (!(value instanceof Boolean)) {
            throw new SchemaException(field, "Metadata '" + key + "' must be a boolean but was " + value);
        }
        return (Boolean) value;
    }
}
