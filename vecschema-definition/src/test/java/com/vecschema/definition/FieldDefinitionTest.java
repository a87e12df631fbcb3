package com.vecschema.definition;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldDefinitionTest {

    @Test
    void storageName_defaultsToPropertyName() {
        FieldDefinition f = FieldDefinition.builder(FieldRole.DATA).propertyName("content").build();

        assertEquals("content", f.getPropertyName());
        assertEquals("content", f.getStorageName());
    }

    @Test
    void storageName_overridesPropertyName() {
        FieldDefinition f = FieldDefinition.builder(FieldRole.VECTOR)
                .propertyName("embedding")
                .storageName("vector")
                .dimensions(5)
                .build();

        assertEquals("embedding", f.getPropertyName());
        assertEquals("vector", f.getStorageName());
    }

    @Test
    void build_withoutAnyName_throwsSchemaException() {
        assertThrows(SchemaException.class, () -> FieldDefinition.builder(FieldRole.KEY).build());
        assertThrows(SchemaException.class, () -> FieldDefinition.key("  ").build());
    }

    @Test
    void build_vectorAttributesOnDataField_throwsSchemaException() {
        SchemaException e = assertThrows(SchemaException.class,
                () -> FieldDefinition.data("content").dimensions(3).build());
        assertEquals("content", e.getFieldName());
        assertTrue(e.getMessage().contains("dimensions"));

        assertThrows(SchemaException.class, () -> FieldDefinition.key("id").indexKind("hnsw").build());
        assertThrows(SchemaException.class, () -> FieldDefinition.key("id").distanceFunction("cosine_similarity").build());
    }

    @Test
    void build_indexingFlagsOnNonDataField_throwsSchemaException() {
        assertThrows(SchemaException.class, () -> FieldDefinition.key("id").fullTextIndexed(true).build());
        assertThrows(SchemaException.class, () -> FieldDefinition.vector("v", 3).filterable(true).build());
    }

    @Test
    void build_vectorWithoutDimensions_isDeferredToValidation() {
        FieldDefinition f = FieldDefinition.builder(FieldRole.VECTOR).storageName("vector").build();

        assertNull(f.getDimensions());
        assertTrue(f.isVector());
    }

    @Test
    void newDefaultValue_invokesFactoryPerCall() {
        FieldDefinition f = FieldDefinition.data("tags").defaultFactory(ArrayList::new).build();

        Object first = f.newDefaultValue();
        Object second = f.newDefaultValue();

        assertTrue(f.hasDefault());
        assertEquals(List.of(), first);
        assertNotSame(first, second);
    }

    @Test
    void newDefaultValue_withoutFactory_throwsIllegalState() {
        FieldDefinition f = FieldDefinition.data("content").build();

        assertFalse(f.hasDefault());
        assertThrows(IllegalStateException.class, f::newDefaultValue);
    }

    @Test
    void equals_isStructuralAndIgnoresFactoryIdentity() {
        FieldDefinition a = FieldDefinition.key("id").valueType("text").defaultFactory(() -> "a").build();
        FieldDefinition b = FieldDefinition.key("id").valueType("text").defaultFactory(() -> "b").build();
        FieldDefinition c = FieldDefinition.key("id").valueType("text").build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    void toBuilder_copiesAllAttributes() {
        FieldDefinition f = FieldDefinition.vector("vector", 5).propertyName("embedding")
                .indexKind("hnsw").distanceFunction("cosine_similarity").valueType("float").build();

        assertEquals(f, f.toBuilder().build());
    }

    @Test
    void fromToken_resolvesCaseInsensitiveAndRejectsUnknown() {
        assertEquals(FieldRole.KEY, FieldRole.fromToken(" Key ", "id"));
        assertEquals(FieldRole.VECTOR, FieldRole.fromToken("vector", "v"));
        SchemaException e = assertThrows(SchemaException.class, () -> FieldRole.fromToken("embedding", "v"));
        assertEquals("v", e.getFieldName());
        assertThrows(SchemaException.class, () -> FieldRole.fromToken(null, "v"));
    }
}
