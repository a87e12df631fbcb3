package com.vecschema.definition;

import com.vecschema.definition.ValidationException.Violation;
import com.vecschema.definition.container.ContainerHooks;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CollectionDefinitionBuilderTest {

    private static CollectionDefinition sample() {
        return CollectionDefinition.builder()
                .field(FieldDefinition.key("id").valueType("text").build())
                .field(FieldDefinition.data("content").valueType("text").fullTextIndexed(true).build())
                .field(FieldDefinition.data("category").valueType("text").filterable(true).build())
                .field(FieldDefinition.vector("vector", 5).indexKind("hnsw").distanceFunction("cosine_similarity").build())
                .build();
    }

    @Test
    void build_twoKeyFields_failsWithMultipleKeyFields() {
        ValidationException e = assertThrows(ValidationException.class, () -> CollectionDefinition.builder()
                .field(FieldDefinition.key("id").build())
                .field(FieldDefinition.key("id2").build())
                .field(FieldDefinition.vector("vector", 3).build())
                .build());

        assertEquals(Violation.MULTIPLE_KEY_FIELDS, e.getViolation());
        assertTrue(e.getMessage().contains("multiple key fields"));
    }

    @Test
    void build_noKeyField_fails() {
        ValidationException e = assertThrows(ValidationException.class, () -> CollectionDefinition.builder()
                .field(FieldDefinition.data("content").build())
                .field(FieldDefinition.vector("vector", 3).build())
                .build());

        assertEquals(Violation.NO_KEY_FIELD, e.getViolation());
        assertTrue(e.getMessage().contains("no key field"));
    }

    @Test
    void build_emptyFieldList_failsWithNoKeyField() {
        ValidationException e = assertThrows(ValidationException.class, () -> CollectionDefinition.builder().build());
        assertEquals(Violation.NO_KEY_FIELD, e.getViolation());
    }

    @Test
    void build_duplicateStorageName_fails() {
        ValidationException e = assertThrows(ValidationException.class, () -> CollectionDefinition.builder()
                .field(FieldDefinition.key("id").build())
                .field(FieldDefinition.data("content").build())
                .field(FieldDefinition.vector("content", 3).build())
                .build());

        assertEquals(Violation.DUPLICATE_STORAGE_NAME, e.getViolation());
        assertTrue(e.getMessage().contains("content"));
    }

    @Test
    void build_vectorWithoutDimensions_fails() {
        ValidationException e = assertThrows(ValidationException.class, () -> CollectionDefinition.builder()
                .field(FieldDefinition.key("id").build())
                .field(FieldDefinition.builder(FieldRole.VECTOR).storageName("vector").build())
                .build());

        assertEquals(Violation.MISSING_DIMENSIONS, e.getViolation());
        assertTrue(e.getMessage().contains("vector field missing dimensions"));
    }

    @Test
    void build_nonPositiveDimensions_fails() {
        ValidationException e = assertThrows(ValidationException.class, () -> CollectionDefinition.builder()
                .field(FieldDefinition.key("id").build())
                .field(FieldDefinition.vector("vector", 0).build())
                .build());

        assertEquals(Violation.NON_POSITIVE_DIMENSIONS, e.getViolation());
    }

    @Test
    void build_noVectorField_fails() {
        ValidationException e = assertThrows(ValidationException.class, () -> CollectionDefinition.builder()
                .field(FieldDefinition.key("id").build())
                .field(FieldDefinition.data("content").build())
                .build());

        assertEquals(Violation.NO_VECTOR_FIELD, e.getViolation());
    }

    @Test
    void build_onlyOneContainerHook_fails() {
        ValidationException e = assertThrows(ValidationException.class, () -> CollectionDefinition.builder()
                .field(FieldDefinition.key("id").build())
                .field(FieldDefinition.vector("vector", 3).build())
                .containerMode(true)
                .toContainer(rows -> rows)
                .build());

        assertEquals(Violation.INCOMPLETE_CONTAINER_HOOKS, e.getViolation());
        assertTrue(e.getMessage().contains("fromContainer"));
    }

    @Test
    void build_hooksWithoutContainerMode_fails() {
        ValidationException e = assertThrows(ValidationException.class, () -> CollectionDefinition.builder()
                .field(FieldDefinition.key("id").build())
                .field(FieldDefinition.vector("vector", 3).build())
                .toContainer(rows -> rows)
                .fromContainer(c -> List.of())
                .build());

        assertEquals(Violation.HOOKS_WITHOUT_CONTAINER_MODE, e.getViolation());
    }

    @Test
    void accessors_reflectFieldOrderAndRoles() {
        CollectionDefinition def = sample();

        assertEquals(4, def.getFields().size());
        assertEquals(FieldRole.KEY, def.getKeyField().getRole());
        assertEquals("id", def.getKeyName());
        assertEquals(List.of("content", "category"), def.getDataFieldNames());
        assertEquals(List.of("vector"), def.getVectorFieldNames());
        assertEquals(5, def.getVectorFields().get(0).getDimensions());
        assertEquals(List.of("id", "content", "category", "vector"), List.copyOf(def.getStorageNames()));
        assertEquals(List.of("content", "category"), def.getStorageNames(false, false));
        assertEquals(List.of("id", "content", "category"), def.getStorageNames(true, false));
        assertTrue(def.findField("category").orElseThrow().isFilterable());
        assertTrue(def.findField("missing").isEmpty());
        assertTrue(def.getPropertyNames().isEmpty());
        assertFalse(def.isContainerMode());
        assertFalse(def.hasContainerHooks());
    }

    @Test
    void accessors_areUnmodifiable() {
        CollectionDefinition def = sample();

        assertThrows(UnsupportedOperationException.class, () -> def.getFields().clear());
        Set<String> names = def.getStorageNames();
        assertThrows(UnsupportedOperationException.class, () -> names.remove("id"));
    }

    @Test
    void toBuilder_rebuildsEqualDefinition() {
        CollectionDefinition def = sample();
        CollectionDefinition copy = def.toBuilder().build();

        assertNotSame(def, copy);
        assertEquals(def, copy);
        assertEquals(def.hashCode(), copy.hashCode());
    }

    @Test
    void toBuilder_canExtendDefinition() {
        CollectionDefinition extended = sample().toBuilder()
                .field(FieldDefinition.vector("title_vector", 3).build())
                .build();

        assertEquals(List.of("vector", "title_vector"), extended.getVectorFieldNames());
    }

    @Test
    void equals_comparesContainerHooksByPresenceOnly() {
        CollectionDefinition first = sample().toBuilder()
                .containerMode(true)
                .containerHooks(ContainerHooks.recordTable())
                .build();
        CollectionDefinition second = sample().toBuilder()
                .containerMode(true)
                .containerHooks(ContainerHooks.recordTable())
                .build();
        CollectionDefinition withoutHooks = sample().toBuilder().containerMode(true).build();

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, withoutHooks);
    }
}
