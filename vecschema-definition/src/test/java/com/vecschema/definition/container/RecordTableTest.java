package com.vecschema.definition.container;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecordTableTest {

    @Test
    void fromRows_raggedRows_roundTripsAndTracksAbsentCells() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("id", "1");
        first.put("content", "a");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("id", "2");
        second.put("vector", List.of(0.5, 0.5));
        Map<String, Object> third = new LinkedHashMap<>();
        third.put("id", "3");
        third.put("content", null);
        List<Map<String, Object>> rows = List.of(first, second, third);

        RecordTable table = RecordTable.fromRows(rows);

        assertEquals(3, table.getRowCount());
        assertEquals(List.of("id", "content", "vector"), table.getColumns());
        assertEquals(Arrays.asList("a", null, null), table.getColumn("content"));
        assertFalse(table.isPresent(1, "content"));
        assertTrue(table.isPresent(2, "content"));
        assertNull(table.get(2, "content"));
        assertFalse(table.isPresent(0, "vector"));
        assertEquals(rows, table.toRows());
    }

    @Test
    void fromRows_empty_hasNoColumns() {
        RecordTable table = RecordTable.fromRows(List.of());

        assertEquals(0, table.getRowCount());
        assertTrue(table.getColumns().isEmpty());
        assertTrue(table.toRows().isEmpty());
    }

    @Test
    void fromColumns_buildsRowsInOrder() {
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("id", List.of("1", "2"));
        columns.put("score", List.of(1, 2));

        RecordTable table = RecordTable.fromColumns(columns);

        assertEquals(2, table.getRowCount());
        assertEquals(2, table.get(1, "score"));
        assertEquals(List.of(Map.of("id", "1", "score", 1), Map.of("id", "2", "score", 2)), table.toRows());
    }

    @Test
    void fromColumns_unequalLengths_throws() {
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("id", List.of("1", "2"));
        columns.put("score", List.of(1));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> RecordTable.fromColumns(columns));
        assertTrue(e.getMessage().contains("score"));
    }

    @Test
    void getColumn_unknown_throws() {
        RecordTable table = RecordTable.fromRows(List.of(Map.of("id", "1")));

        assertThrows(IllegalArgumentException.class, () -> table.getColumn("title"));
        assertFalse(table.hasColumn("title"));
        assertNull(table.get(0, "title"));
    }

    @Test
    void get_rowOutOfRange_throws() {
        RecordTable table = RecordTable.fromRows(List.of(Map.of("id", "1")));

        assertThrows(IndexOutOfBoundsException.class, () -> table.get(1, "id"));
    }

    @Test
    void equals_comparesCellsNotConstruction() {
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("id", List.of("1"));

        assertEquals(RecordTable.fromRows(List.of(Map.of("id", "1"))), RecordTable.fromColumns(columns));
        assertEquals(RecordTable.fromRows(List.of(Map.of("id", "1"))).hashCode(), RecordTable.fromColumns(columns).hashCode());
    }
}
