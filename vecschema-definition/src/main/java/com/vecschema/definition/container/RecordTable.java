package com.vecschema.definition.container;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable column-oriented table: a bulk container holding many rows under one set of columns.
 * <p>
 * Grouping rows whose key sets differ is allowed; cells a row did not carry are remembered as absent
 * (read as null) and left out again by {@link #toRows()}, so {@code fromRows(rows).toRows()} equals
 * {@code rows}. Column order is the order in which names are first seen.
 */
public final class RecordTable {

    private static final Object ABSENT = new Object();

    private final List<String> columns;
    private final Map<String, List<Object>> cells;
    private final int rowCount;

    private RecordTable(List<String> columns, Map<String, List<Object>> cells, int rowCount) {
        this.columns = Collections.unmodifiableList(columns);
        this.cells = cells;
        this.rowCount = rowCount;
    }

    /** Groups rows into a table. */
    public static RecordTable fromRows(List<? extends Map<String, ?>> rows) {
        Objects.requireNonNull(rows, "rows");
        List<String> columns = new ArrayList<>();
        Map<String, List<Object>> cells = new LinkedHashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            Map<String, ?> row = Objects.requireNonNull(rows.get(i), "row " + i);
            for (Map.Entry<String, ?> e : row.entrySet()) {
                List<Object> column = cells.get(e.getKey());
                if (column == null) {
                    column = new ArrayList<>(Collections.nCopies(i, ABSENT));
                    cells.put(e.getKey(), column);
                    columns.add(e.getKey());
                }
                column.add(e.getValue());
            }
            for (List<Object> column : cells.values()) {
                if (column.size() == i) column.add(ABSENT);
            }
        }
        return new RecordTable(columns, cells, rows.size());
    }

    /**
     * Builds a table from whole columns of equal length.
     *
     * @throws IllegalArgumentException if column lengths differ
     */
    public static RecordTable fromColumns(Map<String, ? extends List<?>> columnValues) {
        Objects.requireNonNull(columnValues, "columnValues");
        List<String> columns = new ArrayList<>();
        Map<String, List<Object>> cells = new LinkedHashMap<>();
        int rowCount = -1;
        for (Map.Entry<String, ? extends List<?>> e : columnValues.entrySet()) {
            List<?> values = Objects.requireNonNull(e.getValue(), "column " + e.getKey());
            if (rowCount >= 0 && values.size() != rowCount) {
                throw new IllegalArgumentException("Column " + e.getKey() + " has " + values.size()
                        + " values, expected " + rowCount);
            }
            rowCount = values.size();
            columns.add(e.getKey());
            cells.put(e.getKey(), new ArrayList<>(values));
        }
        return new RecordTable(columns, cells, Math.max(rowCount, 0));
    }

    /** Ungroups the table into rows, in row order, omitting absent cells. */
    public List<Map<String, Object>> toRows() {
        List<Map<String, Object>> rows = new ArrayList<>(rowCount);
        for (int i = 0; i < rowCount; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (String column : columns) {
                Object v = cells.get(column).get(i);
                if (v != ABSENT) row.put(column, v);
            }
            rows.add(row);
        }
        return rows;
    }

    public List<String> getColumns() {
        return columns;
    }

    public int getRowCount() {
        return rowCount;
    }

    public boolean hasColumn(String column) {
        return cells.containsKey(column);
    }

    /** Values of one column in row order; absent cells read as null. */
    public List<Object> getColumn(String column) {
        List<Object> values = cells.get(column);
        if (values == null) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        List<Object> out = new ArrayList<>(values.size());
        for (Object v : values) out.add(v == ABSENT ? null : v);
        return Collections.unmodifiableList(out);
    }

    /** Cell value; null when absent. */
    public Object get(int row, String column) {
        Object v = cellOrAbsent(row, column);
        return v == ABSENT ? null : v;
    }

    public boolean isPresent(int row, String column) {
        return cellOrAbsent(row, column) != ABSENT;
    }

    private Object cellOrAbsent(int row, String column) {
        Objects.checkIndex(row, rowCount);
        List<Object> values = cells.get(column);
        return values != null ? values.get(row) : ABSENT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecordTable that = (RecordTable) o;
        return rowCount == that.rowCount && columns.equals(that.columns) && toRows().equals(that.toRows());
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, toRows());
    }

    @Override
    public String toString() {
        return "RecordTable{columns=" + columns + ", rows=" + rowCount + "}";
    }
}
