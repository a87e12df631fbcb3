package com.vecschema.definition.container;

import com.vecschema.definition.CollectionDefinition;
import com.vecschema.definition.SerializationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Converts between a sequence of rows ({@code storageName → value}) and a single container value for a
 * definition in container mode.
 * <p>
 * With hooks set on the definition they do the conversion; without hooks the container is the row list
 * itself (an unmodifiable copy). Row order is preserved in both directions. Rows are keyed by storage
 * names, so renames declared on fields are already applied on both sides of a hook. Every row, incoming
 * or produced by a hook, must be a map whose keys are declared storage names; a hook that throws or
 * returns null fails the conversion with {@link SerializationException}.
 */
public final class ContainerAdapter {

    private final CollectionDefinition definition;

    public ContainerAdapter(CollectionDefinition definition) {
        this.definition = Objects.requireNonNull(definition, "definition");
    }

    /**
     * Builds the container value for the given rows.
     *
     * @param rows ordered rows; values may be null
     * @return the hook's container, or an unmodifiable list of row copies without hooks
     * @throws SerializationException if a row is malformed or the hook fails
     * @throws IllegalStateException  if the definition is not in container mode
     */
    public Object toContainer(List<? extends Map<String, ?>> rows) {
        Objects.requireNonNull(rows, "rows");
        requireContainerMode();
        List<Map<String, Object>> checked = checkRows(rows);
        ContainerHooks hooks = definition.getContainerHooks();
        if (hooks == null) {
            return checked;
        }
        Object container;
        try {
            container = hooks.applyToContainer(checked);
        } catch (SerializationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SerializationException("toContainer hook failed: " + e.getMessage(), e);
        }
        if (container == null) {
            throw new SerializationException("toContainer hook returned null");
        }
        return container;
    }

    /**
     * Recovers rows from a container value.
     *
     * @param container container produced by {@link #toContainer(List)} or by the application
     * @return unmodifiable rows in container order
     * @throws SerializationException if the container is not convertible or yields malformed rows
     */
    public List<Map<String, Object>> fromContainer(Object container) {
        requireContainerMode();
        ContainerHooks hooks = definition.getContainerHooks();
        List<?> rows;
        if (hooks == null) {
            if (!(container instanceof List)) {
                throw new SerializationException("Expected a list of rows but got "
                        + (container == null ? "null" : container.getClass().getName()));
            }
            rows = (List<?>) container;
        } else {
            try {
                rows = hooks.applyFromContainer(container);
            } catch (SerializationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new SerializationException("fromContainer hook failed: " + e.getMessage(), e);
            }
            if (rows == null) {
                throw new SerializationException("fromContainer hook returned null");
            }
        }
        return checkRows(rows);
    }

    /**
     * Same as {@link #fromContainer(Object)} and additionally requires exactly {@code expectedRows} rows,
     * e.g. the number of rows the container was produced from.
     *
     * @throws SerializationException on a row-count mismatch; the row index is the first missing or
     *                                extra row
     */
    public List<Map<String, Object>> fromContainer(Object container, int expectedRows) {
        List<Map<String, Object>> rows = fromContainer(container);
        if (rows.size() != expectedRows) {
            throw new SerializationException(Math.min(rows.size(), expectedRows),
                    "Expected " + expectedRows + " rows but container yielded " + rows.size());
        }
        return rows;
    }

    /**
     * Same as {@link #fromContainer(Object)} and additionally requires the recovered rows to match the rows
     * the container was produced from: the same number of rows and, row by row, the same storage names.
     * Values are not compared.
     *
     * @throws SerializationException on a row-count mismatch or when a row's field set differs from its
     *                                source row
     */
    public List<Map<String, Object>> fromContainer(Object container, List<? extends Map<String, ?>> producedFrom) {
        Objects.requireNonNull(producedFrom, "producedFrom");
        List<Map<String, Object>> rows = fromContainer(container, producedFrom.size());
        for (int i = 0; i < rows.size(); i++) {
            Map<String, ?> source = producedFrom.get(i);
            if (source == null) {
                throw new SerializationException(i, "null source row");
            }
            Set<String> expected = source.keySet();
            Set<String> actual = rows.get(i).keySet();
            if (!actual.equals(expected)) {
                throw new SerializationException(i, "Container yielded fields " + actual + " but the row had " + expected);
            }
        }
        return rows;
    }

    private void requireContainerMode() {
        if (!definition.isContainerMode()) {
            throw new IllegalStateException("Collection definition is not in container mode");
        }
    }

    private List<Map<String, Object>> checkRows(List<?> rows) {
        Set<String> known = definition.getStorageNames();
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Object row = rows.get(i);
            if (!(row instanceof Map)) {
                throw new SerializationException(i, "Expected a map of storage name to value but got "
                        + (row == null ? "null" : row.getClass().getName()));
            }
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) row).entrySet()) {
                Object name = e.getKey();
                if (!(name instanceof String) || !known.contains(name)) {
                    throw new SerializationException(i, "Unknown field '" + name + "'; declared fields are " + known);
                }
                copy.put((String) name, e.getValue());
            }
            out.add(Collections.unmodifiableMap(copy));
        }
        return Collections.unmodifiableList(out);
    }
}
