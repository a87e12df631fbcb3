package com.vecschema.definition;

import com.vecschema.definition.container.ContainerAdapter;
import com.vecschema.definition.container.ContainerHooks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Validated, immutable schema of a collection: ordered fields (declaration order of the backend schema)
 * with exactly one key, at least one vector, unique storage names, plus container-mode settings.
 * <p>
 * Instances come from {@link CollectionDefinitionBuilder} (manual) or from schema extraction, both of
 * which validate before construction. Safe to share across threads.
 */
public final class CollectionDefinition {

    private final List<FieldDefinition> fields;
    private final Map<String, FieldDefinition> byStorageName;
    private final FieldDefinition keyField;
    private final boolean containerMode;
    private final ContainerHooks containerHooks;

    CollectionDefinition(List<FieldDefinition> fields, boolean containerMode, ContainerHooks containerHooks) {
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        Map<String, FieldDefinition> index = new LinkedHashMap<>();
        FieldDefinition key = null;
        for (FieldDefinition f : this.fields) {
            index.put(f.getStorageName(), f);
            if (f.isKey()) key = f;
        }
        this.byStorageName = Collections.unmodifiableMap(index);
        this.keyField = key;
        this.containerMode = containerMode;
        this.containerHooks = containerHooks;
    }

    public static CollectionDefinitionBuilder builder() {
        return new CollectionDefinitionBuilder();
    }

    /** All fields in declaration order. */
    public List<FieldDefinition> getFields() {
        return fields;
    }

    public FieldDefinition getKeyField() {
        return keyField;
    }

    /** Storage name of the key field. */
    public String getKeyName() {
        return keyField.getStorageName();
    }

    public List<FieldDefinition> getDataFields() {
        return fieldsWithRole(FieldRole.DATA);
    }

    public List<FieldDefinition> getVectorFields() {
        return fieldsWithRole(FieldRole.VECTOR);
    }

    public List<String> getDataFieldNames() {
        return storageNamesOf(getDataFields());
    }

    public List<String> getVectorFieldNames() {
        return storageNamesOf(getVectorFields());
    }

    /** Storage names of all fields, in order. */
    public Set<String> getStorageNames() {
        return byStorageName.keySet();
    }

    /**
     * Storage names in order, optionally leaving out the key and/or vector fields (e.g. for payload-only
     * projections).
     */
    public List<String> getStorageNames(boolean includeKey, boolean includeVectors) {
        List<String> names = new ArrayList<>();
        for (FieldDefinition f : fields) {
            if (f.isKey() && !includeKey) continue;
            if (f.isVector() && !includeVectors) continue;
            names.add(f.getStorageName());
        }
        return Collections.unmodifiableList(names);
    }

    /** Property names of fields bound to a record type attribute, in order. */
    public List<String> getPropertyNames() {
        List<String> names = new ArrayList<>();
        for (FieldDefinition f : fields) {
            if (f.getPropertyName() != null) names.add(f.getPropertyName());
        }
        return Collections.unmodifiableList(names);
    }

    public Optional<FieldDefinition> findField(String storageName) {
        return Optional.ofNullable(byStorageName.get(storageName));
    }

    public boolean isContainerMode() {
        return containerMode;
    }

    public boolean hasContainerHooks() {
        return containerHooks != null;
    }

    /** Hooks set on this definition, or null when the default row-list representation is used. */
    public ContainerHooks getContainerHooks() {
        return containerHooks;
    }

    /**
     * Converts rows ({@code storageName → value}) into one container value.
     *
     * @see ContainerAdapter#toContainer(List)
     */
    public Object toContainer(List<? extends Map<String, ?>> rows) {
        return new ContainerAdapter(this).toContainer(rows);
    }

    /**
     * Converts a container value back into rows.
     *
     * @see ContainerAdapter#fromContainer(Object)
     */
    public List<Map<String, Object>> fromContainer(Object container) {
        return new ContainerAdapter(this).fromContainer(container);
    }

    /**
     * Converts a container value back into rows and checks the row count.
     *
     * @see ContainerAdapter#fromContainer(Object, int)
     */
    public List<Map<String, Object>> fromContainer(Object container, int expectedRows) {
        return new ContainerAdapter(this).fromContainer(container, expectedRows);
    }

    /**
     * Converts a container value back into rows and checks them against the rows it was produced from.
     *
     * @see ContainerAdapter#fromContainer(Object, List)
     */
    public List<Map<String, Object>> fromContainer(Object container, List<? extends Map<String, ?>> producedFrom) {
        return new ContainerAdapter(this).fromContainer(container, producedFrom);
    }

    /** Builder pre-filled with this definition's fields and container settings. */
    public CollectionDefinitionBuilder toBuilder() {
        CollectionDefinitionBuilder b = new CollectionDefinitionBuilder()
                .fields(fields)
                .containerMode(containerMode);
        if (containerHooks != null) b.containerHooks(containerHooks);
        return b;
    }

    private List<FieldDefinition> fieldsWithRole(FieldRole role) {
        List<FieldDefinition> out = new ArrayList<>();
        for (FieldDefinition f : fields) {
            if (f.getRole() == role) out.add(f);
        }
        return Collections.unmodifiableList(out);
    }

    private static List<String> storageNamesOf(List<FieldDefinition> list) {
        List<String> names = new ArrayList<>(list.size());
        for (FieldDefinition f : list) names.add(f.getStorageName());
        return Collections.unmodifiableList(names);
    }

    /** Structural equality; container hooks count only by presence. */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CollectionDefinition that = (CollectionDefinition) o;
        return containerMode == that.containerMode
                && fields.equals(that.fields)
                && hasContainerHooks() == that.hasContainerHooks();
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields, containerMode, hasContainerHooks());
    }

    @Override
    public String toString() {
        return "CollectionDefinition{key=" + getKeyName() + ", fields=" + fields
                + (containerMode ? ", containerMode" : "") + "}";
    }
}
