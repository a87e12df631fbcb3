package com.vecschema.definition;

import com.vecschema.definition.container.ContainerHooks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Explicit construction path for collection definitions that have no dedicated record class, such as
 * one definition shared by the anonymous rows of a table. {@link #build()} runs the same aggregate
 * validation as schema extraction.
 * <pre>{@code
 * CollectionDefinition def = CollectionDefinition.builder()
 *         .field(FieldDefinition.key("id").build())
 *         .field(FieldDefinition.data("content").valueType("text").build())
 *         .field(FieldDefinition.vector("vector", 5).indexKind("hnsw").build())
 *         .containerMode(true)
 *         .containerHooks(ContainerHooks.recordTable())
 *         .build();
 * }</pre>
 */
public final class CollectionDefinitionBuilder {

    private static final Logger log = LoggerFactory.getLogger(CollectionDefinitionBuilder.class);

    private final List<FieldDefinition> fields = new ArrayList<>();
    private boolean containerMode;
    private Function<? super List<Map<String, Object>>, ?> toContainer;
    private Function<Object, ? extends List<? extends Map<String, ?>>> fromContainer;
    private ContainerHooks containerHooks;

    CollectionDefinitionBuilder() {
    }

    /** Appends a field; order is kept. */
    public CollectionDefinitionBuilder field(FieldDefinition field) {
        fields.add(Objects.requireNonNull(field, "field"));
        return this;
    }

    /** Appends the given fields in order. */
    public CollectionDefinitionBuilder fields(List<FieldDefinition> fieldList) {
        Objects.requireNonNull(fieldList, "fields");
        for (FieldDefinition f : fieldList) field(f);
        return this;
    }

    public CollectionDefinitionBuilder containerMode(boolean containerMode) {
        this.containerMode = containerMode;
        return this;
    }

    /** Rows to container hook. Must be paired with {@link #fromContainer(Function)}. */
    public CollectionDefinitionBuilder toContainer(Function<? super List<Map<String, Object>>, ?> hook) {
        this.toContainer = hook;
        this.containerHooks = null;
        return this;
    }

    /** Container to rows hook. Must be paired with {@link #toContainer(Function)}. */
    public CollectionDefinitionBuilder fromContainer(Function<Object, ? extends List<? extends Map<String, ?>>> hook) {
        this.fromContainer = hook;
        this.containerHooks = null;
        return this;
    }

    /** Sets both hooks at once; replaces any hook set individually. */
    public CollectionDefinitionBuilder containerHooks(ContainerHooks hooks) {
        this.containerHooks = hooks;
        this.toContainer = null;
        this.fromContainer = null;
        return this;
    }

    /**
     * Sets typed hooks for a container class; a container of another class fails conversion with
     * {@link SerializationException}.
     */
    public <C> CollectionDefinitionBuilder containerHooks(Class<C> containerType,
                                                        Function<? super List<Map<String, Object>>, ? extends C> to,
                                                        Function<? super C, ? extends List<? extends Map<String, ?>>> from) {
        return containerHooks(ContainerHooks.typed(containerType, to, from));
    }

    /**
     * Validates and builds the definition.
     *
     * @throws ValidationException if an aggregate invariant is violated
     */
    public CollectionDefinition build() {
        boolean hasTo = containerHooks != null || toContainer != null;
        boolean hasFrom = containerHooks != null || fromContainer != null;
        DefinitionValidator.validate(fields, containerMode, hasTo, hasFrom);
        ContainerHooks hooks = containerHooks;
        if (hooks == null && toContainer != null) {
            hooks = ContainerHooks.of(toContainer, fromContainer);
        }
        CollectionDefinition definition = new CollectionDefinition(fields, containerMode, hooks);
        log.debug("Built collection definition key={} fields={} containerMode={}",
                definition.getKeyName(), fields.size(), containerMode);
        return definition;
    }
}
