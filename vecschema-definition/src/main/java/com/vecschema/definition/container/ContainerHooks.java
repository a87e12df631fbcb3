package com.vecschema.definition.container;

import com.vecschema.definition.SerializationException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Pair of user functions converting between row mappings ({@code storageName → value}) and one bulk
 * container value (e.g. a {@link RecordTable}). Both directions are always present.
 */
public final class ContainerHooks {

    private final Function<? super List<Map<String, Object>>, ?> toContainer;
    private final Function<Object, ? extends List<? extends Map<String, ?>>> fromContainer;

    private ContainerHooks(Function<? super List<Map<String, Object>>, ?> toContainer,
                           Function<Object, ? extends List<? extends Map<String, ?>>> fromContainer) {
        this.toContainer = Objects.requireNonNull(toContainer, "toContainer");
        this.fromContainer = Objects.requireNonNull(fromContainer, "fromContainer");
    }

    /** Untyped hooks; {@code fromContainer} receives whatever container the caller passes. */
    public static ContainerHooks of(Function<? super List<Map<String, Object>>, ?> toContainer,
                                    Function<Object, ? extends List<? extends Map<String, ?>>> fromContainer) {
        return new ContainerHooks(toContainer, fromContainer);
    }

    /**
     * Hooks for a container of a known type. Passing a container of another type to
     * {@code fromContainer} fails with {@link SerializationException} instead of a class cast.
     */
    public static <C> ContainerHooks typed(Class<C> containerType,
                                           Function<? super List<Map<String, Object>>, ? extends C> toContainer,
                                           Function<? super C, ? extends List<? extends Map<String, ?>>> fromContainer) {
        Objects.requireNonNull(containerType, "containerType");
        Objects.requireNonNull(fromContainer, "fromContainer");
        return new ContainerHooks(toContainer, container -> {
            if (!containerType.isInstance(container)) {
                throw new SerializationException("Expected container of type " + containerType.getName() + " but got "
                        + (container == null ? "null" : container.getClass().getName()));
            }
            return fromContainer.apply(containerType.cast(container));
        });
    }

    /** Hooks grouping rows into a {@link RecordTable} and back. */
    public static ContainerHooks recordTable() {
        return typed(RecordTable.class, RecordTable::fromRows, RecordTable::toRows);
    }

    Object applyToContainer(List<Map<String, Object>> rows) {
        return toContainer.apply(rows);
    }

    List<? extends Map<String, ?>> applyFromContainer(Object container) {
        return fromContainer.apply(container);
    }
}
