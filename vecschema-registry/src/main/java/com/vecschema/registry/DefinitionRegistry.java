package com.vecschema.registry;

import com.vecschema.definition.CollectionDefinition;
import com.vecschema.extraction.AnnotatedRecordDescriptor;
import com.vecschema.extraction.RecordMapper;
import com.vecschema.extraction.RecordTypeDescriptor;
import com.vecschema.extraction.SchemaExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache of collection definitions by record type, plus named definitions for tabular data without a
 * record class.
 * <p>
 * A definition is extracted on the first request for its type and kept for the lifetime of the registry;
 * entries are never replaced or evicted. Concurrent first requests for the same type run one extraction
 * and all receive the same instance. Ready entries are read without locking. A failed extraction is not
 * cached: the caller gets the exception and the type stays unseen.
 * <p>
 * Create one registry per application (or per test) and pass it to the code that needs definitions;
 * separate registries share nothing.
 */
public final class DefinitionRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefinitionRegistry.class);

    private final Map<Class<?>, CollectionDefinition> byType = new ConcurrentHashMap<>();
    private final Map<String, CollectionDefinition> byName = new ConcurrentHashMap<>();

    /**
     * Returns the definition of the descriptor's record type, extracting it on first use.
     *
     * @throws com.vecschema.definition.SchemaException     if the descriptor's metadata is malformed
     * @throws com.vecschema.definition.ValidationException if the extracted definition is invalid
     */
    public CollectionDefinition get(RecordTypeDescriptor<?> descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        Class<?> type = Objects.requireNonNull(descriptor.recordType(), "recordType");
        CollectionDefinition ready = byType.get(type);
        if (ready != null) return ready;
        return byType.computeIfAbsent(type, t -> build(t, descriptor));
    }

    /**
     * Returns the definition of an annotated record class (see {@link AnnotatedRecordDescriptor}), or the
     * definition registered for it, extracting on first use.
     */
    public CollectionDefinition get(Class<?> type) {
        Objects.requireNonNull(type, "type");
        CollectionDefinition ready = byType.get(type);
        if (ready != null) return ready;
        return byType.computeIfAbsent(type, t -> build(t, AnnotatedRecordDescriptor.of(t)));
    }

    /** Mapper for the descriptor's record type, backed by the cached definition. */
    public <T> RecordMapper<T> mapper(RecordTypeDescriptor<T> descriptor) {
        return RecordMapper.of(descriptor, get(descriptor));
    }

    /** Mapper for an annotated record class, backed by the cached definition. */
    public <T> RecordMapper<T> mapper(Class<T> type) {
        AnnotatedRecordDescriptor<T> descriptor = AnnotatedRecordDescriptor.of(type);
        return RecordMapper.of(descriptor, get(descriptor));
    }

    /**
     * Registers a manually built definition for a type.
     *
     * @throws IllegalArgumentException if the type already has a definition
     */
    public void register(Class<?> type, CollectionDefinition definition) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(definition, "definition");
        if (byType.putIfAbsent(type, definition) != null) {
            throw new IllegalArgumentException("Definition already registered for type " + type.getName());
        }
        log.info("Registered collection definition for type={} key={}", type.getName(), definition.getKeyName());
    }

    /**
     * Registers a named definition (e.g. one shared by the rows of a table).
     *
     * @throws IllegalArgumentException if the name is blank or already registered
     */
    public void register(String name, CollectionDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        String n = Objects.requireNonNull(name, "name").trim();
        if (n.isEmpty()) {
            throw new IllegalArgumentException("Definition name must be non-blank");
        }
        if (byName.putIfAbsent(n, definition) != null) {
            throw new IllegalArgumentException("Definition already registered: " + n);
        }
        log.info("Registered collection definition name={} key={}", n, definition.getKeyName());
    }

    /** Definition already held for a type, without extracting. */
    public Optional<CollectionDefinition> find(Class<?> type) {
        return type == null ? Optional.empty() : Optional.ofNullable(byType.get(type));
    }

    /** Named definition, if registered. */
    public Optional<CollectionDefinition> find(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        return Optional.ofNullable(byName.get(name.trim()));
    }

    public boolean contains(Class<?> type) {
        return type != null && byType.containsKey(type);
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    /** Number of type-keyed definitions. */
    public int size() {
        return byType.size();
    }

    public Map<Class<?>, CollectionDefinition> getAllByType() {
        return Collections.unmodifiableMap(byType);
    }

    public Map<String, CollectionDefinition> getAllByName() {
        return Collections.unmodifiableMap(byName);
    }

    private static CollectionDefinition build(Class<?> type, RecordTypeDescriptor<?> descriptor) {
        CollectionDefinition definition = SchemaExtractor.extract(descriptor);
        log.info("Collection definition ready for type={} fields={} containerMode={}",
                type.getName(), definition.getFields().size(), definition.isContainerMode());
        return definition;
    }
}
