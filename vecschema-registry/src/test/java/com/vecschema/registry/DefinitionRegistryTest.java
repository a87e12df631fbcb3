package com.vecschema.registry;

import com.vecschema.annotations.VectorStoreField;
import com.vecschema.definition.CollectionDefinition;
import com.vecschema.definition.FieldDefinition;
import com.vecschema.definition.ValidationException;
import com.vecschema.extraction.DeclaredField;
import com.vecschema.extraction.FieldMetadata;
import com.vecschema.extraction.RecordMapper;
import com.vecschema.extraction.RecordTypeDescriptor;
import com.vecschema.extraction.SimpleRecordDescriptor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefinitionRegistryTest {

    record Doc(String id, List<Double> embedding) {
    }

    static class Chunk {
        @VectorStoreField("key")
        String id;

        @VectorStoreField(value = "data", name = "text")
        String content;

        @VectorStoreField(value = "vector", dimensions = 2)
        double[] vector;
    }

    /** Counts how often its fields are listed, i.e. how often a definition is extracted from it. */
    static final class CountingDescriptor implements RecordTypeDescriptor<Doc> {
        private final RecordTypeDescriptor<Doc> delegate;
        final AtomicInteger extractions = new AtomicInteger();
        volatile boolean failing;

        CountingDescriptor(RecordTypeDescriptor<Doc> delegate) {
            this.delegate = delegate;
        }

        @Override
        public Class<Doc> recordType() {
            return Doc.class;
        }

        @Override
        public List<DeclaredField<Doc>> declaredFields() {
            extractions.incrementAndGet();
            if (failing) {
                return List.of(DeclaredField.<Doc>builder("id").valueTypes(String.class)
                        .metadata(FieldMetadata.of("key")).build());
            }
            return delegate.declaredFields();
        }

        @Override
        public Doc newRecord(Map<String, Object> values) {
            return delegate.newRecord(values);
        }
    }

    @SuppressWarnings("unchecked")
    private static SimpleRecordDescriptor<Doc> docDescriptor() {
        return SimpleRecordDescriptor.builder(Doc.class)
                .field("id", String.class, FieldMetadata.of("key"), Doc::id)
                .field("embedding", List.class, FieldMetadata.of("vector").with(FieldMetadata.DIMENSIONS, 2), Doc::embedding)
                .factory(v -> new Doc((String) v.get("id"), (List<Double>) v.get("embedding")))
                .build();
    }

    private static CollectionDefinition manualDefinition() {
        return CollectionDefinition.builder()
                .field(FieldDefinition.key("id").build())
                .field(FieldDefinition.vector("v", 3).build())
                .build();
    }

    @Test
    void get_returnsSameInstanceOnRepeatedCalls() {
        DefinitionRegistry registry = new DefinitionRegistry();
        CountingDescriptor descriptor = new CountingDescriptor(docDescriptor());

        CollectionDefinition first = registry.get(descriptor);
        CollectionDefinition second = registry.get(descriptor);

        assertSame(first, second);
        assertEquals(1, descriptor.extractions.get());
        assertTrue(registry.contains(Doc.class));
        assertEquals(1, registry.size());
    }

    @Test
    void get_concurrentFirstRequests_extractOnce() throws Exception {
        DefinitionRegistry registry = new DefinitionRegistry();
        CountingDescriptor descriptor = new CountingDescriptor(docDescriptor());
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<CollectionDefinition>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return registry.get(descriptor);
                }));
            }
            start.countDown();
            CollectionDefinition expected = futures.get(0).get(10, TimeUnit.SECONDS);
            for (Future<CollectionDefinition> f : futures) {
                assertSame(expected, f.get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, descriptor.extractions.get());
    }

    @Test
    void get_failedExtractionIsNotCached() {
        DefinitionRegistry registry = new DefinitionRegistry();
        CountingDescriptor descriptor = new CountingDescriptor(docDescriptor());
        descriptor.failing = true;

        ValidationException e = assertThrows(ValidationException.class, () -> registry.get(descriptor));
        assertEquals(ValidationException.Violation.NO_VECTOR_FIELD, e.getViolation());
        assertFalse(registry.contains(Doc.class));

        descriptor.failing = false;
        CollectionDefinition def = registry.get(descriptor);

        assertEquals("id", def.getKeyName());
        assertEquals(2, descriptor.extractions.get());
    }

    @Test
    void get_annotatedClass() {
        DefinitionRegistry registry = new DefinitionRegistry();

        CollectionDefinition def = registry.get(Chunk.class);

        assertEquals(List.of("id", "text", "vector"), List.copyOf(def.getStorageNames()));
        assertSame(def, registry.get(Chunk.class));
        assertTrue(registry.find(Chunk.class).isPresent());
    }

    @Test
    void registries_areIndependent() {
        DefinitionRegistry a = new DefinitionRegistry();
        DefinitionRegistry b = new DefinitionRegistry();

        CollectionDefinition fromA = a.get(Chunk.class);

        assertFalse(b.contains(Chunk.class));
        assertNotSame(fromA, b.get(Chunk.class));
    }

    @Test
    void register_type_winsOverExtraction() {
        DefinitionRegistry registry = new DefinitionRegistry();
        CollectionDefinition manual = manualDefinition();

        registry.register(Chunk.class, manual);

        assertSame(manual, registry.get(Chunk.class));
    }

    @Test
    void register_duplicateType_throws() {
        DefinitionRegistry registry = new DefinitionRegistry();
        registry.get(Chunk.class);

        assertThrows(IllegalArgumentException.class, () -> registry.register(Chunk.class, manualDefinition()));
    }

    @Test
    void register_name() {
        DefinitionRegistry registry = new DefinitionRegistry();
        CollectionDefinition manual = manualDefinition();

        registry.register(" passages ", manual);

        assertSame(manual, registry.find("passages").orElseThrow());
        assertTrue(registry.contains("passages"));
        assertEquals(Map.of("passages", manual), registry.getAllByName());
        assertThrows(IllegalArgumentException.class, () -> registry.register("passages", manualDefinition()));
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", manualDefinition()));
    }

    @Test
    void find_unknown_isEmpty() {
        DefinitionRegistry registry = new DefinitionRegistry();

        assertFalse(registry.find("missing").isPresent());
        assertFalse(registry.find((String) null).isPresent());
        assertFalse(registry.find(Chunk.class).isPresent());
        assertTrue(registry.getAllByType().isEmpty());
    }

    @Test
    void mapper_usesCachedDefinition() {
        DefinitionRegistry registry = new DefinitionRegistry();
        SimpleRecordDescriptor<Doc> descriptor = docDescriptor();

        RecordMapper<Doc> mapper = registry.mapper(descriptor);
        Doc doc = mapper.fromRow(mapper.toRow(new Doc("d1", List.of(0.5, 0.5))));

        assertSame(registry.get(descriptor), mapper.getDefinition());
        assertEquals(new Doc("d1", List.of(0.5, 0.5)), doc);
    }

    @Test
    void mapper_annotatedClass() {
        DefinitionRegistry registry = new DefinitionRegistry();
        Chunk chunk = new Chunk();
        chunk.id = "c1";
        chunk.content = "hello";

        Map<String, Object> row = registry.mapper(Chunk.class).toRow(chunk);

        assertEquals("hello", row.get("text"));
        assertSame(registry.get(Chunk.class), registry.mapper(Chunk.class).getDefinition());
    }
}
