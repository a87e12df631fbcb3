package com.vecschema.extraction;

import com.vecschema.annotations.NoDefault;
import com.vecschema.annotations.VectorStoreField;
import com.vecschema.annotations.VectorStoreModel;
import com.vecschema.definition.SchemaException;
import com.vecschema.definition.SerializationException;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link RecordTypeDescriptor} read from {@link VectorStoreField} annotations.
 * <p>
 * Supports Java records (fields in component order, built through the canonical constructor) and plain
 * classes with a no-arg constructor (instance fields of the class and its superclasses, superclass
 * first, in the order the JVM reports them, which is declaration order on HotSpot). Non-annotated fields
 * are listed as non-schema attributes. {@link VectorStoreModel#containerMode()} on the class sets
 * container mode.
 *
 * @param <T> record type
 */
public final class AnnotatedRecordDescriptor<T> implements RecordTypeDescriptor<T> {

    private final Class<T> recordType;
    private final List<DeclaredField<T>> fields;
    private final Map<String, Field> reflectFields;
    private final boolean containerMode;

    private AnnotatedRecordDescriptor(Class<T> recordType) {
        this.recordType = recordType;
        this.reflectFields = new LinkedHashMap<>();
        for (Field f : instanceFields(recordType)) {
            if (reflectFields.containsKey(f.getName())) {
                throw new SchemaException(f.getName(), "Field is declared more than once in the hierarchy of " + recordType.getName());
            }
            f.setAccessible(true);
            reflectFields.put(f.getName(), f);
        }
        List<DeclaredField<T>> declared = new ArrayList<>();
        for (Field f : reflectFields.values()) {
            declared.add(toDeclaredField(f));
        }
        this.fields = Collections.unmodifiableList(declared);
        VectorStoreModel model = recordType.getAnnotation(VectorStoreModel.class);
        this.containerMode = model != null && model.containerMode();
    }

    /**
     * Reads the annotations of a record class.
     *
     * @throws SchemaException if a default factory cannot be instantiated or a field name repeats
     */
    public static <T> AnnotatedRecordDescriptor<T> of(Class<T> recordType) {
        return new AnnotatedRecordDescriptor<>(Objects.requireNonNull(recordType, "recordType"));
    }

    @Override
    public Class<T> recordType() {
        return recordType;
    }

    @Override
    public List<DeclaredField<T>> declaredFields() {
        return fields;
    }

    @Override
    public boolean containerMode() {
        return containerMode;
    }

    /**
     * Builds a record; for Java records absent components get null (or the primitive zero value), for
     * plain classes absent fields keep their initializer values.
     *
     * @throws SerializationException if the record cannot be constructed or a value has the wrong type
     */
    @Override
    public T newRecord(Map<String, Object> values) {
        Objects.requireNonNull(values, "values");
        try {
            if (recordType.isRecord()) {
                return newJavaRecord(values);
            }
            Constructor<T> ctor = recordType.getDeclaredConstructor();
            ctor.setAccessible(true);
            T instance = ctor.newInstance();
            for (Map.Entry<String, Object> e : values.entrySet()) {
                Field f = reflectFields.get(e.getKey());
                if (f == null) {
                    throw new SerializationException("No field '" + e.getKey() + "' on " + recordType.getName());
                }
                f.set(instance, e.getValue());
            }
            return instance;
        } catch (InvocationTargetException e) {
            throw new SerializationException("Constructor of " + recordType.getName() + " failed: "
                    + e.getCause().getMessage(), e.getCause());
        } catch (ReflectiveOperationException | IllegalArgumentException e) {
            throw new SerializationException("Cannot construct " + recordType.getName() + ": " + e.getMessage(), e);
        }
    }

    private T newJavaRecord(Map<String, Object> values) throws ReflectiveOperationException {
        RecordComponent[] components = recordType.getRecordComponents();
        Class<?>[] types = new Class<?>[components.length];
        Object[] args = new Object[components.length];
        for (int i = 0; i < components.length; i++) {
            types[i] = components[i].getType();
            Object v = values.get(components[i].getName());
            args[i] = v != null ? v : zeroValue(types[i]);
        }
        Constructor<T> ctor = recordType.getDeclaredConstructor(types);
        ctor.setAccessible(true);
        return ctor.newInstance(args);
    }

    private DeclaredField<T> toDeclaredField(Field f) {
        DeclaredField.Builder<T> b = DeclaredField.<T>builder(f.getName())
                .valueTypes(f.getGenericType())
                .accessor(record -> read(f, record));
        VectorStoreField ann = f.getAnnotation(VectorStoreField.class);
        if (ann == null) {
            return b.build();
        }
        b.valueTypes(ann.alsoAccepts());
        b.metadata(toMetadata(ann));
        if (ann.defaultFactory() != NoDefault.class) {
            b.defaultFactory(instantiateFactory(f.getName(), ann.defaultFactory()));
        }
        return b.build();
    }

    private static FieldMetadata toMetadata(VectorStoreField ann) {
        FieldMetadata m = FieldMetadata.of(ann.value());
        if (!ann.name().isEmpty()) m = m.with(FieldMetadata.NAME, ann.name());
        if (!ann.type().isEmpty()) m = m.with(FieldMetadata.TYPE, ann.type());
        if (ann.dimensions() != 0) m = m.with(FieldMetadata.DIMENSIONS, ann.dimensions());
        if (!ann.indexKind().isEmpty()) m = m.with(FieldMetadata.INDEX_KIND, ann.indexKind());
        if (!ann.distanceFunction().isEmpty()) m = m.with(FieldMetadata.DISTANCE_FUNCTION, ann.distanceFunction());
        if (ann.isFullTextIndexed()) m = m.with(FieldMetadata.IS_FULL_TEXT_INDEXED, true);
        if (ann.isFilterable()) m = m.with(FieldMetadata.IS_FILTERABLE, true);
        return m;
    }

    private static Supplier<?> instantiateFactory(String fieldName, Class<? extends Supplier<?>> factoryClass) {
        try {
            Constructor<? extends Supplier<?>> ctor = factoryClass.getDeclaredConstructor();
            ctor.setAccessible(true);
            return ctor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new SchemaException(fieldName, "Cannot instantiate default factory " + factoryClass.getName()
                    + " (needs a no-arg constructor)");
        }
    }

    private static Object read(Field f, Object record) {
        try {
            return f.get(record);
        } catch (IllegalAccessException e) {
            throw new SerializationException("Cannot read field " + f.getName() + ": " + e.getMessage(), e);
        }
    }

    private static List<Field> instanceFields(Class<?> type) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> c = type; c != null && c != Object.class && c != Record.class; c = c.getSuperclass()) {
            hierarchy.push(c);
        }
        List<Field> out = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            for (Field f : c.getDeclaredFields()) {
                if (Modifier.isStatic(f.getModifiers()) || f.isSynthetic()) continue;
                out.add(f);
            }
        }
        if (type.isRecord()) {
            List<Field> ordered = new ArrayList<>();
            for (RecordComponent rc : type.getRecordComponents()) {
                for (Field f : out) {
                    if (f.getName().equals(rc.getName())) ordered.add(f);
                }
            }
            return ordered;
        }
        return out;
    }

    private static Object zeroValue(Type type) {
        if (type == boolean.class) return false;
        if (type == char.class) return '\0';
        if (type == byte.class) return (byte) 0;
        if (type == short.class) return (short) 0;
        if (type == int.class) return 0;
        if (type == long.class) return 0L;
        if (type == float.class) return 0f;
        if (type == double.class) return 0d;
        return null;
    }
}
