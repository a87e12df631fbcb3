package com.vecschema.extraction;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.math.BigInteger;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Semantic value type tags and their inference from declared Java types.
 * <p>
 * A field accepting both a numeric sequence and a string is tagged
 * {@link #VECTOR_OR_PENDING_SOURCE_TEXT}: the stored value is either the embedding or the text it will
 * be computed from by some other component. Both are kept as given; nothing is converted here.
 */
public final class ValueTypes {

    public static final String TEXT = "text";
    public static final String INTEGER = "integer";
    public static final String FLOAT = "float";
    public static final String BOOLEAN = "boolean";
    public static final String FLOAT_SEQUENCE = "float-sequence";
    public static final String TEXT_SEQUENCE = "text-sequence";
    public static final String VECTOR_OR_PENDING_SOURCE_TEXT = "vector-or-pending-source-text";
    public static final String OBJECT = "object";

    private ValueTypes() {
    }

    /**
     * Infers the tag for a field accepting the given types.
     *
     * @return the common tag, {@link #VECTOR_OR_PENDING_SOURCE_TEXT} for numeric sequence plus text,
     *         {@link #OBJECT} for any other mix, or null when no type is declared
     */
    public static String infer(List<? extends Type> types) {
        if (types == null || types.isEmpty()) return null;
        Set<String> tags = new LinkedHashSet<>();
        for (Type t : types) tags.add(inferOne(t));
        if (tags.size() == 1) return tags.iterator().next();
        if (tags.size() == 2 && tags.contains(FLOAT_SEQUENCE) && tags.contains(TEXT)) {
            return VECTOR_OR_PENDING_SOURCE_TEXT;
        }
        return OBJECT;
    }

    static String inferOne(Type type) {
        Class<?> raw = rawClass(type);
        if (raw == null) return OBJECT;
        String scalar = scalarTag(raw);
        if (scalar != null) return scalar;
        if (raw.isArray()) {
            Type component = type instanceof GenericArrayType
                    ? ((GenericArrayType) type).getGenericComponentType() : raw.getComponentType();
            return sequenceTag(component);
        }
        if (Collection.class.isAssignableFrom(raw) && type instanceof ParameterizedType) {
            Type[] args = ((ParameterizedType) type).getActualTypeArguments();
            if (args.length == 1) return sequenceTag(args[0]);
        }
        return OBJECT;
    }

    private static String sequenceTag(Type element) {
        Class<?> raw = rawClass(element);
        if (raw == null) return OBJECT;
        String tag = scalarTag(raw);
        if (INTEGER.equals(tag) || FLOAT.equals(tag)) return FLOAT_SEQUENCE;
        if (TEXT.equals(tag)) return TEXT_SEQUENCE;
        return OBJECT;
    }

    private static String scalarTag(Class<?> c) {
        if (CharSequence.class.isAssignableFrom(c) || c == char.class || c == Character.class) return TEXT;
        if (c == int.class || c == long.class || c == short.class || c == byte.class
                || c == Integer.class || c == Long.class || c == Short.class || c == Byte.class
                || c == BigInteger.class) return INTEGER;
        if (c == float.class || c == double.class || Number.class.isAssignableFrom(c)) return FLOAT;
        if (c == boolean.class || c == Boolean.class) return BOOLEAN;
        return null;
    }

    private static Class<?> rawClass(Type type) {
        if (type instanceof Class) return (Class<?>) type;
        if (type instanceof ParameterizedType) return rawClass(((ParameterizedType) type).getRawType());
        if (type instanceof WildcardType) {
            Type[] upper = ((WildcardType) type).getUpperBounds();
            return upper.length == 1 ? rawClass(upper[0]) : null;
        }
        if (type instanceof GenericArrayType) {
            Class<?> component = rawClass(((GenericArrayType) type).getGenericComponentType());
            return component != null ? component.arrayType() : null;
        }
        return null;
    }
}
