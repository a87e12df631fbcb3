package com.vecschema.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.function.Supplier;

/**
 * Marks a field of a record class as part of its vector-store schema. Fields without this annotation
 * are not part of the schema.
 * <p>
 * {@link #value()} is the role token ("key", "data" or "vector"). Vector-only attributes
 * ({@link #dimensions()}, {@link #indexKind()}, {@link #distanceFunction()}) and data-only attributes
 * ({@link #isFullTextIndexed()}, {@link #isFilterable()}) are rejected on other roles.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface VectorStoreField {

    /** Role token: "key", "data" or "vector". */
    String value();

    /** Storage name used with the backing store. Empty = the field name. */
    String name() default "";

    /** Semantic value type tag (e.g. "text", "float"). Empty = inferred from the field's Java type. */
    String type() default "";

    /** Vector dimensionality; 0 = not declared. Required for vector fields. */
    int dimensions() default 0;

    /** Backend index kind (e.g. "hnsw", "flat"). Empty = backend default. */
    String indexKind() default "";

    /** Backend distance function (e.g. "cosine_similarity"). Empty = backend default. */
    String distanceFunction() default "";

    boolean isFullTextIndexed() default false;

    boolean isFilterable() default false;

    /**
     * Extra value classes the field accepts besides its declared Java type, e.g. {@code String.class}
     * on a {@code float[]} vector field whose value may still be the source text.
     */
    Class<?>[] alsoAccepts() default {};

    /** Factory for the value used when a record is constructed without this field; instantiated once, invoked per record. */
    Class<? extends Supplier<?>> defaultFactory() default NoDefault.class;
}
