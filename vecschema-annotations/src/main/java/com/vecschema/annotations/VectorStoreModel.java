package com.vecschema.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Optional class-level marker for record classes whose fields carry {@link VectorStoreField}.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface VectorStoreModel {

    /** Whether instances describe rows of a bulk container rather than one object per record. */
    boolean containerMode() default false;
}
