/**
 * Schema annotations for record classes.
 * <ul>
 *   <li>{@link com.vecschema.annotations.VectorStoreField} – role token plus storage metadata for one field</li>
 *   <li>{@link com.vecschema.annotations.VectorStoreModel} – optional class-level marker (container mode)</li>
 *   <li>{@link com.vecschema.annotations.RandomUuid} – default factory for generated keys</li>
 * </ul>
 * Read at runtime by {@code com.vecschema.extraction.AnnotatedRecordDescriptor}.
 */
package com.vecschema.annotations;
