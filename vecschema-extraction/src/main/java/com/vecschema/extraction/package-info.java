/**
 * Schema extraction from record types.
 * <p>
 * A record type is described by a {@link com.vecschema.extraction.RecordTypeDescriptor}, either written by
 * hand ({@link com.vecschema.extraction.SimpleRecordDescriptor}) or read from annotations
 * ({@link com.vecschema.extraction.AnnotatedRecordDescriptor}). {@link com.vecschema.extraction.SchemaExtractor}
 * turns it into a validated definition; {@link com.vecschema.extraction.RecordMapper} converts records to
 * rows and back.
 */
package com.vecschema.extraction;
