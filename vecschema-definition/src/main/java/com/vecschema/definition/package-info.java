/**
 * Collection schema model.
 *
 * <ul>
 *   <li>{@link com.vecschema.definition.FieldDefinition} – one field: role, names, value type, vector and indexing attributes</li>
 *   <li>{@link com.vecschema.definition.CollectionDefinition} – validated ordered field list, key/data/vector accessors, container conversion</li>
 *   <li>{@link com.vecschema.definition.CollectionDefinitionBuilder} – manual construction (tabular rows, no record class)</li>
 *   <li>{@link com.vecschema.definition.DefinitionValidator} – aggregate invariants checked at build time</li>
 *   <li>{@link com.vecschema.definition.SchemaException}, {@link com.vecschema.definition.ValidationException},
 *       {@link com.vecschema.definition.SerializationException} – error taxonomy</li>
 *   <li>{@link com.vecschema.definition.container} – container hooks, adapter and {@code RecordTable}</li>
 *   <li>{@link com.vecschema.definition.json} – JSON form of definitions</li>
 * </ul>
 */
package com.vecschema.definition;
