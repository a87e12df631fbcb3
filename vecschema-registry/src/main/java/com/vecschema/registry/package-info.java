/**
 * Definition registry and file loading.
 * <ul>
 *   <li>{@link com.vecschema.registry.DefinitionRegistry} – per-type cache (extract once, read many) and named definitions</li>
 *   <li>{@link com.vecschema.registry.DefinitionLoader} – JSON definitions from the configured directory</li>
 * </ul>
 */
package com.vecschema.registry;
