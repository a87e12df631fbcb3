package com.vecschema.registry;

import com.vecschema.config.VecSchemaConfig;
import com.vecschema.definition.CollectionDefinition;
import com.vecschema.definition.json.CollectionDefinitionJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads manual collection definitions from JSON files {@code <definitionsDir>/<name>.json}
 * (format: {@link CollectionDefinitionJson}). A missing or unreadable file yields empty; a file that
 * parses but describes an invalid schema fails with the schema or validation error.
 */
public final class DefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(DefinitionLoader.class);

    private static final String FILE_SUFFIX = ".json";

    private final Path definitionsDir;
    private final List<String> preloadNames;

    /**
     * @param definitionsDir directory holding definition files; null = no directory (every load is empty)
     */
    public DefinitionLoader(Path definitionsDir) {
        this(definitionsDir, List.of());
    }

    /**
     * @param definitionsDir directory holding definition files; null = no directory (every load is empty)
     * @param preloadNames   names registered by {@link #preload(DefinitionRegistry)}
     */
    public DefinitionLoader(Path definitionsDir, List<String> preloadNames) {
        this.definitionsDir = definitionsDir;
        this.preloadNames = List.copyOf(Objects.requireNonNull(preloadNames, "preloadNames"));
    }

    /** Loader for the configured directory that preloads the configured definition names. */
    public static DefinitionLoader fromConfig(VecSchemaConfig config) {
        Objects.requireNonNull(config, "config");
        return new DefinitionLoader(Path.of(config.getDefinitionsDir()), config.getPreloadDefinitions());
    }

    public List<String> getPreloadNames() {
        return preloadNames;
    }

    /**
     * Registers the preload definitions by name, typically once at startup.
     *
     * @return number of definitions registered
     * @throws IllegalStateException if a preload definition file is missing
     */
    public int preload(DefinitionRegistry registry) {
        int count = loadAll(preloadNames, registry);
        if (count > 0) {
            log.info("Preloaded {} collection definitions from {}: {}", count, definitionsDir, preloadNames);
        }
        return count;
    }

    /**
     * Loads one definition by name.
     *
     * @param name file name without {@code .json}
     * @return the validated definition, or empty if the file is missing or unreadable
     * @throws IllegalArgumentException if the name is blank or contains a path separator
     */
    public Optional<CollectionDefinition> load(String name) {
        String n = checkName(name);
        if (definitionsDir == null) {
            return Optional.empty();
        }
        Path file = definitionsDir.resolve(n + FILE_SUFFIX);
        if (!Files.isRegularFile(file)) {
            log.debug("No definition file {}", file);
            return Optional.empty();
        }
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            log.warn("Failed to read definition file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
        CollectionDefinition definition = CollectionDefinitionJson.fromJson(json);
        log.info("Collection definition loaded from file: {} key={} fields={}", file, definition.getKeyName(),
                definition.getFields().size());
        return Optional.of(definition);
    }

    /**
     * Loads each named definition and registers it under its name.
     *
     * @return number of definitions registered
     * @throws IllegalStateException if a named definition file is missing
     */
    public int loadAll(List<String> names, DefinitionRegistry registry) {
        Objects.requireNonNull(names, "names");
        Objects.requireNonNull(registry, "registry");
        int count = 0;
        for (String name : names) {
            CollectionDefinition definition = load(name).orElseThrow(() -> new IllegalStateException(
                    "No collection definition '" + name + "' in " + definitionsDir));
            registry.register(name, definition);
            count++;
        }
        return count;
    }

    private static String checkName(String name) {
        String n = Objects.requireNonNull(name, "name").trim();
        if (n.isEmpty() || n.contains("/") || n.contains("\\") || n.contains("..")) {
            throw new IllegalArgumentException("Invalid definition name: '" + name + "'");
        }
        return n;
    }
}
