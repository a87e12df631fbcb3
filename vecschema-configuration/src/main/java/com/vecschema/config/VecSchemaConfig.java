package com.vecschema.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Configuration loaded from environment variables.
 * <p>
 * VECSCHEMA_DEFINITIONS_DIR: directory holding JSON collection definitions ({@code <name>.json}).
 * VECSCHEMA_PRELOAD_DEFINITIONS: comma-separated definition names to load at startup.
 */
public final class VecSchemaConfig {

    private static final String ENV_DEFINITIONS_DIR = "VECSCHEMA_DEFINITIONS_DIR";
    private static final String ENV_PRELOAD_DEFINITIONS = "VECSCHEMA_PRELOAD_DEFINITIONS";

    private static final String DEFAULT_DEFINITIONS_DIR = "config/definitions";

    private final String definitionsDir;
    private final List<String> preloadDefinitions;

    private VecSchemaConfig(Builder b) {
        this.definitionsDir = b.definitionsDir;
        this.preloadDefinitions = Collections.unmodifiableList(new ArrayList<>(b.preloadDefinitions));
    }

    /** Directory for definition files. Default {@code config/definitions}. */
    public String getDefinitionsDir() {
        return definitionsDir;
    }

    /** Definition names (file names without {@code .json}) to load up front. Default empty. */
    public List<String> getPreloadDefinitions() {
        return preloadDefinitions;
    }

    public static VecSchemaConfig fromEnvironment() {
        return builder()
                .definitionsDir(getEnv(ENV_DEFINITIONS_DIR, DEFAULT_DEFINITIONS_DIR))
                .preloadDefinitions(parseCommaSeparated(System.getenv(ENV_PRELOAD_DEFINITIONS)))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String definitionsDir = DEFAULT_DEFINITIONS_DIR;
        private List<String> preloadDefinitions = List.of();

        public Builder definitionsDir(String definitionsDir) {
            this.definitionsDir = definitionsDir != null ? definitionsDir : DEFAULT_DEFINITIONS_DIR;
            return this;
        }

        public Builder preloadDefinitions(List<String> preloadDefinitions) {
            this.preloadDefinitions = Objects.requireNonNull(preloadDefinitions, "preloadDefinitions");
            return this;
        }

        public VecSchemaConfig build() {
            return new VecSchemaConfig(this);
        }
    }
}
