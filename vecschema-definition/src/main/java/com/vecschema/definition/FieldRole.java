package com.vecschema.definition;

import java.util.Locale;

/**
 * Purpose of a schema field. Closed set: a collection has exactly one {@link #KEY}, any number of
 * {@link #DATA} fields and at least one {@link #VECTOR}.
 */
public enum FieldRole {
    KEY("key"),
    DATA("data"),
    VECTOR("vector");

    private final String token;

    FieldRole(String token) {
        this.token = token;
    }

    /** Token used in annotations and JSON definitions ("key", "data", "vector"). */
    public String getToken() {
        return token;
    }

    /**
     * Resolves a role token (case-insensitive, surrounding whitespace ignored).
     *
     * @param token   role token
     * @param context field name for the error message; may be null
     * @throws SchemaException if the token is null, blank or not a known role
     */
    public static FieldRole fromToken(String token, String context) {
        if (token != null) {
            String t = token.trim().toLowerCase(Locale.ROOT);
            for (FieldRole role : values()) {
                if (role.token.equals(t)) return role;
            }
        }
        throw new SchemaException(context, "Unrecognized field role token '" + token + "' (use key, data or vector)");
    }
}
