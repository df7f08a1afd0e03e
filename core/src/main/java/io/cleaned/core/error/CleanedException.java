package io.cleaned.core.error;

import java.util.Objects;

/**
 * Root of the library's exceptions. Every exception names the schema involved and the
 * {@link Phase} of that schema's life in which it was raised, so a caller can tell a broken
 * schema from rejected input without switching on the concrete type.
 */
public abstract class CleanedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** The part of a schema's life an exception comes from. */
    public enum Phase {
        /**
         * Declaring a schema with {@code SchemaBuilder}, or resolving a {@code SchemaRef} on first
         * use. The schema itself is wrong and no input can succeed against it.
         */
        DEFINITION,
        /** Running {@code Schema.validate}. The schema is sound and the input was rejected. */
        VALIDATION;

        /** {@code true} if the input, not the schema, has to change for validation to pass. */
        public boolean blamesInput() {
            return this == VALIDATION;
        }
    }

    private final String schemaName;
    private final Phase phase;

    /**
     * @param schemaName         the schema being declared or validated against, may be null
     * @param writableStackTrace false for derived views of an existing failure
     */
    protected CleanedException(
            String message, Throwable cause, String schemaName, Phase phase, boolean writableStackTrace) {
        super(message, cause, false, writableStackTrace);
        this.schemaName = schemaName;
        this.phase = Objects.requireNonNull(phase, "phase must not be null");
    }

    /** The schema involved, or {@code null} for an anonymous schema. */
    public String schemaName() {
        return schemaName;
    }

    public Phase phase() {
        return phase;
    }
}
