package io.cleaned.core.error;

/**
 * Thrown when a schema or validator is defined incorrectly: duplicate field names, contradictory
 * constraints, or a lazy schema reference that cannot be resolved. These are programming errors
 * and are never reported as part of a {@link ValidationError}.
 */
public final class SchemaDefinitionException extends CleanedException {

    private static final long serialVersionUID = 1L;

    public SchemaDefinitionException(String message, String schemaName) {
        super(message, null, schemaName, Phase.DEFINITION, true);
    }

    public SchemaDefinitionException(String message, Throwable cause, String schemaName) {
        super(message, cause, schemaName, Phase.DEFINITION, true);
    }
}
