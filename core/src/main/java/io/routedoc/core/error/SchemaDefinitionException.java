package io.routedoc.core.error;

/** Thrown when a schema declared in a route description is not a valid JSON Schema. */
public final class SchemaDefinitionException extends RouteLoadException {

    private static final long serialVersionUID = 1L;

    private final String schemaName;

    public SchemaDefinitionException(String message, String schemaName, String source) {
        super(message, source);
        this.schemaName = schemaName;
    }

    public SchemaDefinitionException(String message, Throwable cause, String schemaName, String source) {
        super(message, cause, source);
        this.schemaName = schemaName;
    }

    /** Name of the offending schema under {@code schemas}. */
    public String schemaName() {
        return schemaName;
    }
}
