package io.datashape.core.error;

/**
 * Thrown at definition time when a schema type or field declaration is inconsistent, e.g. two
 * fields sharing a load key or a partial field naming an undeclared field.
 */
public final class SchemaDefinitionException extends DataShapeException {

    private static final long serialVersionUID = 1L;

    public SchemaDefinitionException(String message, String schemaName) {
        super(message, schemaName);
    }
}
