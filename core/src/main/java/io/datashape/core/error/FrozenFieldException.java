package io.datashape.core.error;

/**
 * Thrown immediately when a frozen field (or any field of a frozen schema type) is assigned
 * after construction. Signals misuse of a read-only contract, so it is never collected into an
 * error tree.
 */
public final class FrozenFieldException extends DataShapeException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;

    public FrozenFieldException(String schemaName, String fieldName) {
        super("Field '" + schemaName + "." + fieldName + "' is frozen and cannot be modified", schemaName);
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }
}
