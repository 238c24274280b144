package io.datashape.core.error;

/**
 * Thrown when reading an optional field that has no default and was never assigned. Distinct
 * from validation failure: the instance is valid, the value simply does not exist.
 */
public final class FieldNotSetException extends DataShapeException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;

    public FieldNotSetException(String schemaName, String fieldName) {
        super("Field '" + schemaName + "." + fieldName + "' has no value set", schemaName);
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }
}
