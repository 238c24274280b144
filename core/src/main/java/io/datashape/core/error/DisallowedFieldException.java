package io.datashape.core.error;

/** Thrown when a partial instance is read or written through a field outside its allow-list. */
public final class DisallowedFieldException extends DataShapeException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;

    public DisallowedFieldException(String schemaName, String fieldName) {
        super("Field '" + schemaName + "." + fieldName + "' is not available on this partial instance", schemaName);
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }
}
