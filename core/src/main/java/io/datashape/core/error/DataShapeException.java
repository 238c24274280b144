package io.datashape.core.error;

/**
 * Abstract base for all datashape exceptions. Never thrown directly; use one of the concrete
 * subclasses. Carries the name of the schema type involved, when one is known.
 */
public abstract class DataShapeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String schemaName;

    protected DataShapeException(String message, String schemaName) {
        super(message);
        this.schemaName = schemaName;
    }

    protected DataShapeException(String message, Throwable cause, String schemaName) {
        super(message, cause);
        this.schemaName = schemaName;
    }

    /** The schema type that triggered the error, or {@code null} if not tied to one. */
    public String schemaName() {
        return schemaName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
