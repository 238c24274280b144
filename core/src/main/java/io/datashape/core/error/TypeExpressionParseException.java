package io.datashape.core.error;

/**
 * Thrown when a type-expression descriptor (JSON or YAML) cannot be compiled. Carries the
 * {@code source} of the descriptor: a file path, or {@code "<inline>"} for in-memory input.
 */
public final class TypeExpressionParseException extends DataShapeException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public TypeExpressionParseException(String message, String source) {
        super(message, null);
        this.source = source;
    }

    public TypeExpressionParseException(String message, Throwable cause, String source) {
        super(message, cause, null);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
