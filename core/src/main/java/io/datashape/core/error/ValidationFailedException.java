package io.datashape.core.error;

/**
 * Thrown by a validator to report a failure. The message becomes the message of the resulting
 * field error and the optional state is attached to it unchanged.
 */
public final class ValidationFailedException extends DataShapeException {

    private static final long serialVersionUID = 1L;

    private final transient Object state;

    public ValidationFailedException(String message) {
        this(message, null);
    }

    public ValidationFailedException(String message, Object state) {
        super(message, null);
        this.state = state;
    }

    /** Opaque state supplied by the validator, or {@code null}. */
    public Object state() {
        return state;
    }
}
