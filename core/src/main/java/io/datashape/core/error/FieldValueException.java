package io.datashape.core.error;

import io.datashape.core.model.ErrorCode;
import io.datashape.core.model.ErrorTree;
import io.datashape.core.model.FieldError;
import java.util.List;
import java.util.Objects;

/**
 * Thrown by a field type when a value cannot be resolved or deserialized. The field pipeline
 * catches it and turns it into field errors (or a nested error tree) bound to the field name;
 * it never escapes a load or update call.
 */
public final class FieldValueException extends DataShapeException {

    private static final long serialVersionUID = 1L;

    private final transient List<FieldError> errors;
    private final transient ErrorTree nested;

    public FieldValueException(ErrorCode code, String message, Object value) {
        this(List.of(FieldError.of(code, message).withValue(value)));
    }

    public FieldValueException(List<FieldError> errors) {
        super(errors.isEmpty() ? "invalid value" : errors.get(0).message(), null);
        this.errors = List.copyOf(errors);
        this.nested = null;
    }

    public FieldValueException(ErrorTree nested) {
        super("nested schema validation failed", null);
        this.errors = List.of();
        this.nested = Objects.requireNonNull(nested, "nested must not be null");
    }

    /** Errors not yet bound to a field name; empty when {@link #nested()} is set. */
    public List<FieldError> errors() {
        return errors;
    }

    /** Errors of a nested schema load, or {@code null}. */
    public ErrorTree nested() {
        return nested;
    }
}
