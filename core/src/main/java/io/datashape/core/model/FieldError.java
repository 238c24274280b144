package io.datashape.core.model;

import java.util.Objects;

/**
 * A single data error, optionally bound to a field name. Immutable: the {@code with*} methods
 * return copies.
 *
 * <p>
 * The offending value is tracked separately from its presence so that a {@code null} value can
 * still be reported.
 */
public final class FieldError {

    private final ErrorCode code;
    private final String message;
    private final String field;
    private final Object value;
    private final boolean hasValue;
    private final Object state;

    private FieldError(ErrorCode code, String message, String field, Object value, boolean hasValue, Object state) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = message != null ? message : code.defaultMessage();
        this.field = field;
        this.value = value;
        this.hasValue = hasValue;
        this.state = state;
    }

    /** Creates an unbound error with the code's default message. */
    public static FieldError of(ErrorCode code) {
        return new FieldError(code, null, null, null, false, null);
    }

    /** Creates an unbound error with an explicit message. */
    public static FieldError of(ErrorCode code, String message) {
        return new FieldError(code, message, null, null, false, null);
    }

    public FieldError withField(String field) {
        return new FieldError(code, message, field, value, hasValue, state);
    }

    public FieldError withValue(Object value) {
        return new FieldError(code, message, field, value, true, state);
    }

    public FieldError withState(Object state) {
        return new FieldError(code, message, field, value, hasValue, state);
    }

    public ErrorCode code() {
        return code;
    }

    public String message() {
        return message;
    }

    /** The field name (or unknown raw key) this error belongs to, or {@code null}. */
    public String field() {
        return field;
    }

    public boolean hasValue() {
        return hasValue;
    }

    /** The offending value; check {@link #hasValue()} first since {@code null} is a valid value. */
    public Object value() {
        return value;
    }

    /** Opaque state attached by the producer of the error, or {@code null}. */
    public Object state() {
        return state;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldError that)) return false;
        return code == that.code
                && hasValue == that.hasValue
                && message.equals(that.message)
                && Objects.equals(field, that.field)
                && Objects.equals(value, that.value)
                && Objects.equals(state, that.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message, field, value, hasValue, state);
    }

    @Override
    public String toString() {
        return "FieldError[" + code + (field != null ? ", field=" + field : "") + ", message=" + message + "]";
    }
}
