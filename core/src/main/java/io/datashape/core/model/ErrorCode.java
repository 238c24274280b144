package io.datashape.core.model;

/**
 * Classification of data errors produced while loading or updating a schema instance. Each code
 * carries the default message used when no field-specific message is supplied.
 */
public enum ErrorCode {
    /** A required field is absent and has no default. */
    FIELD_REQUIRED("This field is required."),

    /** {@code null} given to a field that is not nullable. */
    NONE_DISALLOWED("Value for this field cannot be None."),

    /** Strict type resolution rejected the value's shape. */
    INVALID_DATATYPE("Value for this field has an invalid data type."),

    /** Non-strict conversion of the value failed. */
    NONCONVERTIBLE_VALUE("Value for this field cannot be converted."),

    /** A user or built-in validator rejected the value. */
    VALIDATION_FAILED("Validation failed for this field."),

    /** The value does not conform to the field's type expression. */
    TYPE_VALIDATION_FAILED("Value does not conform to the declared type."),

    /** Raw data carries a key that no field declares. */
    UNKNOWN_FIELD("Invalid or unknown field."),

    /** Raw data for a partial schema names a field outside its allow-list. */
    DISALLOWED_FIELD("This field is not allowed in this context.");

    private final String defaultMessage;

    ErrorCode(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
