package io.datashape.core.field;

import io.datashape.core.model.ErrorTree;
import io.datashape.core.model.FieldError;
import java.util.List;

/**
 * Result of running one field through the load pipeline: a value to store, nothing to store, or
 * the errors found.
 */
public final class FieldOutcome {

    private static final FieldOutcome UNSET = new FieldOutcome(false, null, List.of(), null);

    private final boolean hasValue;
    private final Object value;
    private final List<FieldError> errors;
    private final ErrorTree nested;

    private FieldOutcome(boolean hasValue, Object value, List<FieldError> errors, ErrorTree nested) {
        this.hasValue = hasValue;
        this.value = value;
        this.errors = List.copyOf(errors);
        this.nested = nested;
    }

    public static FieldOutcome value(Object value) {
        return new FieldOutcome(true, value, List.of(), null);
    }

    /** The field stays unset: absent, optional and without default. */
    public static FieldOutcome unset() {
        return UNSET;
    }

    public static FieldOutcome failed(List<FieldError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("a failed outcome needs at least one error");
        }
        return new FieldOutcome(false, null, errors, null);
    }

    public static FieldOutcome nested(ErrorTree tree) {
        return new FieldOutcome(false, null, List.of(), tree);
    }

    public boolean isFailure() {
        return !errors.isEmpty() || nested != null;
    }

    public boolean hasValue() {
        return hasValue;
    }

    public Object value() {
        return value;
    }

    public List<FieldError> errors() {
        return errors;
    }

    /** The nested tree of a failed object or partial field, or {@code null}. */
    public ErrorTree nestedErrors() {
        return nested;
    }
}
