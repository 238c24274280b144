package io.datashape.core.field;

import io.datashape.core.engine.SchemaContext;
import io.datashape.core.error.FieldValueException;

/**
 * The value type of a field: how raw input is resolved into the declared shape, turned into the
 * stored value, and turned back into raw form on dump.
 *
 * <p>
 * Implementations must be immutable; one instance is shared by every descriptor using it.
 *
 * @param <T> the stored value type
 */
public abstract class FieldType<T> {

    /** Short name used in messages and {@code toString()}. */
    public abstract String label();

    /**
     * Checks (strict) or converts (non-strict) a non-null raw value into the declared shape.
     *
     * @throws FieldValueException when the value has the wrong shape or cannot be converted
     */
    public abstract Object resolve(Object raw, boolean strict, LoadContext context);

    /**
     * Turns a resolved value into the stored value. Runs after the raw validators passed.
     * Identity by default.
     *
     * @throws FieldValueException when the transform fails, e.g. a nested schema load
     */
    @SuppressWarnings("unchecked")
    public T deserialize(Object resolved, LoadContext context) {
        return (T) resolved;
    }

    /** Turns a stored value back into raw form. Never validates. Identity by default. */
    public Object serialize(T value, SchemaContext context) {
        return value;
    }

    @Override
    public String toString() {
        return label();
    }
}
