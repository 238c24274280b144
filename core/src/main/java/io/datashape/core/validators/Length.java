package io.datashape.core.validators;

import io.datashape.core.engine.SchemaContext;
import io.datashape.core.error.ValidationFailedException;
import io.datashape.core.spi.Validator;
import java.util.Collection;
import java.util.Map;

/** Inclusive length bounds for strings, collections, maps and arrays. */
public final class Length implements Validator<Object> {

    private final int min;
    private final int max;

    public Length(int min, int max) {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("invalid length bounds: " + min + ".." + max);
        }
        this.min = min;
        this.max = max;
    }

    public static Length atLeast(int min) {
        return new Length(min, Integer.MAX_VALUE);
    }

    public static Length atMost(int max) {
        return new Length(0, max);
    }

    public static Length exactly(int length) {
        return new Length(length, length);
    }

    @Override
    public void validate(Object value, SchemaContext context) {
        int length = lengthOf(value);
        if (length < min || length > max) {
            throw new ValidationFailedException(message(), length);
        }
    }

    private String message() {
        if (min == max) {
            return "Length must be exactly " + min;
        }
        if (max == Integer.MAX_VALUE) {
            return "Length must be at least " + min;
        }
        if (min == 0) {
            return "Length must be at most " + max;
        }
        return "Length must be between " + min + " and " + max;
    }

    private static int lengthOf(Object value) {
        if (value instanceof CharSequence s) {
            return s.length();
        }
        if (value instanceof Collection<?> c) {
            return c.size();
        }
        if (value instanceof Map<?, ?> m) {
            return m.size();
        }
        if (value instanceof Object[] a) {
            return a.length;
        }
        throw new IllegalArgumentException(
                "Length cannot be measured for " + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    @Override
    public String toString() {
        return "Length(" + min + ", " + max + ")";
    }
}
