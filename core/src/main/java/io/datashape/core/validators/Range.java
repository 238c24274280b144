package io.datashape.core.validators;

import io.datashape.core.engine.SchemaContext;
import io.datashape.core.error.ValidationFailedException;
import io.datashape.core.spi.Validator;
import java.math.BigDecimal;

/**
 * Inclusive numeric range check for integer and float fields. {@code Range.upTo(5)} accepts
 * {@code 0..5}; {@code new Range(2, 10)} accepts {@code 2..10}.
 */
public final class Range implements Validator<Number> {

    private final long lower;
    private final long upper;
    private final String message;

    public Range(long lower, long upper) {
        if (upper < lower) {
            throw new IllegalArgumentException("upper bound " + upper + " is below lower bound " + lower);
        }
        this.lower = lower;
        this.upper = upper;
        this.message = lower == upper
                ? "Value must be equal to " + lower
                : "Value must be in range " + lower + " to " + upper + " inclusive";
    }

    /** {@code 0..upper} inclusive. */
    public static Range upTo(long upper) {
        return new Range(0, upper);
    }

    public long lower() {
        return lower;
    }

    public long upper() {
        return upper;
    }

    @Override
    public void validate(Number value, SchemaContext context) {
        double d = value.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new ValidationFailedException(message);
        }
        BigDecimal decimal = new BigDecimal(value.toString());
        if (decimal.compareTo(BigDecimal.valueOf(lower)) < 0 || decimal.compareTo(BigDecimal.valueOf(upper)) > 0) {
            throw new ValidationFailedException(message);
        }
    }

    @Override
    public String toString() {
        return "Range(" + lower + ", " + upper + ")";
    }
}
