package io.datashape.core.field;

import io.datashape.core.error.FieldValueException;
import io.datashape.core.model.ErrorCode;
import io.datashape.core.model.PrimitiveType;
import java.math.BigDecimal;

/**
 * Integral field. Integral inputs are stored unchanged (an {@code Integer} stays an
 * {@code Integer}); non-strict conversions of strings, floating point numbers and booleans
 * produce a {@code Long}, truncating fractions.
 */
public final class IntegerType extends FieldType<Number> {

    static final IntegerType INSTANCE = new IntegerType();

    private IntegerType() {}

    @Override
    public String label() {
        return "integer";
    }

    @Override
    public Object resolve(Object raw, boolean strict, LoadContext context) {
        if (PrimitiveType.isIntegral(raw)) {
            return raw;
        }
        if (strict) {
            throw new FieldValueException(
                    ErrorCode.INVALID_DATATYPE, "Value for this field must be of integer data type.", raw);
        }
        if (raw instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw notConvertible(raw);
            }
        }
        if (raw instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            if (!Double.isNaN(d) && !Double.isInfinite(d)) {
                return (long) d;
            }
        }
        if (raw instanceof BigDecimal decimal) {
            return decimal.longValue();
        }
        throw notConvertible(raw);
    }

    private static FieldValueException notConvertible(Object raw) {
        return new FieldValueException(
                ErrorCode.NONCONVERTIBLE_VALUE, "Value for this field must be an integer-convertible value.", raw);
    }
}
