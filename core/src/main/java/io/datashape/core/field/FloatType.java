package io.datashape.core.field;

import io.datashape.core.error.FieldValueException;
import io.datashape.core.model.ErrorCode;
import io.datashape.core.model.PrimitiveType;

/**
 * Floating point field. Strict mode accepts {@code Double}, {@code Float} and
 * {@code BigDecimal} unchanged; non-strict mode converts strings, integers and booleans to
 * {@code Double}.
 */
public final class FloatType extends FieldType<Number> {

    static final FloatType INSTANCE = new FloatType();

    private FloatType() {}

    @Override
    public String label() {
        return "float";
    }

    @Override
    public Object resolve(Object raw, boolean strict, LoadContext context) {
        if (PrimitiveType.isFloating(raw)) {
            return raw;
        }
        if (strict) {
            throw new FieldValueException(
                    ErrorCode.INVALID_DATATYPE, "Value for this field must be a floating point number.", raw);
        }
        if (raw instanceof Boolean b) {
            return b ? 1.0d : 0.0d;
        }
        if (PrimitiveType.isIntegral(raw)) {
            return ((Number) raw).doubleValue();
        }
        if (raw instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new FieldValueException(
                        ErrorCode.NONCONVERTIBLE_VALUE, "Value for this field must be a float-convertible value.", raw);
            }
        }
        throw new FieldValueException(
                ErrorCode.NONCONVERTIBLE_VALUE, "Value for this field must be a float-convertible value.", raw);
    }
}
