package io.datashape.core.field;

import io.datashape.core.error.FieldValueException;
import io.datashape.core.model.ErrorCode;

/** Text field. Non-strict mode accepts any value and stores its string form. */
public final class StringType extends FieldType<String> {

    static final StringType INSTANCE = new StringType();

    private StringType() {}

    @Override
    public String label() {
        return "string";
    }

    @Override
    public Object resolve(Object raw, boolean strict, LoadContext context) {
        if (raw instanceof String) {
            return raw;
        }
        if (strict) {
            throw new FieldValueException(
                    ErrorCode.INVALID_DATATYPE, "Value for this field must be of string data type.", raw);
        }
        return String.valueOf(raw);
    }
}
