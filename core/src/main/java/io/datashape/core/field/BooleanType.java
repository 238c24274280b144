package io.datashape.core.field;

import io.datashape.core.error.FieldValueException;
import io.datashape.core.model.ErrorCode;
import java.util.Set;

/**
 * Boolean field. Non-strict mode maps the string form of the input through two token sets;
 * anything outside both is not convertible.
 */
public final class BooleanType extends FieldType<Boolean> {

    public static final Set<String> DEFAULT_TRUE_TOKENS = Set.of("TRUE", "True", "true", "YES", "Yes", "yes", "1");
    public static final Set<String> DEFAULT_FALSE_TOKENS = Set.of("FALSE", "False", "false", "NO", "No", "no", "0");

    static final BooleanType INSTANCE = new BooleanType(DEFAULT_TRUE_TOKENS, DEFAULT_FALSE_TOKENS);

    private final Set<String> trueTokens;
    private final Set<String> falseTokens;

    BooleanType(Set<String> trueTokens, Set<String> falseTokens) {
        this.trueTokens = Set.copyOf(trueTokens);
        this.falseTokens = Set.copyOf(falseTokens);
        for (String token : this.trueTokens) {
            if (this.falseTokens.contains(token)) {
                throw new IllegalArgumentException("Token '" + token + "' is both a true and a false token");
            }
        }
    }

    @Override
    public String label() {
        return "boolean";
    }

    @Override
    public Object resolve(Object raw, boolean strict, LoadContext context) {
        if (raw instanceof Boolean) {
            return raw;
        }
        if (strict) {
            throw new FieldValueException(
                    ErrorCode.INVALID_DATATYPE, "Value for this field must be of boolean type.", raw);
        }
        String token = String.valueOf(raw);
        if (trueTokens.contains(token)) {
            return Boolean.TRUE;
        }
        if (falseTokens.contains(token)) {
            return Boolean.FALSE;
        }
        throw new FieldValueException(
                ErrorCode.NONCONVERTIBLE_VALUE, "Value for this field must be a boolean-convertible value.", raw);
    }
}
