package io.datashape.core.field;

import io.datashape.core.error.FieldValueException;
import io.datashape.core.model.ErrorCode;
import io.datashape.core.model.FieldError;
import io.datashape.core.model.Mismatch;
import io.datashape.core.model.TypeExpression;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Field whose value must conform to a structural {@link TypeExpression}. Values are stored
 * unchanged; strictness does not apply. Each mismatch becomes one
 * {@link ErrorCode#TYPE_VALIDATION_FAILED} error carrying the {@link Mismatch} as state.
 */
public class ExpressionType extends FieldType<Object> {

    private final TypeExpression expression;

    public ExpressionType(TypeExpression expression) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
    }

    public TypeExpression expression() {
        return expression;
    }

    @Override
    public String label() {
        return expression.label();
    }

    @Override
    public Object resolve(Object raw, boolean strict, LoadContext context) {
        List<Mismatch> mismatches = context.engine().typeValidator().validate(raw, expression);
        if (mismatches.isEmpty()) {
            return raw;
        }
        List<FieldError> errors = new ArrayList<>(mismatches.size());
        for (Mismatch mismatch : mismatches) {
            errors.add(FieldError.of(ErrorCode.TYPE_VALIDATION_FAILED, mismatch.describe())
                    .withValue(raw)
                    .withState(mismatch));
        }
        throw new FieldValueException(errors);
    }
}
