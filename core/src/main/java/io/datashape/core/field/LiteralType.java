package io.datashape.core.field;

import io.datashape.core.model.TypeExpression;
import java.util.List;

/** Field restricted to a fixed set of values. */
public final class LiteralType extends ExpressionType {

    public LiteralType(List<Object> values) {
        super(new TypeExpression.Literal(values));
    }

    public List<Object> values() {
        return ((TypeExpression.Literal) expression()).values();
    }
}
