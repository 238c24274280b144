package io.datashape.core.field;

import io.datashape.core.engine.SchemaInstance;
import io.datashape.core.engine.SchemaType;
import io.datashape.core.model.TypeExpression;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Entry point for declaring fields. Every method returns a {@link FieldDescriptor.Builder} with
 * the builder defaults (required, not nullable, strict).
 *
 * <pre>{@code
 * SchemaType user = SchemaType.builder("User")
 *         .field(Fields.string("name"))
 *         .field(Fields.integer("age").validator(new Range(0, 150)))
 *         .field(Fields.bool("active").strict(false).defaultValue(true))
 *         .build();
 * }</pre>
 */
public final class Fields {

    private Fields() {}

    public static FieldDescriptor.Builder<String> string(String name) {
        return FieldDescriptor.builder(name, StringType.INSTANCE);
    }

    public static FieldDescriptor.Builder<Number> integer(String name) {
        return FieldDescriptor.builder(name, IntegerType.INSTANCE);
    }

    public static FieldDescriptor.Builder<Number> floating(String name) {
        return FieldDescriptor.builder(name, FloatType.INSTANCE);
    }

    public static FieldDescriptor.Builder<Boolean> bool(String name) {
        return FieldDescriptor.builder(name, BooleanType.INSTANCE);
    }

    /** A boolean field with custom conversion tokens for non-strict mode. */
    public static FieldDescriptor.Builder<Boolean> bool(String name, Set<String> trueTokens, Set<String> falseTokens) {
        return FieldDescriptor.builder(name, new BooleanType(trueTokens, falseTokens));
    }

    public static FieldDescriptor.Builder<Object> any(String name) {
        return FieldDescriptor.builder(name, AnyType.INSTANCE);
    }

    public static FieldDescriptor.Builder<Object> literal(String name, Object... values) {
        return FieldDescriptor.builder(name, new LiteralType(Arrays.asList(values)));
    }

    public static FieldDescriptor.Builder<Object> expression(String name, TypeExpression expression) {
        return FieldDescriptor.builder(name, new ExpressionType(expression));
    }

    /** A mapping with uniformly typed keys and values. */
    public static FieldDescriptor.Builder<Object> dict(String name, TypeExpression key, TypeExpression value) {
        return expression(name, TypeExpression.mapping(key, value));
    }

    /** A mapping with declared keys, each required or optional. */
    public static FieldDescriptor.Builder<Object> record(String name, TypeExpression.RecordField... fields) {
        return expression(name, TypeExpression.record(fields));
    }

    public static FieldDescriptor.Builder<SchemaInstance> object(String name, SchemaType type) {
        return FieldDescriptor.builder(name, new ObjectType(type));
    }

    /** A partial instance of {@code type} allowing only {@code include}. */
    public static FieldDescriptor.Builder<SchemaInstance> partialOf(String name, SchemaType type, String... include) {
        return FieldDescriptor.builder(name, new PartialType(type, Arrays.asList(include), List.of()));
    }

    /** A partial instance of {@code type} allowing everything but {@code exclude}. */
    public static FieldDescriptor.Builder<SchemaInstance> partialExcluding(
            String name, SchemaType type, String... exclude) {
        return FieldDescriptor.builder(name, new PartialType(type, List.of(), Arrays.asList(exclude)));
    }

    /** A field of a custom type. */
    public static <T> FieldDescriptor.Builder<T> of(String name, FieldType<T> type) {
        return FieldDescriptor.builder(name, type);
    }
}
