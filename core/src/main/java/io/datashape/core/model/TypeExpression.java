package io.datashape.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Declarative description of an expected value shape. Built once (by the factory methods below
 * or by {@code TypeExpressionParser}) and shared read-only across any number of validations.
 *
 * <p>
 * Implementations form a sealed hierarchy, so the vocabulary is fixed. Every variant has a stable
 * {@link #label()} used in mismatch messages and descriptor round-trips.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface TypeExpression {

    /** Stable, human-readable label, e.g. {@code string} or {@code sequence[integer]}. */
    String label();

    // ── Factory methods ──

    static Atom atom(PrimitiveType primitive) {
        return new Atom(primitive.label(), primitive, null);
    }

    /** An atom satisfied by any instance of {@code javaType}. */
    static Atom instanceOf(Class<?> javaType) {
        return new Atom(javaType.getSimpleName(), null, javaType);
    }

    static Atom string() {
        return atom(PrimitiveType.STRING);
    }

    static Atom integer() {
        return atom(PrimitiveType.INTEGER);
    }

    static Atom floating() {
        return atom(PrimitiveType.FLOAT);
    }

    static Atom number() {
        return atom(PrimitiveType.NUMBER);
    }

    static Atom bool() {
        return atom(PrimitiveType.BOOLEAN);
    }

    static Atom none() {
        return atom(PrimitiveType.NONE);
    }

    static Any any() {
        return Any.INSTANCE;
    }

    static Union union(TypeExpression... variants) {
        return new Union(Arrays.asList(variants));
    }

    /** {@code T} or {@code null}: a union of {@code T} and {@link PrimitiveType#NONE}. */
    static Union optional(TypeExpression type) {
        return new Union(List.of(type, none()));
    }

    static Literal literal(Object... values) {
        return new Literal(Arrays.asList(values));
    }

    static Sequence sequence(TypeExpression element) {
        return new Sequence(element);
    }

    static SetOf setOf(TypeExpression element) {
        return new SetOf(element);
    }

    static Tuple tuple(TypeExpression... elements) {
        return new Tuple(Arrays.asList(elements));
    }

    static Mapping mapping(TypeExpression key, TypeExpression value) {
        return new Mapping(key, value);
    }

    static TypedRecord record(RecordField... fields) {
        return new TypedRecord(Arrays.asList(fields));
    }

    static Unsupported unsupported(String label) {
        return new Unsupported(label);
    }

    // ── Implementations ──

    /**
     * A single primitive or class shape. Exactly one of {@code primitive} and {@code javaType}
     * is set.
     */
    record Atom(String label, PrimitiveType primitive, Class<?> javaType) implements TypeExpression {
        public Atom {
            Objects.requireNonNull(label, "label must not be null");
            if ((primitive == null) == (javaType == null)) {
                throw new IllegalArgumentException("Atom needs exactly one of primitive or javaType");
            }
        }

        public boolean matches(Object value) {
            return primitive != null ? primitive.matches(value) : javaType.isInstance(value);
        }
    }

    /** Matches every value. */
    record Any() implements TypeExpression {
        static final Any INSTANCE = new Any();

        @Override
        public String label() {
            return "any";
        }
    }

    /** Matches when any variant matches; variants are tried in declared order. */
    record Union(List<TypeExpression> variants) implements TypeExpression {
        public Union {
            variants = List.copyOf(variants);
            if (variants.isEmpty()) {
                throw new IllegalArgumentException("Union needs at least one variant");
            }
        }

        /** Variant labels joined with {@code ", "}. */
        public String variantLabels() {
            return variants.stream().map(TypeExpression::label).collect(Collectors.joining(", "));
        }

        @Override
        public String label() {
            return "union[" + variantLabels() + "]";
        }
    }

    /** Matches values equal to one of the allowed literals. */
    record Literal(List<Object> values) implements TypeExpression {
        public Literal {
            if (values.isEmpty()) {
                throw new IllegalArgumentException("Literal needs at least one value");
            }
            // List.copyOf rejects nulls; a null literal is legitimate
            values = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(values)));
        }

        @Override
        public String label() {
            return "literal[" + values.stream().map(Literal::repr).collect(Collectors.joining(", ")) + "]";
        }

        /** Quotes strings so that {@code 'a'} and {@code a} read differently in messages. */
        public static String repr(Object value) {
            return value instanceof String s ? "'" + s + "'" : String.valueOf(value);
        }
    }

    /** An ordered container whose every element matches {@code element}. */
    record Sequence(TypeExpression element) implements TypeExpression {
        public Sequence {
            Objects.requireNonNull(element, "element must not be null");
        }

        @Override
        public String label() {
            return "sequence[" + element.label() + "]";
        }
    }

    /** A {@link java.util.Set} whose every element matches {@code element}. */
    record SetOf(TypeExpression element) implements TypeExpression {
        public SetOf {
            Objects.requireNonNull(element, "element must not be null");
        }

        @Override
        public String label() {
            return "set[" + element.label() + "]";
        }
    }

    /** A fixed-length ordered container, validated position by position. */
    record Tuple(List<TypeExpression> elements) implements TypeExpression {
        public Tuple {
            elements = List.copyOf(elements);
        }

        @Override
        public String label() {
            return "tuple[" + elements.stream().map(TypeExpression::label).collect(Collectors.joining(", ")) + "]";
        }
    }

    /** A key→value mapping with uniformly typed keys and values. */
    record Mapping(TypeExpression key, TypeExpression value) implements TypeExpression {
        public Mapping {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String label() {
            return "mapping[" + key.label() + ", " + value.label() + "]";
        }
    }

    /**
     * A mapping with a fixed set of declared keys, each required or optional. Keys present in
     * the value but not declared here are ignored.
     */
    record TypedRecord(List<RecordField> fields) implements TypeExpression {
        public TypedRecord {
            fields = List.copyOf(fields);
            long distinct = fields.stream().map(RecordField::key).distinct().count();
            if (distinct != fields.size()) {
                throw new IllegalArgumentException("Record keys must be unique: " + fields);
            }
        }

        @Override
        public String label() {
            return "record{"
                    + fields.stream()
                            .map(f -> f.required() ? f.key() : f.key() + "?")
                            .collect(Collectors.joining(", "))
                    + "}";
        }
    }

    /** One declared key of a {@link TypedRecord}. */
    record RecordField(String key, TypeExpression type, boolean required) {
        public RecordField {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }

        public static RecordField required(String key, TypeExpression type) {
            return new RecordField(key, type, true);
        }

        public static RecordField optional(String key, TypeExpression type) {
            return new RecordField(key, type, false);
        }
    }

    /**
     * A shape outside the supported vocabulary. Always matches; validators emit a one-time
     * warning naming {@code label} unless warnings are disabled.
     */
    record Unsupported(String label) implements TypeExpression {
        public Unsupported {
            Objects.requireNonNull(label, "label must not be null");
        }
    }
}
