package io.datashape.core.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** The primitive shapes an {@link TypeExpression.Atom} can name without a Java class. */
public enum PrimitiveType {
    STRING("string"),
    INTEGER("integer"),
    FLOAT("float"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    NONE("none");

    private final String label;

    PrimitiveType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Runtime shape check. Booleans are never numbers. */
    public boolean matches(Object value) {
        return switch (this) {
            case STRING -> value instanceof String;
            case INTEGER -> isIntegral(value);
            case FLOAT -> isFloating(value);
            case NUMBER -> isIntegral(value) || isFloating(value);
            case BOOLEAN -> value instanceof Boolean;
            case NONE -> value == null;
        };
    }

    /** Looks up a primitive by its label, or returns {@code null}. */
    public static PrimitiveType fromLabel(String label) {
        for (PrimitiveType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        return null;
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger;
    }

    public static boolean isFloating(Object value) {
        return value instanceof Double || value instanceof Float || value instanceof BigDecimal;
    }

    /** Short runtime type name used in error messages. */
    public static String describe(Object value) {
        if (value == null) return "none";
        if (value instanceof String) return "string";
        if (value instanceof Boolean) return "boolean";
        if (isIntegral(value)) return "integer";
        if (isFloating(value)) return "float";
        if (value instanceof List || value instanceof Object[]) return "list";
        if (value instanceof Set) return "set";
        if (value instanceof Map) return "mapping";
        return value.getClass().getSimpleName();
    }
}
