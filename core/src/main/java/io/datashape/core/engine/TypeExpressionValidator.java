package io.datashape.core.engine;

import io.datashape.core.error.TypeValidationException;
import io.datashape.core.model.Mismatch;
import io.datashape.core.model.PrimitiveType;
import io.datashape.core.model.TypeExpression;
import io.datashape.core.model.TypeExpression.Any;
import io.datashape.core.model.TypeExpression.Atom;
import io.datashape.core.model.TypeExpression.Literal;
import io.datashape.core.model.TypeExpression.Mapping;
import io.datashape.core.model.TypeExpression.RecordField;
import io.datashape.core.model.TypeExpression.Sequence;
import io.datashape.core.model.TypeExpression.SetOf;
import io.datashape.core.model.TypeExpression.Tuple;
import io.datashape.core.model.TypeExpression.TypedRecord;
import io.datashape.core.model.TypeExpression.Union;
import io.datashape.core.model.TypeExpression.Unsupported;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks runtime values against {@link TypeExpression} trees. Every mismatch is collected, each
 * with the path of the offending element below the validated root.
 *
 * <p>
 * Thread-safe: the only mutable state is the set of unsupported labels already warned about.
 */
public final class TypeExpressionValidator {

    private static final Logger LOG = LoggerFactory.getLogger(TypeExpressionValidator.class);

    private final boolean warnUnsupported;
    private final Set<String> warnedLabels = ConcurrentHashMap.newKeySet();

    public TypeExpressionValidator() {
        this(true);
    }

    /**
     * @param warnUnsupported whether to log a one-time WARN per {@link Unsupported} label
     */
    public TypeExpressionValidator(boolean warnUnsupported) {
        this.warnUnsupported = warnUnsupported;
    }

    /** Validates {@code value} against {@code expr}; an empty list means it conforms. */
    public List<Mismatch> validate(Object value, TypeExpression expr) {
        return validate(value, expr, List.of());
    }

    /** Validates {@code value} as found at {@code path} below some outer root. */
    public List<Mismatch> validate(Object value, TypeExpression expr, List<Object> path) {
        Objects.requireNonNull(expr, "expr must not be null");
        List<Mismatch> out = new ArrayList<>();
        check(value, expr, new ArrayList<>(path), out);
        return out;
    }

    public boolean matches(Object value, TypeExpression expr) {
        return validate(value, expr).isEmpty();
    }

    /**
     * Validates a map of named values against a map of named type expressions.
     *
     * @param ignoreMissing do not report names declared in {@code types} but absent from
     *                      {@code values}
     * @param ignoreExtra   do not report names present in {@code values} but not declared
     * @throws TypeValidationException listing every problem, keyed by name
     */
    public void validateTypes(
            Map<String, TypeExpression> types,
            Map<String, ?> values,
            boolean ignoreMissing,
            boolean ignoreExtra) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        types.forEach((name, expr) -> {
            if (!values.containsKey(name)) {
                if (!ignoreMissing) {
                    errors.computeIfAbsent(name, k -> new ArrayList<>()).add("This key is missing.");
                }
                return;
            }
            for (Mismatch mismatch : validate(values.get(name), expr)) {
                errors.computeIfAbsent(name, k -> new ArrayList<>()).add(mismatch.describe());
            }
        });
        if (!ignoreExtra) {
            for (String name : values.keySet()) {
                if (!types.containsKey(name)) {
                    errors.computeIfAbsent(name, k -> new ArrayList<>()).add("Invalid key");
                }
            }
        }
        if (!errors.isEmpty()) {
            throw new TypeValidationException(errors);
        }
    }

    // ── Dispatch ──

    private void check(Object value, TypeExpression expr, List<Object> path, List<Mismatch> out) {
        if (expr instanceof Any) {
            return;
        }
        if (expr instanceof Atom atom) {
            if (!atom.matches(value)) {
                out.add(new Mismatch(path, "Must be of type " + atom.label()));
            }
        } else if (expr instanceof Union union) {
            checkUnion(value, union, path, out);
        } else if (expr instanceof Literal literal) {
            checkLiteral(value, literal, path, out);
        } else if (expr instanceof Sequence sequence) {
            List<?> items = asList(value);
            if (items == null) {
                out.add(new Mismatch(path, "Must be a valid list"));
                return;
            }
            for (int i = 0; i < items.size(); i++) {
                check(items.get(i), sequence.element(), append(path, i), out);
            }
        } else if (expr instanceof SetOf setOf) {
            if (!(value instanceof Set<?> set)) {
                out.add(new Mismatch(path, "Must be a valid set"));
                return;
            }
            int position = 0;
            for (Object item : set) {
                check(item, setOf.element(), append(path, position++), out);
            }
        } else if (expr instanceof Tuple tuple) {
            checkTuple(value, tuple, path, out);
        } else if (expr instanceof Mapping mapping) {
            if (!(value instanceof Map<?, ?> map)) {
                out.add(new Mismatch(path, "Must be a valid mapping"));
                return;
            }
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                List<Object> entryPath = append(path, entry.getKey() == null ? "null" : entry.getKey());
                check(entry.getKey(), mapping.key(), entryPath, out);
                check(entry.getValue(), mapping.value(), entryPath, out);
            }
        } else if (expr instanceof TypedRecord record) {
            checkRecord(value, record, path, out);
        } else if (expr instanceof Unsupported unsupported) {
            warnOnce(unsupported.label());
        }
    }

    private void checkUnion(Object value, Union union, List<Object> path, List<Mismatch> out) {
        for (TypeExpression variant : union.variants()) {
            if (validate(value, variant, path).isEmpty()) {
                return;
            }
        }
        out.add(new Mismatch(
                path,
                "Type of " + Literal.repr(value) + " (" + PrimitiveType.describe(value)
                        + ") is not compatible with types (" + union.variantLabels() + ")"));
    }

    private static void checkLiteral(Object value, Literal literal, List<Object> path, List<Mismatch> out) {
        for (Object allowed : literal.values()) {
            if (literalEquals(allowed, value)) {
                return;
            }
        }
        List<Object> values = literal.values();
        String message = values.size() == 1
                ? "Value must be equal to " + Literal.repr(values.get(0))
                : "Value must be one of: " + values.stream().map(Literal::repr).collect(Collectors.joining(", "));
        out.add(new Mismatch(path, message));
    }

    private void checkTuple(Object value, Tuple tuple, List<Object> path, List<Mismatch> out) {
        List<?> items = asList(value);
        if (items == null) {
            out.add(new Mismatch(path, "Must be a valid tuple"));
            return;
        }
        int expected = tuple.elements().size();
        if (items.size() != expected) {
            out.add(new Mismatch(path, "Tuple length must be " + expected + " (current length: " + items.size() + ")"));
            return;
        }
        for (int i = 0; i < expected; i++) {
            check(items.get(i), tuple.elements().get(i), append(path, i), out);
        }
    }

    private void checkRecord(Object value, TypedRecord record, List<Object> path, List<Mismatch> out) {
        if (!(value instanceof Map<?, ?> map)) {
            out.add(new Mismatch(path, "Must be a valid mapping"));
            return;
        }
        for (RecordField field : record.fields()) {
            List<Object> fieldPath = append(path, field.key());
            if (!map.containsKey(field.key())) {
                if (field.required()) {
                    out.add(new Mismatch(fieldPath, "This key is required."));
                }
                continue;
            }
            check(map.get(field.key()), field.type(), fieldPath, out);
        }
    }

    private void warnOnce(String label) {
        if (warnUnsupported && warnedLabels.add(label)) {
            LOG.warn("Type expression '{}' is not supported; values are accepted without validation", label);
        }
    }

    // ── Helpers ──

    private static boolean literalEquals(Object allowed, Object value) {
        if (allowed instanceof Boolean || value instanceof Boolean) {
            return Objects.equals(allowed, value);
        }
        BigDecimal a = toDecimal(allowed);
        BigDecimal v = toDecimal(value);
        if (a != null && v != null) {
            return a.compareTo(v) == 0;
        }
        return Objects.equals(allowed, value);
    }

    /** Exact decimal form of a finite number, or {@code null}. */
    private static BigDecimal toDecimal(Object value) {
        if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
            return null;
        }
        if (value instanceof Float f && (f.isNaN() || f.isInfinite())) {
            return null;
        }
        if (PrimitiveType.isIntegral(value) || PrimitiveType.isFloating(value)) {
            return new BigDecimal(value.toString());
        }
        return null;
    }

    private static List<?> asList(Object value) {
        if (value instanceof List<?> list) {
            return list;
        }
        if (value instanceof Object[] array) {
            return Arrays.asList(array);
        }
        return null;
    }

    private static List<Object> append(List<Object> path, Object segment) {
        List<Object> next = new ArrayList<>(path.size() + 1);
        next.addAll(path);
        next.add(segment);
        return next;
    }
}
