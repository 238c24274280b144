package io.datashape.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thrown by {@code TypeExpressionValidator.validateTypes} when a map of values does not conform
 * to a map of named type expressions. Errors are keyed by the value name.
 */
public final class TypeValidationException extends DataShapeException {

    private static final long serialVersionUID = 1L;

    private final Map<String, List<String>> errors;

    public TypeValidationException(Map<String, List<String>> errors) {
        super("Type validation failed: " + errors, null);
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    /** Error messages keyed by value name, in detection order. */
    public Map<String, List<String>> errors() {
        return errors;
    }
}
