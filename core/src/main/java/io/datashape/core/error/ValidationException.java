package io.datashape.core.error;

import io.datashape.core.model.ErrorTree;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Thrown when loading, updating or assigning fields of a schema instance fails. Carries the
 * complete {@link ErrorTree} for the operation: every violation found, not just the first.
 *
 * <p>
 * Not final: a subclass with a {@code (String, ErrorTree)} constructor can be selected globally
 * through {@link io.datashape.core.config.EngineConfig} so that callers see their own exception
 * type.
 */
public class ValidationException extends DataShapeException {

    private static final long serialVersionUID = 1L;

    private final transient ErrorTree errors;

    public ValidationException(String schemaName, ErrorTree errors) {
        super(formatMessage(schemaName, errors), schemaName);
        this.errors = Objects.requireNonNull(errors, "errors must not be null");
    }

    /** The aggregated error tree. */
    public ErrorTree errors() {
        return errors;
    }

    /** Shorthand for {@code errors().raw()}. */
    public Map<String, Object> raw() {
        return errors.raw();
    }

    private static String formatMessage(String schemaName, ErrorTree errors) {
        StringBuilder sb = new StringBuilder("Validation failed for schema '")
                .append(schemaName)
                .append("':");
        if (errors == null) {
            return sb.toString();
        }
        for (Map.Entry<String, List<String>> entry : errors.flatten().entrySet()) {
            for (String message : entry.getValue()) {
                sb.append("\n  ").append(entry.getKey()).append(": ").append(message);
            }
        }
        return sb.toString();
    }
}
