package io.datashape.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One violation found while validating a value against a {@link TypeExpression}.
 *
 * @param path    location of the offending value below the validated root; {@link String}
 *                segments are mapping/record keys, {@link Integer} segments are positions
 * @param message what was expected at that location
 */
public record Mismatch(List<Object> path, String message) {

    public Mismatch {
        path = List.copyOf(path);
        Objects.requireNonNull(message, "message must not be null");
    }

    /** Dotted/indexed rendering of {@link #path()}, e.g. {@code tags[2]} or {@code owner.id}. */
    public String pathString() {
        StringBuilder sb = new StringBuilder();
        for (Object segment : path) {
            if (segment instanceof Integer) {
                sb.append('[').append(segment).append(']');
            } else if (segment instanceof String s && !s.isEmpty()) {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(s);
            } else {
                sb.append('[').append(segment).append(']');
            }
        }
        return sb.toString();
    }

    /** The message prefixed with the path, or the bare message at the root. */
    public String describe() {
        String p = pathString();
        return p.isEmpty() ? message : p + ": " + message;
    }
}
