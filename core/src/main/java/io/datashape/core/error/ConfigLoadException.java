package io.datashape.core.error;

/**
 * Thrown when engine configuration cannot be loaded. The message names the file, key or
 * environment variable at fault.
 */
public final class ConfigLoadException extends DataShapeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message, null);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause, null);
    }
}
