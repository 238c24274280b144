package io.datashape.core.config;

import java.util.Objects;

/**
 * Immutable engine-wide settings. Build with {@link #builder()}, or load from YAML with
 * {@link ConfigLoader}.
 *
 * <ul>
 *   <li>{@code exceptionFactory} creates the exception thrown for a failed load or update
 *       (default: plain {@code ValidationException})</li>
 *   <li>{@code warnUnsupportedTypes} logs a one-time WARN per unsupported type expression
 *       (default {@code true})</li>
 *   <li>{@code ignoreExtra} is the unknown-field policy for schema types that do not set their
 *       own (default {@code false})</li>
 * </ul>
 */
public final class EngineConfig {

    private static final EngineConfig DEFAULTS = builder().build();

    private final ValidationExceptionFactory exceptionFactory;
    private final boolean warnUnsupportedTypes;
    private final boolean ignoreExtra;

    private EngineConfig(Builder b) {
        this.exceptionFactory = b.exceptionFactory;
        this.warnUnsupportedTypes = b.warnUnsupportedTypes;
        this.ignoreExtra = b.ignoreExtra;
    }

    public static EngineConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .exceptionFactory(exceptionFactory)
                .warnUnsupportedTypes(warnUnsupportedTypes)
                .ignoreExtra(ignoreExtra);
    }

    public ValidationExceptionFactory exceptionFactory() {
        return exceptionFactory;
    }

    public boolean warnUnsupportedTypes() {
        return warnUnsupportedTypes;
    }

    public boolean ignoreExtra() {
        return ignoreExtra;
    }

    @Override
    public String toString() {
        return "EngineConfig{warnUnsupportedTypes=" + warnUnsupportedTypes + ", ignoreExtra=" + ignoreExtra + "}";
    }

    public static final class Builder {

        private ValidationExceptionFactory exceptionFactory = ValidationExceptionFactory.standard();
        private boolean warnUnsupportedTypes = true;
        private boolean ignoreExtra;

        private Builder() {}

        public Builder exceptionFactory(ValidationExceptionFactory factory) {
            this.exceptionFactory = Objects.requireNonNull(factory, "factory must not be null");
            return this;
        }

        public Builder warnUnsupportedTypes(boolean warn) {
            this.warnUnsupportedTypes = warn;
            return this;
        }

        public Builder ignoreExtra(boolean ignoreExtra) {
            this.ignoreExtra = ignoreExtra;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
