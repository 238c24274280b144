package io.datashape.core.field;

import io.datashape.core.engine.SchemaContext;
import io.datashape.core.engine.ValidatorChain;
import io.datashape.core.error.FieldValueException;
import io.datashape.core.model.ErrorCode;
import io.datashape.core.model.FieldError;
import io.datashape.core.spi.DefaultProvider;
import io.datashape.core.spi.Validator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declaration of one field of a schema type: keys, flags, default, validators and value type.
 * Shared by every instance of the type and never mutated; {@link #toBuilder()} derives modified
 * copies.
 *
 * <p>
 * The load pipeline for a present value runs, in order: null handling, type resolution, raw
 * validators, deserialization, post-coercion validators. A failed null or type check ends the
 * pipeline; later failures are accumulated, so raw and post-coercion errors are reported together.
 *
 * @param <T> the stored value type
 */
public final class FieldDescriptor<T> {

    private final String name;
    private final String loadKey;
    private final String dumpKey;
    private final FieldType<T> type;
    private final boolean required;
    private final boolean nullable;
    private final boolean strictLoad;
    private final boolean strictSet;
    private final boolean frozen;
    private final boolean hasDefault;
    private final T defaultValue;
    private final DefaultProvider<T> defaultProvider;
    private final Map<String, Object> extras;
    private final ValidatorChain validators;

    private FieldDescriptor(Builder<T> b) {
        this.name = b.name;
        this.loadKey = b.loadKey != null ? b.loadKey : b.name;
        this.dumpKey = b.dumpKey != null ? b.dumpKey : b.name;
        this.type = b.type;
        this.hasDefault = b.hasDefault;
        this.required = b.required && !b.hasDefault;
        this.nullable = b.nullable;
        this.strictLoad = b.strictLoad;
        this.strictSet = b.strictSet;
        this.frozen = b.frozen;
        this.defaultValue = b.defaultValue;
        this.defaultProvider = b.defaultProvider;
        this.extras = Collections.unmodifiableMap(new LinkedHashMap<>(b.extras));
        this.validators = b.validators;
    }

    /**
     * Starts a descriptor; {@link Fields} has shortcuts for the built-in types.
     *
     * @param name the field name, also the default load and dump key
     * @param type conversion and shape checks for the stored value
     * @param <T>  the stored value type
     * @return a builder with the defaults listed on {@link Builder}
     */
    public static <T> Builder<T> builder(String name, FieldType<T> type) {
        return new Builder<>(name, type);
    }

    /** A builder pre-populated with every attribute of this descriptor. */
    public Builder<T> toBuilder() {
        Builder<T> b = new Builder<>(name, type);
        b.loadKey = loadKey;
        b.dumpKey = dumpKey;
        b.required = required;
        b.nullable = nullable;
        b.strictLoad = strictLoad;
        b.strictSet = strictSet;
        b.frozen = frozen;
        b.hasDefault = hasDefault;
        b.defaultValue = defaultValue;
        b.defaultProvider = defaultProvider;
        b.extras.putAll(extras);
        b.validators = validators;
        return b;
    }

    // ── Pipeline ──

    /** Outcome for a field absent from the input: its default, a required error, or unset. */
    public FieldOutcome loadAbsent(LoadContext context) {
        if (hasDefault) {
            return FieldOutcome.value(resolveDefault(context.schemaContext()));
        }
        if (required) {
            return FieldOutcome.failed(List.of(FieldError.of(ErrorCode.FIELD_REQUIRED)));
        }
        return FieldOutcome.unset();
    }

    /**
     * Runs a present value (possibly {@code null}) through the pipeline.
     *
     * @param raw     the input value
     * @param context engine, schema context and whether the value came from raw data
     * @return the stored value, or the errors (or nested error tree) of the failed steps
     */
    public FieldOutcome load(Object raw, LoadContext context) {
        if (raw == null) {
            return nullable
                    ? FieldOutcome.value(null)
                    : FieldOutcome.failed(List.of(FieldError.of(ErrorCode.NONE_DISALLOWED).withValue(null)));
        }
        boolean strict = context.fromRawData() ? strictLoad : strictSet;
        SchemaContext schemaContext = context.schemaContext();

        Object resolved;
        try {
            resolved = type.resolve(raw, strict, context);
        } catch (FieldValueException e) {
            return failure(e);
        }

        List<FieldError> errors = new ArrayList<>(validators.run(raw, schemaContext, true));

        T value;
        try {
            value = type.deserialize(resolved, context);
        } catch (FieldValueException e) {
            if (errors.isEmpty()) {
                return failure(e);
            }
            // raw failures take precedence over a nested error tree
            if (e.nested() == null) {
                errors.addAll(e.errors());
            }
            return FieldOutcome.failed(errors);
        }

        errors.addAll(validators.run(value, schemaContext, false));
        return errors.isEmpty() ? FieldOutcome.value(value) : FieldOutcome.failed(errors);
    }

    /** Raw form of a stored value. */
    @SuppressWarnings("unchecked")
    public Object dump(Object value, SchemaContext context) {
        return value == null ? null : type.serialize((T) value, context);
    }

    private T resolveDefault(SchemaContext context) {
        return defaultProvider != null ? defaultProvider.get(this, context) : defaultValue;
    }

    private static FieldOutcome failure(FieldValueException e) {
        return e.nested() != null ? FieldOutcome.nested(e.nested()) : FieldOutcome.failed(e.errors());
    }

    // ── Accessors ──

    public String name() {
        return name;
    }

    /** Key read from raw data on load; defaults to the name. */
    public String loadKey() {
        return loadKey;
    }

    /** Key written on dump; defaults to the name. */
    public String dumpKey() {
        return dumpKey;
    }

    public FieldType<T> type() {
        return type;
    }

    /** {@code false} whenever a default is configured. */
    public boolean isRequired() {
        return required;
    }

    public boolean isNullable() {
        return nullable;
    }

    /** Whether values from raw data must already have the declared shape. */
    public boolean isStrictLoad() {
        return strictLoad;
    }

    /** Whether assigned values must already have the declared shape. */
    public boolean isStrictSet() {
        return strictSet;
    }

    /** Whether assignment and update of this field are refused after load. */
    public boolean isFrozen() {
        return frozen;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    /** Opaque metadata attached at declaration time. */
    public Map<String, Object> extras() {
        return extras;
    }

    public ValidatorChain validators() {
        return validators;
    }

    @Override
    public String toString() {
        return "FieldDescriptor[" + name + ": " + type.label() + "]";
    }

    /** Fluent builder. Defaults: required, not nullable, strict, not frozen, no validators. */
    public static final class Builder<T> {

        private String name;
        private final FieldType<T> type;
        private String loadKey;
        private String dumpKey;
        private boolean required = true;
        private boolean nullable;
        private boolean strictLoad = true;
        private boolean strictSet = true;
        private boolean frozen;
        private boolean hasDefault;
        private T defaultValue;
        private DefaultProvider<T> defaultProvider;
        private final Map<String, Object> extras = new LinkedHashMap<>();
        private ValidatorChain validators = ValidatorChain.empty();

        private Builder(String name, FieldType<T> type) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.type = Objects.requireNonNull(type, "type must not be null");
        }

        public Builder<T> name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        /** Sets both the load key and the dump key. */
        public Builder<T> dataKey(String key) {
            this.loadKey = key;
            this.dumpKey = key;
            return this;
        }

        public Builder<T> loadKey(String key) {
            this.loadKey = key;
            return this;
        }

        public Builder<T> dumpKey(String key) {
            this.dumpKey = key;
            return this;
        }

        public Builder<T> required(boolean required) {
            this.required = required;
            return this;
        }

        /** A static default; makes the field optional. {@code null} is a valid default. */
        public Builder<T> defaultValue(T value) {
            this.hasDefault = true;
            this.defaultValue = value;
            this.defaultProvider = null;
            return this;
        }

        /** A computed default; makes the field optional. */
        public Builder<T> defaultProvider(DefaultProvider<T> provider) {
            this.hasDefault = true;
            this.defaultProvider = Objects.requireNonNull(provider, "provider must not be null");
            this.defaultValue = null;
            return this;
        }

        public Builder<T> noDefault() {
            this.hasDefault = false;
            this.defaultValue = null;
            this.defaultProvider = null;
            return this;
        }

        public Builder<T> nullable(boolean nullable) {
            this.nullable = nullable;
            return this;
        }

        /** Sets both {@link #strictLoad} and {@link #strictSet}. */
        public Builder<T> strict(boolean strict) {
            this.strictLoad = strict;
            this.strictSet = strict;
            return this;
        }

        public Builder<T> strictLoad(boolean strict) {
            this.strictLoad = strict;
            return this;
        }

        public Builder<T> strictSet(boolean strict) {
            this.strictSet = strict;
            return this;
        }

        public Builder<T> frozen(boolean frozen) {
            this.frozen = frozen;
            return this;
        }

        public Builder<T> extra(String key, Object value) {
            extras.put(key, value);
            return this;
        }

        /** Adds a post-coercion validator. */
        public Builder<T> validator(Validator<? super T> validator) {
            return addValidator(validator, false);
        }

        /** Adds a raw validator; it sees the input value before deserialization. */
        public Builder<T> rawValidator(Validator<Object> validator) {
            return addValidator(validator, true);
        }

        public Builder<T> addValidator(Validator<?> validator, boolean raw) {
            this.validators = validators.with(validator, raw);
            return this;
        }

        public Builder<T> removeValidator(Validator<?> validator) {
            this.validators = validators.without(validator);
            return this;
        }

        public Builder<T> clearValidators() {
            this.validators = validators.cleared();
            return this;
        }

        /** Removes only the validators of one mode. */
        public Builder<T> clearValidators(boolean raw) {
            this.validators = validators.cleared(raw);
            return this;
        }

        public FieldDescriptor<T> build() {
            return new FieldDescriptor<>(this);
        }
    }
}
