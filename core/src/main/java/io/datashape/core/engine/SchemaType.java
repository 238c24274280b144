package io.datashape.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.datashape.core.error.SchemaDefinitionException;
import io.datashape.core.field.FieldDescriptor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * An ordered, immutable registry of field descriptors under a name. Built once with
 * {@link #builder(String)} and shared by every instance loaded from it.
 *
 * <p>
 * The {@code load*} methods are shortcuts through {@link SchemaEngine#global()}.
 */
public final class SchemaType {

    private final String name;
    private final List<FieldDescriptor<?>> fields;
    private final Map<String, FieldDescriptor<?>> byName;
    private final Map<String, FieldDescriptor<?>> byLoadKey;
    private final Map<String, FieldDescriptor<?>> byDumpKey;
    private final boolean frozen;
    private final Boolean ignoreExtra;
    private final UnaryOperator<Map<String, Object>> preprocessor;
    private final Consumer<SchemaInstance> afterLoad;

    private SchemaType(
            String name,
            List<FieldDescriptor<?>> fields,
            boolean frozen,
            Boolean ignoreExtra,
            UnaryOperator<Map<String, Object>> preprocessor,
            Consumer<SchemaInstance> afterLoad) {
        this.name = name;
        this.fields = List.copyOf(fields);
        this.frozen = frozen;
        this.ignoreExtra = ignoreExtra;
        this.preprocessor = preprocessor;
        this.afterLoad = afterLoad;

        Map<String, FieldDescriptor<?>> names = new HashMap<>();
        Map<String, FieldDescriptor<?>> loadKeys = new HashMap<>();
        Map<String, FieldDescriptor<?>> dumpKeys = new HashMap<>();
        for (FieldDescriptor<?> field : this.fields) {
            names.put(field.name(), field);
            FieldDescriptor<?> clash = loadKeys.put(field.loadKey(), field);
            if (clash != null) {
                throw new SchemaDefinitionException(
                        "Fields '" + clash.name() + "' and '" + field.name() + "' share load key '" + field.loadKey()
                                + "'",
                        name);
            }
            clash = dumpKeys.put(field.dumpKey(), field);
            if (clash != null) {
                throw new SchemaDefinitionException(
                        "Fields '" + clash.name() + "' and '" + field.name() + "' share dump key '" + field.dumpKey()
                                + "'",
                        name);
            }
        }
        this.byName = Collections.unmodifiableMap(names);
        this.byLoadKey = Collections.unmodifiableMap(loadKeys);
        this.byDumpKey = Collections.unmodifiableMap(dumpKeys);
    }

    /**
     * Starts a new schema type.
     *
     * @param name the type name used in error trees and log lines
     * @return an empty builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    /** Every field, in declaration order (inherited fields first). */
    public List<FieldDescriptor<?>> fields() {
        return fields;
    }

    /** Field names in declaration order. */
    public Set<String> fieldNames() {
        Set<String> names = new LinkedHashSet<>();
        for (FieldDescriptor<?> field : fields) {
            names.add(field.name());
        }
        return names;
    }

    /** The field named {@code name}, or {@code null}. */
    public FieldDescriptor<?> field(String name) {
        return byName.get(name);
    }

    /** The field loaded from {@code key}, or {@code null}. */
    public FieldDescriptor<?> fieldByLoadKey(String key) {
        return byLoadKey.get(key);
    }

    /** The field dumped under {@code key}, or {@code null}. */
    public FieldDescriptor<?> fieldByDumpKey(String key) {
        return byDumpKey.get(key);
    }

    public boolean hasField(String name) {
        return byName.containsKey(name);
    }

    /** Whether every field rejects assignment after construction. */
    public boolean isFrozen() {
        return frozen;
    }

    /** The type's own unknown-field policy, or {@code null} to defer to the engine config. */
    public Boolean ignoreExtra() {
        return ignoreExtra;
    }

    Map<String, Object> preprocess(Map<String, Object> raw) {
        if (preprocessor == null) {
            return raw;
        }
        Map<String, Object> result = preprocessor.apply(raw);
        if (result == null) {
            throw new IllegalStateException("Preprocessor of schema '" + name + "' returned null");
        }
        return result;
    }

    void afterLoad(SchemaInstance instance) {
        if (afterLoad != null) {
            afterLoad.accept(instance);
        }
    }

    /**
     * Resolves a partial selection into the set of allowed field names. Exactly one of
     * {@code include} and {@code exclude} must be non-empty, and every name must be declared.
     *
     * @throws SchemaDefinitionException otherwise
     */
    public Set<String> selectFields(Collection<String> include, Collection<String> exclude) {
        boolean hasInclude = include != null && !include.isEmpty();
        boolean hasExclude = exclude != null && !exclude.isEmpty();
        if (hasInclude == hasExclude) {
            throw new SchemaDefinitionException("Exactly one of include or exclude must be provided", name);
        }
        Collection<String> named = hasInclude ? include : exclude;
        for (String fieldName : named) {
            if (!byName.containsKey(fieldName)) {
                throw new SchemaDefinitionException(
                        "Schema '" + name + "' has no field named '" + fieldName + "'", name);
            }
        }
        Set<String> allowed = new LinkedHashSet<>();
        for (FieldDescriptor<?> field : fields) {
            if (hasInclude == named.contains(field.name())) {
                allowed.add(field.name());
            }
        }
        return Collections.unmodifiableSet(allowed);
    }

    // ── Shortcuts through the global engine ──

    /**
     * Loads {@code raw} through {@link SchemaEngine#global()}.
     *
     * @see SchemaEngine#load(SchemaType, Map, LoadOptions)
     */
    public SchemaInstance load(Map<String, ?> raw) {
        return SchemaEngine.global().load(this, raw, LoadOptions.defaults());
    }

    public SchemaInstance load(Map<String, ?> raw, LoadOptions options) {
        return SchemaEngine.global().load(this, raw, options);
    }

    public SchemaInstance load(JsonNode raw) {
        return SchemaEngine.global().load(this, raw, LoadOptions.defaults());
    }

    /** Loads a partial instance allowing only the {@code allowed} fields. */
    public SchemaInstance loadPartial(Map<String, ?> raw, Set<String> allowed) {
        return SchemaEngine.global().loadPartial(this, raw, allowed, LoadOptions.defaults());
    }

    @Override
    public String toString() {
        return "SchemaType[" + name + ", fields=" + fieldNames() + "]";
    }

    /** Fluent builder. Not thread-safe. */
    public static final class Builder {

        private final String name;
        private final Map<String, FieldDescriptor<?>> fields = new LinkedHashMap<>();
        private final Set<String> ownNames = new LinkedHashSet<>();
        private boolean frozen;
        private Boolean ignoreExtra;
        private UnaryOperator<Map<String, Object>> preprocessor;
        private Consumer<SchemaInstance> afterLoad;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        /**
         * Copies the fields, flags and hooks of {@code parent}. Fields declared on this builder
         * with an inherited name replace the inherited field at its original position.
         */
        public Builder extend(SchemaType parent) {
            Objects.requireNonNull(parent, "parent must not be null");
            Map<String, FieldDescriptor<?>> merged = new LinkedHashMap<>();
            for (FieldDescriptor<?> field : parent.fields()) {
                merged.put(field.name(), field);
            }
            merged.putAll(fields);
            fields.clear();
            fields.putAll(merged);
            this.frozen = this.frozen || parent.frozen;
            if (ignoreExtra == null) {
                ignoreExtra = parent.ignoreExtra;
            }
            if (preprocessor == null) {
                preprocessor = parent.preprocessor;
            }
            if (afterLoad == null) {
                afterLoad = parent.afterLoad;
            }
            return this;
        }

        /**
         * Declares a field. Declaration order is load, dump and error order.
         *
         * @param field the descriptor; its name overrides an inherited field of the same name
         * @return this builder
         * @throws SchemaDefinitionException if this builder already declares the name
         */
        public Builder field(FieldDescriptor<?> field) {
            Objects.requireNonNull(field, "field must not be null");
            if (!ownNames.add(field.name())) {
                throw new SchemaDefinitionException("Field '" + field.name() + "' is declared twice", name);
            }
            fields.put(field.name(), field);
            return this;
        }

        public Builder field(FieldDescriptor.Builder<?> field) {
            return field(field.build());
        }

        public Builder frozen(boolean frozen) {
            this.frozen = frozen;
            return this;
        }

        public Builder ignoreExtra(boolean ignoreExtra) {
            this.ignoreExtra = ignoreExtra;
            return this;
        }

        /** Transforms the raw mapping before any field is loaded. */
        public Builder preprocessor(UnaryOperator<Map<String, Object>> preprocessor) {
            this.preprocessor = preprocessor;
            return this;
        }

        /** Runs after a successful load, with the fully initialized instance. */
        public Builder afterLoad(Consumer<SchemaInstance> afterLoad) {
            this.afterLoad = afterLoad;
            return this;
        }

        /**
         * Builds the immutable type.
         *
         * @throws SchemaDefinitionException if two fields share a load key or a dump key
         */
        public SchemaType build() {
            return new SchemaType(name, new ArrayList<>(fields.values()), frozen, ignoreExtra, preprocessor, afterLoad);
        }
    }
}
