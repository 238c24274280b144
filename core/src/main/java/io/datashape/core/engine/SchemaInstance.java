package io.datashape.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datashape.core.error.DisallowedFieldException;
import io.datashape.core.error.FieldNotSetException;
import io.datashape.core.field.FieldDescriptor;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A validated value of a {@link SchemaType}: the stored field values plus the instance's
 * {@link SchemaContext}. Created only by {@link SchemaEngine}; changed only through validated
 * assignment ({@link #set}) or transactional update ({@link #update}).
 *
 * <p>
 * A partial instance carries an allow-list: reading or writing any other field raises
 * {@link DisallowedFieldException}.
 *
 * <p>
 * Not thread-safe.
 */
public final class SchemaInstance {

    private final SchemaEngine engine;
    private final SchemaType type;
    private final SchemaContext context;
    private final Set<String> allowed;
    private final Map<String, Object> values = new LinkedHashMap<>();

    SchemaInstance(SchemaEngine engine, SchemaType type, SchemaContext context, Set<String> allowed) {
        this.engine = engine;
        this.type = type;
        this.context = context;
        this.allowed = allowed == null ? null : Set.copyOf(allowed);
    }

    public SchemaType type() {
        return type;
    }

    public SchemaContext context() {
        return context;
    }

    // ── Read access ──

    /**
     * The stored value of field {@code name}.
     *
     * @throws IllegalArgumentException if the type declares no such field
     * @throws DisallowedFieldException if the field is outside a partial instance's allow-list
     * @throws FieldNotSetException     if the field holds no value
     */
    public Object get(String name) {
        checkAccess(name);
        if (!values.containsKey(name)) {
            throw new FieldNotSetException(type.name(), name);
        }
        return values.get(name);
    }

    @SuppressWarnings("unchecked")
    public <T> T get(FieldDescriptor<T> field) {
        return (T) get(field.name());
    }

    /**
     * The value of the field named (or loaded/dumped as) {@code key}, or {@code fallback} when
     * there is no such field or it is unset or disallowed.
     */
    public Object getOrDefault(String key, Object fallback) {
        FieldDescriptor<?> field = type.field(key);
        if (field == null) {
            field = type.fieldByLoadKey(key);
        }
        if (field == null) {
            field = type.fieldByDumpKey(key);
        }
        if (field == null || !isAllowed(field.name()) || !values.containsKey(field.name())) {
            return fallback;
        }
        return values.get(field.name());
    }

    /** Whether field {@code name} holds a value. */
    public boolean isSet(String name) {
        checkAccess(name);
        return values.containsKey(name);
    }

    // ── Mutation ──

    /** Assigns one field by name; strictness is the field's {@code strictSet}. */
    public void set(String name, Object value) {
        engine.assign(this, Collections.singletonMap(name, value));
    }

    /** Assigns several fields by name, all or nothing. */
    public void set(Map<String, ?> values) {
        engine.assign(this, values);
    }

    /** Updates fields from raw data keyed by load key, all or nothing. */
    public void update(Map<String, ?> raw) {
        engine.update(this, raw);
    }

    /** Updates fields from raw data with per-call options, such as an unknown-field override. */
    public void update(Map<String, ?> raw, LoadOptions options) {
        engine.update(this, raw, options);
    }

    public void update(JsonNode raw) {
        engine.update(this, SchemaEngine.requireMapping(type, raw));
    }

    // ── Dump ──

    public Map<String, Object> dump() {
        return engine.dump(this, DumpOptions.all());
    }

    public Map<String, Object> dump(DumpOptions options) {
        return engine.dump(this, options);
    }

    public ObjectNode dumpJson() {
        return engine.dumpJson(this, DumpOptions.all());
    }

    // ── State ──

    public boolean isPartial() {
        return allowed != null;
    }

    public boolean isInitialized() {
        return context.isInitialized();
    }

    /** Names of the accessible fields: the allow-list of a partial instance, else every field. */
    public Set<String> allowedFields() {
        return allowed != null ? allowed : type.fieldNames();
    }

    public boolean isAllowed(String name) {
        return allowed == null || allowed.contains(name);
    }

    /**
     * A new partial instance holding this instance's values of the {@code fields} it is allowed
     * to read. This instance is not modified.
     */
    public SchemaInstance restrictTo(Set<String> fields) {
        Set<String> narrowed = new LinkedHashSet<>();
        for (String name : fields) {
            if (isAllowed(name)) {
                narrowed.add(name);
            }
        }
        SchemaContext copyContext = context.copy(true);
        SchemaInstance copy = new SchemaInstance(engine, type, copyContext, narrowed);
        copyContext.attach(copy);
        values.forEach((name, value) -> {
            if (narrowed.contains(name)) {
                copy.values.put(name, value);
            }
        });
        if (context.isInitialized()) {
            copyContext.markInitialized();
        }
        return copy;
    }

    // ── Engine access ──

    boolean hasValue(String name) {
        return values.containsKey(name);
    }

    Object value(String name) {
        return values.get(name);
    }

    void store(String name, Object value) {
        values.put(name, value);
    }

    private void checkAccess(String name) {
        if (!type.hasField(name)) {
            throw new IllegalArgumentException("Schema '" + type.name() + "' has no field named '" + name + "'");
        }
        if (!isAllowed(name)) {
            throw new DisallowedFieldException(type.name(), name);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SchemaInstance that)) return false;
        return type == that.type && Objects.equals(allowed, that.allowed) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type.name(), allowed, values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.name()).append('(');
        boolean first = true;
        for (FieldDescriptor<?> field : type.fields()) {
            if (!values.containsKey(field.name())) {
                continue;
            }
            if (!first) {
                sb.append(", ");
            }
            sb.append(field.name()).append('=').append(values.get(field.name()));
            first = false;
        }
        return sb.append(')').toString();
    }
}
