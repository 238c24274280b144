package io.datashape.core.engine;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-instance context shared by field types and validators while an instance is loaded and
 * updated. The {@link #state()} map is free-form and mutable: coercion steps may stash values in
 * it for later validators to read.
 *
 * <p>
 * Not thread-safe, like the instance that owns it.
 */
public final class SchemaContext {

    private final SchemaType schemaType;
    private final Map<String, Object> state;
    private final boolean partial;
    private boolean initialized;
    private SchemaInstance instance;

    SchemaContext(SchemaType schemaType, Map<String, ?> initialState, boolean partial) {
        this.schemaType = Objects.requireNonNull(schemaType, "schemaType must not be null");
        this.state = new HashMap<>(initialState);
        this.partial = partial;
    }

    public SchemaType schemaType() {
        return schemaType;
    }

    /** Mutable, free-form state. */
    public Map<String, Object> state() {
        return state;
    }

    public boolean isPartial() {
        return partial;
    }

    /** {@code true} once the owning instance has been fully loaded. */
    public boolean isInitialized() {
        return initialized;
    }

    /**
     * The instance this context belongs to. Set before the first field is loaded, so validators
     * may read fields already processed; {@code null} only for contexts built outside the engine.
     */
    public SchemaInstance instance() {
        return instance;
    }

    void attach(SchemaInstance instance) {
        this.instance = instance;
    }

    void markInitialized() {
        this.initialized = true;
    }

    /** A detached copy carrying the same state, for a derived instance. */
    SchemaContext copy(boolean partial) {
        return new SchemaContext(schemaType, state, partial);
    }
}
