package io.datashape.core.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call load options.
 *
 * @param ignoreExtra overrides the unknown-field policy of the schema type when non-null
 * @param state       initial content of the instance's context state
 */
public record LoadOptions(Boolean ignoreExtra, Map<String, Object> state) {

    private static final LoadOptions DEFAULTS = new LoadOptions(null, Map.of());

    public LoadOptions {
        state = state == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(state));
    }

    public static LoadOptions defaults() {
        return DEFAULTS;
    }

    public LoadOptions withIgnoreExtra(boolean ignoreExtra) {
        return new LoadOptions(ignoreExtra, state);
    }

    public LoadOptions withState(Map<String, Object> state) {
        return new LoadOptions(ignoreExtra, state);
    }
}
