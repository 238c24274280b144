package io.datashape.core.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datashape.core.config.EngineConfig;
import io.datashape.core.error.DisallowedFieldException;
import io.datashape.core.error.FrozenFieldException;
import io.datashape.core.error.ValidationException;
import io.datashape.core.field.FieldDescriptor;
import io.datashape.core.field.FieldOutcome;
import io.datashape.core.field.LoadContext;
import io.datashape.core.model.ErrorCode;
import io.datashape.core.model.ErrorTree;
import io.datashape.core.model.FieldError;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs loads, updates and dumps of schema instances. Every operation walks the fields of the
 * schema type in declaration order and collects all errors into one {@link ErrorTree} before
 * deciding the outcome; a failed operation throws the exception produced by
 * {@link EngineConfig#exceptionFactory()}.
 *
 * <p>
 * Updates are transactional: new values are staged and written to the instance only after every
 * touched field passed, so a failed update (or one aborted by an exception from a validator or
 * field type) leaves the instance exactly as it was.
 *
 * <p>
 * Thread-safe: the engine holds only immutable configuration. The process-wide default engine
 * returned by {@link #global()} is held in an {@link AtomicReference} and replaced wholesale by
 * {@link #setGlobalConfig(EngineConfig)}.
 */
public final class SchemaEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaEngine.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> RAW_MAP = new TypeReference<>() {};

    private static final AtomicReference<SchemaEngine> GLOBAL =
            new AtomicReference<>(new SchemaEngine(EngineConfig.defaults()));

    /** Lifecycle of one load or update, logged at DEBUG. */
    public enum Phase {
        IDLE,
        PREPROCESSING,
        PER_FIELD_VALIDATION,
        COMMITTED,
        ROLLED_BACK
    }

    /**
     * Result of a nested load: exactly one of {@code instance} and a non-empty {@code errors} is
     * meaningful.
     */
    public record NestedLoad(SchemaInstance instance, ErrorTree errors) {
        public boolean isSuccess() {
            return instance != null;
        }
    }

    private final EngineConfig config;
    private final TypeExpressionValidator typeValidator;

    /**
     * Creates an engine bound to {@code config}.
     *
     * @param config exception factory, unknown-field fallback and warning settings; never null
     */
    public SchemaEngine(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.typeValidator = new TypeExpressionValidator(config.warnUnsupportedTypes());
    }

    /** The process-wide engine used by the shortcuts on {@link SchemaType}. */
    public static SchemaEngine global() {
        return GLOBAL.get();
    }

    /** Replaces the process-wide engine with one built from {@code config}. */
    public static void setGlobalConfig(EngineConfig config) {
        GLOBAL.set(new SchemaEngine(config));
        LOG.info("Global schema engine reconfigured: {}", config);
    }

    /** The configuration this engine was built with. */
    public EngineConfig config() {
        return config;
    }

    public TypeExpressionValidator typeValidator() {
        return typeValidator;
    }

    // ── Load ──

    /**
     * Loads {@code raw} into a new instance of {@code type} with default options.
     *
     * @param type the schema type to load
     * @param raw  raw values keyed by load key; not modified
     * @return the validated, initialized instance
     * @throws ValidationException (or the configured subclass) carrying every error found
     */
    public SchemaInstance load(SchemaType type, Map<String, ?> raw) {
        return load(type, raw, LoadOptions.defaults());
    }

    /**
     * Loads {@code raw} into a new instance of {@code type}. The preprocessor runs first, then
     * every field in declaration order; unknown keys are checked last. The afterLoad hook runs
     * only when no error was found.
     *
     * @param type    the schema type to load
     * @param raw     raw values keyed by load key; not modified
     * @param options unknown-field override and initial context state
     * @return the validated, initialized instance
     * @throws ValidationException (or the configured subclass) carrying every error found
     */
    public SchemaInstance load(SchemaType type, Map<String, ?> raw, LoadOptions options) {
        return unwrap(type, doLoad(type, raw, null, options));
    }

    /**
     * Loads a JSON object.
     *
     * @throws IllegalArgumentException if {@code raw} is not a JSON object
     */
    public SchemaInstance load(SchemaType type, JsonNode raw, LoadOptions options) {
        return load(type, requireMapping(type, raw), options);
    }

    /**
     * Loads a partial instance. Only the {@code allowed} fields are validated; raw keys naming
     * other declared fields are {@link ErrorCode#DISALLOWED_FIELD} errors.
     */
    public SchemaInstance loadPartial(SchemaType type, Map<String, ?> raw, Set<String> allowed, LoadOptions options) {
        Objects.requireNonNull(allowed, "allowed must not be null");
        return unwrap(type, doLoad(type, raw, allowed, options));
    }

    /**
     * Loads a nested value without throwing. Used by object and partial fields; the nested
     * instance gets a fresh context and the nested type's own unknown-field policy.
     *
     * @param allowed allow-list for a partial load, or {@code null}
     */
    public NestedLoad loadNested(SchemaType type, Map<String, ?> raw, Set<String> allowed) {
        return doLoad(type, raw, allowed, LoadOptions.defaults());
    }

    private NestedLoad doLoad(SchemaType type, Map<String, ?> raw, Set<String> allowed, LoadOptions options) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(raw, "raw must not be null");
        Objects.requireNonNull(options, "options must not be null");

        phase(type, Phase.IDLE);
        phase(type, Phase.PREPROCESSING);
        Map<String, Object> data = type.preprocess(new LinkedHashMap<>(raw));

        SchemaContext context = new SchemaContext(type, options.state(), allowed != null);
        SchemaInstance instance = new SchemaInstance(this, type, context, allowed);
        context.attach(instance);
        LoadContext loadContext = new LoadContext(this, context, true);

        phase(type, Phase.PER_FIELD_VALIDATION);
        ErrorTree.Builder errors = ErrorTree.builder(type.name());
        Set<String> consumed = new HashSet<>();
        for (FieldDescriptor<?> field : type.fields()) {
            String key = field.loadKey();
            boolean present = data.containsKey(key);
            if (present) {
                consumed.add(key);
            }
            if (!instance.isAllowed(field.name())) {
                if (present) {
                    errors.addFieldError(
                            field.name(), FieldError.of(ErrorCode.DISALLOWED_FIELD).withValue(data.get(key)));
                }
                continue;
            }
            FieldOutcome outcome = present ? field.load(data.get(key), loadContext) : field.loadAbsent(loadContext);
            record(field, outcome, instance, errors);
        }

        boolean ignoreExtra = ignoreExtra(type, options);
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (consumed.contains(entry.getKey())) {
                continue;
            }
            if (ignoreExtra) {
                LOG.debug("Ignoring unknown key: schema={}, key={}", type.name(), entry.getKey());
            } else {
                errors.addUnknownKey(entry.getKey(), FieldError.of(ErrorCode.UNKNOWN_FIELD).withValue(entry.getValue()));
            }
        }

        ErrorTree tree = errors.build();
        if (!tree.isEmpty()) {
            phase(type, Phase.ROLLED_BACK);
            LOG.debug("Load failed: schema={}, errors={}", type.name(), tree.errorCount());
            return new NestedLoad(null, tree);
        }
        context.markInitialized();
        phase(type, Phase.COMMITTED);
        type.afterLoad(instance);
        return new NestedLoad(instance, tree);
    }

    // ── Update ──

    /**
     * Updates {@code instance} from raw data keyed by load key, with default options.
     *
     * @see #update(SchemaInstance, Map, LoadOptions)
     */
    public void update(SchemaInstance instance, Map<String, ?> raw) {
        update(instance, raw, LoadOptions.defaults());
    }

    /**
     * Updates {@code instance} from raw data keyed by load key, all or nothing. Fields use their
     * {@code strictLoad} setting; disallowed keys are collected as errors, and so are unknown keys
     * unless the unknown-field policy resolved from {@code options} ignores them.
     *
     * @param instance the instance to change
     * @param raw      raw values keyed by load key
     * @param options  per-call overrides; {@link LoadOptions#state()} is not used, the instance
     *                 keeps its own context
     * @throws ValidationException   (or the configured subclass) when any field fails
     * @throws FrozenFieldException  when a key names a frozen field
     */
    public void update(SchemaInstance instance, Map<String, ?> raw, LoadOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        applyUpdate(instance, raw, true, options);
    }

    /**
     * Assigns fields of {@code instance} by field name. Fields use their {@code strictSet}
     * setting.
     *
     * @throws IllegalArgumentException if a name is not declared
     * @throws DisallowedFieldException if a name is outside a partial instance's allow-list
     */
    public void assign(SchemaInstance instance, Map<String, ?> values) {
        applyUpdate(instance, values, false, LoadOptions.defaults());
    }

    private void applyUpdate(SchemaInstance instance, Map<String, ?> data, boolean fromRawData, LoadOptions options) {
        Objects.requireNonNull(instance, "instance must not be null");
        Objects.requireNonNull(data, "data must not be null");
        SchemaType type = instance.type();
        phase(type, Phase.IDLE);
        ErrorTree.Builder errors = ErrorTree.builder(type.name());

        Map<FieldDescriptor<?>, Object> touched = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            String key = entry.getKey();
            FieldDescriptor<?> field = fromRawData ? type.fieldByLoadKey(key) : type.field(key);
            if (field == null) {
                if (!fromRawData) {
                    throw new IllegalArgumentException("Schema '" + type.name() + "' has no field named '" + key + "'");
                }
                if (!ignoreExtra(type, options)) {
                    errors.addUnknownKey(key, FieldError.of(ErrorCode.UNKNOWN_FIELD).withValue(entry.getValue()));
                }
                continue;
            }
            if (type.isFrozen() || field.isFrozen()) {
                throw new FrozenFieldException(type.name(), field.name());
            }
            if (!instance.isAllowed(field.name())) {
                if (!fromRawData) {
                    throw new DisallowedFieldException(type.name(), field.name());
                }
                errors.addFieldError(
                        field.name(), FieldError.of(ErrorCode.DISALLOWED_FIELD).withValue(entry.getValue()));
                continue;
            }
            touched.put(field, entry.getValue());
        }

        phase(type, Phase.PER_FIELD_VALIDATION);
        LoadContext loadContext = new LoadContext(this, instance.context(), fromRawData);
        Map<String, Object> staged = new LinkedHashMap<>();
        try {
            for (Map.Entry<FieldDescriptor<?>, Object> entry : touched.entrySet()) {
                FieldDescriptor<?> field = entry.getKey();
                FieldOutcome outcome = field.load(entry.getValue(), loadContext);
                if (outcome.hasValue()) {
                    staged.put(field.name(), outcome.value());
                } else {
                    recordErrors(field, outcome, errors);
                }
            }
        } catch (RuntimeException e) {
            phase(type, Phase.ROLLED_BACK);
            throw e;
        }

        ErrorTree tree = errors.build();
        if (!tree.isEmpty()) {
            phase(type, Phase.ROLLED_BACK);
            throw config.exceptionFactory().create(type.name(), tree);
        }
        staged.forEach(instance::store);
        phase(type, Phase.COMMITTED);
    }

    // ── Dump ──

    /**
     * Raw form of {@code instance}: every set, accessible field that passes {@code options},
     * keyed by dump key, in declaration order. Never validates.
     *
     * @param instance the instance to dump
     * @param options  field include/exclude filter
     * @return a new mutable map; nested instances are dumped recursively
     */
    public Map<String, Object> dump(SchemaInstance instance, DumpOptions options) {
        Objects.requireNonNull(instance, "instance must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Map<String, Object> out = new LinkedHashMap<>();
        for (FieldDescriptor<?> field : instance.type().fields()) {
            String name = field.name();
            if (!instance.isAllowed(name) || !options.accepts(name) || !instance.hasValue(name)) {
                continue;
            }
            out.put(field.dumpKey(), field.dump(instance.value(name), instance.context()));
        }
        return out;
    }

    /** {@link #dump} converted to a Jackson object node. */
    public ObjectNode dumpJson(SchemaInstance instance, DumpOptions options) {
        return MAPPER.valueToTree(dump(instance, options));
    }

    // ── Helpers ──

    /**
     * A mutable, string-keyed copy of a mapping value ({@link Map} or JSON object), or
     * {@code null} for anything else.
     */
    public static Map<String, Object> asRawMap(Object value) {
        if (value instanceof JsonNode node) {
            return node.isObject() ? MAPPER.convertValue(node, RAW_MAP) : null;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(String.valueOf(k), v));
            return out;
        }
        return null;
    }

    static Map<String, Object> requireMapping(SchemaType type, JsonNode raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        Map<String, Object> map = asRawMap(raw);
        if (map == null) {
            throw new IllegalArgumentException(
                    "Raw data for schema '" + type.name() + "' must be a JSON object, got " + raw.getNodeType());
        }
        return map;
    }

    private static void record(
            FieldDescriptor<?> field, FieldOutcome outcome, SchemaInstance instance, ErrorTree.Builder errors) {
        if (outcome.hasValue()) {
            instance.store(field.name(), outcome.value());
        } else {
            recordErrors(field, outcome, errors);
        }
    }

    private static void recordErrors(FieldDescriptor<?> field, FieldOutcome outcome, ErrorTree.Builder errors) {
        if (outcome.nestedErrors() != null) {
            errors.addNested(field.name(), outcome.nestedErrors());
        } else if (!outcome.errors().isEmpty()) {
            errors.addFieldErrors(field.name(), outcome.errors());
        }
    }

    private boolean ignoreExtra(SchemaType type, LoadOptions options) {
        if (options.ignoreExtra() != null) {
            return options.ignoreExtra();
        }
        if (type.ignoreExtra() != null) {
            return type.ignoreExtra();
        }
        return config.ignoreExtra();
    }

    private SchemaInstance unwrap(SchemaType type, NestedLoad result) {
        if (!result.isSuccess()) {
            throw config.exceptionFactory().create(type.name(), result.errors());
        }
        return result.instance();
    }

    private static void phase(SchemaType type, Phase phase) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("schema={}, phase={}", type.name(), phase);
        }
    }
}
