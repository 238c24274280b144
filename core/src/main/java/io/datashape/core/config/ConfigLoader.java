package io.datashape.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.datashape.core.error.ConfigLoadException;
import io.datashape.core.error.ValidationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link EngineConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * engine:
 *   warn-unsupported-types: true
 *   ignore-extra: false
 *   exception-class: com.example.OrderValidationException
 * </pre>
 *
 * <p>
 * Every key is optional; missing keys keep the {@link EngineConfig.Builder} defaults. Env vars
 * take precedence over YAML values:
 * {@code DATASHAPE_WARN_UNSUPPORTED_TYPES}, {@code DATASHAPE_IGNORE_EXTRA} and
 * {@code DATASHAPE_EXCEPTION_CLASS}. An env var counts as set only if its trimmed value is
 * non-empty.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_WARN_UNSUPPORTED_TYPES = "DATASHAPE_WARN_UNSUPPORTED_TYPES";
    static final String ENV_IGNORE_EXTRA = "DATASHAPE_IGNORE_EXTRA";
    static final String ENV_EXCEPTION_CLASS = "DATASHAPE_EXCEPTION_CLASS";

    private ConfigLoader() {
        // utility class
    }

    /** Loads {@code configPath}, overlaying {@link System#getenv}. */
    public static EngineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads {@code configPath}, overlaying the variables returned by {@code envLookup}
     * ({@code null} meaning undefined).
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds an invalid
     *                             value
     */
    public static EngineConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        EngineConfig config = mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        LOG.info("Loaded engine configuration: path={}, config={}", configPath, config);
        return config;
    }

    private static EngineConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        EngineConfig.Builder builder = EngineConfig.builder();
        JsonNode engine = root.path("engine");

        if (engine.has("warn-unsupported-types")) {
            builder.warnUnsupportedTypes(requireBoolean(engine, "warn-unsupported-types"));
        }
        if (engine.has("ignore-extra")) {
            builder.ignoreExtra(requireBoolean(engine, "ignore-extra"));
        }
        if (engine.has("exception-class")) {
            builder.exceptionFactory(exceptionFactory(engine.get("exception-class").asText()));
        }

        envBool(envLookup, ENV_WARN_UNSUPPORTED_TYPES, builder::warnUnsupportedTypes);
        envBool(envLookup, ENV_IGNORE_EXTRA, builder::ignoreExtra);
        if (isSet(envLookup, ENV_EXCEPTION_CLASS)) {
            builder.exceptionFactory(exceptionFactory(envLookup.apply(ENV_EXCEPTION_CLASS).trim()));
        }
        return builder.build();
    }

    /** Resolves a {@link ValidationException} subclass by name into a factory. */
    static ValidationExceptionFactory exceptionFactory(String className) {
        Class<?> type;
        try {
            type = Class.forName(className, true, ConfigLoader.class.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new ConfigLoadException("Exception class not found: " + className, e);
        }
        if (!ValidationException.class.isAssignableFrom(type)) {
            throw new ConfigLoadException(
                    "Exception class " + className + " must be a subclass of " + ValidationException.class.getName());
        }
        return ValidationExceptionFactory.forClass(type.asSubclass(ValidationException.class));
    }

    // --- YAML helpers ---

    private static boolean requireBoolean(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        throw new ConfigLoadException("Configuration key 'engine." + field + "' must be a boolean, got: " + value);
    }

    // --- Env helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (!isSet(envLookup, envVar)) {
            return;
        }
        String value = envLookup.apply(envVar).trim().toLowerCase(Locale.ROOT);
        if (!value.equals("true") && !value.equals("false")) {
            throw new ConfigLoadException("Environment variable " + envVar + " must be true or false, got: " + value);
        }
        setter.accept(Boolean.parseBoolean(value));
    }
}
