package io.pagecraft.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.LongConsumer;

/**
 * Loads {@link CliConfig} from a YAML file with an environment variable overlay.
 *
 * <p>Two invocation patterns:
 * <ul>
 * <li>Default: {@code pagecraft.yaml} in the current directory, if it exists; defaults otherwise</li>
 * <li>{@code --config /path/to/config.yaml}: the file must exist</li>
 * </ul>
 *
 * <p>Every key can be overridden by an environment variable, which takes precedence over the YAML
 * value. A variable is "set" if and only if it is defined AND its trimmed value is non-empty.
 *
 * <pre>
 * engine:
 *   evaluator: spel                # PAGECRAFT_EVALUATOR
 *   while-time-limit-ms: 2000      # PAGECRAFT_WHILE_TIME_LIMIT_MS
 * logging:
 *   format: text                   # PAGECRAFT_LOG_FORMAT
 *   level: WARN                    # PAGECRAFT_LOG_LEVEL
 * </pre>
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Configuration file looked up in the working directory when {@code --config} is absent. */
    public static final String DEFAULT_CONFIG_FILE = "pagecraft.yaml";

    static final String ENV_EVALUATOR = "PAGECRAFT_EVALUATOR";
    static final String ENV_WHILE_TIME_LIMIT_MS = "PAGECRAFT_WHILE_TIME_LIMIT_MS";
    static final String ENV_LOG_FORMAT = "PAGECRAFT_LOG_FORMAT";
    static final String ENV_LOG_LEVEL = "PAGECRAFT_LOG_LEVEL";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration from the given YAML file, applying overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static CliConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration from the given YAML file, applying overrides from the supplied
     * lookup function. Returning {@code null} from {@code envLookup} means the variable is not
     * defined.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static CliConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(configPath.toString(), "Configuration file not found: " + configPath);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException(
                    configPath.toString(), "Failed to parse YAML configuration: " + configPath, e);
        }
        return build(root, envLookup, configPath.toString());
    }

    /**
     * Loads {@code defaultPath} if it exists; otherwise starts from the defaults. Environment
     * overrides apply in both cases.
     *
     * @throws ConfigLoadException if the file exists but is invalid, or an override is invalid
     */
    public static CliConfig loadOptional(Path defaultPath, Function<String, String> envLookup) {
        if (Files.exists(defaultPath)) {
            return load(defaultPath, envLookup);
        }
        return build(null, envLookup, "defaults");
    }

    private static CliConfig build(JsonNode root, Function<String, String> envLookup, String origin) {
        CliConfig.Builder builder = CliConfig.builder();
        try {
            if (root != null && !root.isMissingNode() && !root.isNull()) {
                if (!root.isObject()) {
                    throw new ConfigLoadException(origin, "Configuration root must be a mapping: " + origin);
                }
                mapYaml(root, builder);
            }
            applyEnvOverrides(builder, envLookup);
            return builder.build();
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(origin, "Invalid configuration (" + origin + "): " + e.getMessage(), e);
        }
    }

    private static void mapYaml(JsonNode root, CliConfig.Builder builder) {
        JsonNode engine = root.path("engine");
        if (engine.has("evaluator")) builder.evaluator(engine.get("evaluator").asText());
        if (engine.has("while-time-limit-ms")) {
            JsonNode limit = engine.get("while-time-limit-ms");
            if (!limit.canConvertToLong()) {
                throw new IllegalArgumentException("engine.while-time-limit-ms must be an integer, got: " + limit);
            }
            builder.whileTimeLimitMs(limit.asLong());
        }

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
    }

    private static void applyEnvOverrides(CliConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, ENV_EVALUATOR, builder::evaluator);
        envLong(envLookup, ENV_WHILE_TIME_LIMIT_MS, builder::whileTimeLimitMs);
        envString(envLookup, ENV_LOG_FORMAT, builder::loggingFormat);
        envString(envLookup, ENV_LOG_LEVEL, builder::loggingLevel);
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envLong(Function<String, String> envLookup, String envVar, LongConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Long.parseLong(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar, envVar + " must be an integer, got: '" + value + "'", e);
            }
        }
    }
}
