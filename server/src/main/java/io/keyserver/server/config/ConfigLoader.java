package io.keyserver.server.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ServerConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code keyserver-rest.yaml} from the current
 * directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * YAML layout:
 * <pre>{@code
 * server:
 *   host: 0.0.0.0
 *   port: 8080
 *   max-body-bytes: 1048576
 * health:
 *   enabled: true
 *   path: /health
 * logging:
 *   format: json
 *   level: INFO
 * }</pre>
 *
 * <p>
 * Every key can be overridden by an environment variable ({@code SERVER_HOST},
 * {@code SERVER_PORT}, {@code SERVER_MAX_BODY_BYTES}, {@code HEALTH_ENABLED},
 * {@code HEALTH_PATH}, {@code LOG_FORMAT}, {@code LOG_LEVEL}). An env var is
 * "set" only if it is defined AND its trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "keyserver-rest.yaml";

    /** Level names Logback accepts for the root logger. */
    static final List<String> LOG_LEVELS = List.of("ALL", "TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link ServerConfig} from the given YAML file path, applying
     * environment variable overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the validated configuration
     * @throws ConfigLoadException if the file is missing, contains invalid YAML
     *                             or holds invalid values
     */
    public static ServerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link ServerConfig} from the given YAML file path, applying
     * environment variable overrides from the supplied lookup function.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup; {@code null} means unset
     * @return the validated configuration
     * @throws ConfigLoadException if the file is missing, contains invalid YAML
     *                             or holds invalid values
     */
    public static ServerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = YAML_MAPPER.createObjectNode();
        } else if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }

        ServerConfig.Builder builder = ServerConfig.builder();
        applyYaml(builder, root);
        try {
            applyEnvOverrides(builder, envLookup);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Invalid numeric environment override: " + e.getMessage(), e);
        }
        ServerConfig config = builder.build();
        validate(config);
        return config;
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the resolved config file path
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static void applyYaml(ServerConfig.Builder builder, JsonNode root) {
        JsonNode server = root.path("server");
        if (server.has("host")) builder.host(server.get("host").asText());
        if (server.has("port")) builder.port(intValue(server, "server.port", "port"));
        if (server.has("max-body-bytes"))
            builder.maxBodyBytes(intValue(server, "server.max-body-bytes", "max-body-bytes"));

        JsonNode health = root.path("health");
        if (health.has("enabled")) builder.healthEnabled(health.get("enabled").asBoolean());
        if (health.has("path")) builder.healthPath(health.get("path").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
    }

    private static void applyEnvOverrides(ServerConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "SERVER_HOST", builder::host);
        envString(envLookup, "HEALTH_PATH", builder::healthPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        envInt(envLookup, "SERVER_PORT", builder::port);
        envInt(envLookup, "SERVER_MAX_BODY_BYTES", builder::maxBodyBytes);

        envBool(envLookup, "HEALTH_ENABLED", builder::healthEnabled);
    }

    /**
     * Rejects configurations the server cannot start with.
     *
     * @throws ConfigLoadException naming the offending key
     */
    static void validate(ServerConfig config) {
        if (config.port() < 0 || config.port() > 65535) {
            throw ConfigLoadException.invalidValue("server.port", "must be between 0 and 65535", config.port());
        }
        if (config.maxBodyBytes() <= 0) {
            throw ConfigLoadException.invalidValue("server.max-body-bytes", "must be positive", config.maxBodyBytes());
        }
        if (config.host() == null || config.host().isBlank()) {
            throw ConfigLoadException.invalidValue("server.host", "is required and must not be blank", config.host());
        }
        if (config.healthEnabled() && (config.healthPath() == null || !config.healthPath().startsWith("/"))) {
            throw ConfigLoadException.invalidValue("health.path", "must start with '/'", config.healthPath());
        }
        if (!"json".equalsIgnoreCase(config.loggingFormat()) && !"text".equalsIgnoreCase(config.loggingFormat())) {
            throw ConfigLoadException.invalidValue("logging.format", "must be 'json' or 'text'", config.loggingFormat());
        }
        if (config.loggingLevel() == null
                || !LOG_LEVELS.contains(config.loggingLevel().toUpperCase(Locale.ROOT))) {
            throw ConfigLoadException.invalidValue("logging.level", "must be one of " + LOG_LEVELS, config.loggingLevel());
        }
    }

    // --- YAML helpers ---

    private static int intValue(JsonNode section, String key, String field) {
        JsonNode value = section.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw ConfigLoadException.invalidValue(key, "must be an integer", value.asText());
        }
        return value.asInt();
    }

    // --- Env var helpers ---

    /**
     * Returns {@code true} if the env var is "set": defined AND non-blank after
     * trimming.
     */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies a string env var override if set. */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    /** Applies an integer env var override if set. */
    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Integer.parseInt(envLookup.apply(envVar).trim()));
        }
    }

    /** Applies a boolean env var override if set. */
    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
