package io.keyserver.server.config;

import java.util.Optional;

/**
 * The server configuration could not be loaded or is unusable.
 *
 * <p>
 * Validation failures name the dotted YAML key they concern (for example
 * {@code server.port}), so startup output can point at the line to fix. File
 * and parse failures carry no key.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String key;

    public ConfigLoadException(String message) {
        this(null, message, null);
    }

    public ConfigLoadException(String message, Throwable cause) {
        this(null, message, cause);
    }

    private ConfigLoadException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /**
     * A value that was read but cannot be used.
     *
     * @param key         dotted YAML key, e.g. {@code logging.level}
     * @param requirement what the value must satisfy, e.g. {@code must be positive}
     * @param value       the rejected value as configured
     */
    public static ConfigLoadException invalidValue(String key, String requirement, Object value) {
        return new ConfigLoadException(key, key + " " + requirement + ", got '" + value + "'", null);
    }

    /** The YAML key of the rejected value, empty for file and parse failures. */
    public Optional<String> key() {
        return Optional.ofNullable(key);
    }
}
