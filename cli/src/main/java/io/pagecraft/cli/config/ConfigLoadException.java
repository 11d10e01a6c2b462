package io.pagecraft.cli.config;

/**
 * The configuration could not be loaded. {@link #origin()} names where the bad value came from: the
 * YAML file, an environment variable, or {@code defaults} when no file was used.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String origin;

    public ConfigLoadException(String origin, String message) {
        super(message);
        this.origin = origin;
    }

    public ConfigLoadException(String origin, String message, Throwable cause) {
        super(message, cause);
        this.origin = origin;
    }

    public String origin() {
        return origin;
    }
}
