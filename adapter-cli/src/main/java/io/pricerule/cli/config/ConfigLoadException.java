package io.pricerule.cli.config;

/**
 * Thrown when configuration loading fails: missing file, invalid YAML, or a value that is not
 * a positive integer or a known log format. The message is printed on startup.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
