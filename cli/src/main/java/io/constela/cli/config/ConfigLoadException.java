package io.constela.cli.config;

/**
 * Thrown when CLI configuration cannot be loaded: missing file, invalid YAML or an out-of-range
 * value. The message is printed as-is before the CLI exits.
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
