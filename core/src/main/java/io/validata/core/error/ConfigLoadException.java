package io.validata.core.error;

/**
 * Thrown when validator configuration loading fails: missing file, invalid YAML or an
 * out-of-range value.
 */
public final class ConfigLoadException extends ValidationException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message, null, Phase.CONFIGURATION);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause, null, Phase.CONFIGURATION);
    }
}
