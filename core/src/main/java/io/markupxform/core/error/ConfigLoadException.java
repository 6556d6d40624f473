package io.markupxform.core.error;

/**
 * Thrown when configuration cannot be loaded: a missing file, invalid YAML or an invalid value. Provides
 * a descriptive message suitable for startup error output.
 */
public final class ConfigLoadException extends ExpansionException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message, null, Phase.CONFIGURATION);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause, null, Phase.CONFIGURATION);
    }
}
