package io.feydor.inspo.config;

/**
 * Thrown when a settings file exists but cannot be read or understood
 */
public class SettingsException extends RuntimeException {
    public SettingsException(String message) {
        super(message);
    }

    public SettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
