package com.settingsproxy.core;

/**
 * Base type for every error raised by the settings engine itself.
 *
 * <p>
 * Failures coming from the backing store are <strong>not</strong> wrapped;
 * they reach the caller unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public class SettingsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SettingsException(String message) {
        super(message);
    }

    public SettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
