package com.settingsproxy.core.serialization;

import com.settingsproxy.core.SettingsException;

/**
 * Raised when a value cannot be turned into the persisted string form of a
 * setting.
 *
 * @since 1.0.0
 */
public class SerializationException extends SettingsException {

    private static final long serialVersionUID = 1L;

    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
