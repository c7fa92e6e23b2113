package com.settingsproxy.core.serialization;

import com.settingsproxy.core.SettingsException;

/**
 * Raised when a stored value cannot be converted to the type a caller asked
 * for, e.g. {@code "abc"} requested as {@link Integer}.
 *
 * @since 1.0.0
 */
public class TypeCoercionException extends SettingsException {

    private static final long serialVersionUID = 1L;

    private final Class<?> targetType;

    public TypeCoercionException(Object value, Class<?> targetType, Throwable cause) {
        super("Cannot convert setting value '" + value + "' to "
                + targetType.getSimpleName(), cause);
        this.targetType = targetType;
    }

    public TypeCoercionException(String message, Class<?> targetType) {
        super(message);
        this.targetType = targetType;
    }

    /**
     * @return the type the caller requested
     */
    public Class<?> getTargetType() {
        return targetType;
    }
}
