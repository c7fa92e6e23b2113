package com.settingsproxy.core;

/**
 * Raised when walking an owner's parent chain reaches an owner that was
 * already visited.
 *
 * @since 1.0.0
 */
public class HierarchyCycleException extends SettingsException {

    private static final long serialVersionUID = 1L;

    private final String key;

    public HierarchyCycleException(String key, Object owner) {
        super("Cycle in owner hierarchy while resolving setting '" + key
                + "': owner " + owner + " was visited twice");
        this.key = key;
    }

    /**
     * @return the setting key whose resolution hit the cycle
     */
    public String getKey() {
        return key;
    }
}
