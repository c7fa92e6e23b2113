package com.settingsproxy.core.model;

/**
 * Creates brand-new setting records scoped to an owner.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface SettingFactory {

    /**
     * @param owner the owner the record belongs to
     * @param key   the setting key
     * @return a new, unsaved record
     */
    Setting create(SettingOwner owner, String key);
}
