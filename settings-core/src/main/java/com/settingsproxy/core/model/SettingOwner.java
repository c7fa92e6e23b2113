package com.settingsproxy.core.model;

import com.settingsproxy.core.resolution.SettingsProxy;

import java.util.Collection;
import java.util.Optional;

/**
 * An entity that owns settings, e.g. an organizer or one of its events.
 *
 * @since 1.0.0
 */
public interface SettingOwner {

    /**
     * Enumerate the currently active setting records of this owner.
     *
     * <p>
     * Called at most once per {@link SettingsProxy} instance.
     * </p>
     *
     * @return current records; never {@code null}
     */
    Collection<? extends Setting> currentSettings();

    /**
     * @return the owner settings are inherited from, if any
     */
    Optional<SettingOwner> parent();

    /**
     * Return this owner's resolver. Implementations create it on first call and
     * hand out the same instance afterwards, so that children resolving through
     * this owner share its cache.
     *
     * @return the owner's settings proxy
     */
    SettingsProxy settings();
}
