package com.settingsproxy.core.model;

/**
 * A single persisted setting record belonging to exactly one owner.
 *
 * <p>
 * The value is always the serialized string form; typed values only exist at
 * the {@link com.settingsproxy.core.resolution.SettingsProxy} API boundary.
 * </p>
 *
 * @since 1.0.0
 */
public interface Setting {

    /**
     * @return the setting key, never {@code null}
     */
    String getKey();

    /**
     * @return the serialized value
     */
    String getValue();

    /**
     * Assign a new serialized value. Not persisted until {@link #save()}.
     *
     * @param value serialized value
     */
    void setValue(String value);

    /**
     * Create a new, unsaved record carrying this record's identity, so that a
     * change is stored as a new version instead of overwriting history.
     *
     * @return the copy
     */
    Setting copy();

    /**
     * Persist this record.
     */
    void save();

    /**
     * Remove this record from the owner's current settings.
     */
    void delete();
}
