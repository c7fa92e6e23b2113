package com.settingsproxy.core.resolution;

import com.settingsproxy.core.model.SettingOwner;

import java.util.Objects;

/**
 * Namespaced view on an owner's settings, e.g. the settings of one plugin.
 *
 * <p>
 * Every key is rewritten to {@code {type}_{key}_{item}} and the call is
 * handed to the owner's {@link SettingsProxy}; the sandbox keeps no state of
 * its own. A sandbox of type {@code "plugin"} and key {@code "foo"} stores
 * item {@code "bar"} under {@code "plugin_foo_bar"}.
 * </p>
 *
 * @since 1.0.0
 */
public class SettingsSandbox {

    private final String type;
    private final String key;
    private final SettingOwner owner;

    /**
     * @param type  namespace type, e.g. {@code "plugin"}
     * @param key   namespace key, e.g. the plugin identifier
     * @param owner owner whose settings back this view
     * @throws NullPointerException if any argument is {@code null}
     */
    public SettingsSandbox(String type, String key, SettingOwner owner) {
        this.type = Objects.requireNonNull(type, "Sandbox type must not be null");
        this.key = Objects.requireNonNull(key, "Sandbox key must not be null");
        this.owner = Objects.requireNonNull(owner, "Owner must not be null");
    }

    /**
     * @param item key inside the namespace
     * @return the resolved string value, or {@code null}
     */
    public String get(String item) {
        return get(item, null, String.class);
    }

    /**
     * @param item         key inside the namespace
     * @param defaultValue used when nothing in the hierarchy or the default
     *                     table defines the key
     * @return the resolved string value
     */
    public String get(String item, String defaultValue) {
        return get(item, defaultValue, String.class);
    }

    /**
     * @param item key inside the namespace
     * @param as   requested type
     * @param <T>  requested type
     * @return the resolved value converted to {@code as}
     */
    public <T> T get(String item, Class<T> as) {
        return get(item, null, as);
    }

    /**
     * Resolve {@code item} inside this namespace.
     *
     * @param item         key inside the namespace
     * @param defaultValue caller default, string or value of the requested type
     * @param as           requested type, forwarded unchanged to the proxy
     * @param <T>          requested type
     * @return the converted value, {@code null} if absent everywhere
     * @see SettingsProxy#get(String, Object, Class)
     */
    public <T> T get(String item, Object defaultValue, Class<T> as) {
        return owner.settings().get(convertKey(item), defaultValue, as);
    }

    /**
     * Store a value on the owner under the namespaced key.
     *
     * @param item  key inside the namespace
     * @param value the value; see {@link SettingsProxy#set(String, Object)}
     */
    public void set(String item, Object value) {
        owner.settings().set(convertKey(item), value);
    }

    /**
     * Remove the namespaced key from the owner; unknown keys are ignored.
     *
     * @param item key inside the namespace
     */
    public void delete(String item) {
        owner.settings().delete(convertKey(item));
    }

    /**
     * @param item key inside the namespace
     * @return whether the owner itself has the namespaced key
     */
    public boolean contains(String item) {
        return owner.settings().contains(convertKey(item));
    }

    /**
     * @param item key inside the namespace
     * @return the key as stored on the owner
     */
    public String convertKey(String item) {
        Objects.requireNonNull(item, "Setting key must not be null");
        return type + '_' + key + '_' + item;
    }

    @Override
    public String toString() {
        return "SettingsSandbox{type='" + type + "', key='" + key + "', owner=" + owner + '}';
    }
}
