package com.settingsproxy.core.store;

import com.settingsproxy.core.config.DefaultSettings;
import com.settingsproxy.core.model.SettingOwner;
import com.settingsproxy.core.resolution.SettingsProxy;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * Named {@link SettingOwner} whose settings live in an
 * {@link InMemorySettingStore}.
 *
 * @since 1.0.0
 */
public class InMemoryOwner implements SettingOwner {

    private final String name;
    private final InMemorySettingStore store;
    private final DefaultSettings defaults;
    private SettingOwner parent;
    private SettingsProxy settings;

    public InMemoryOwner(String name, InMemorySettingStore store) {
        this(name, null, store, DefaultSettings.builtIn());
    }

    public InMemoryOwner(String name, SettingOwner parent, InMemorySettingStore store) {
        this(name, parent, store, DefaultSettings.builtIn());
    }

    /**
     * @param name     display name
     * @param parent   owner to inherit from; may be {@code null}
     * @param store    backing store
     * @param defaults table used by this owner's proxy
     */
    public InMemoryOwner(String name, SettingOwner parent, InMemorySettingStore store,
                         DefaultSettings defaults) {
        this.name = Objects.requireNonNull(name, "Owner name must not be null");
        this.parent = parent;
        this.store = Objects.requireNonNull(store, "Store must not be null");
        this.defaults = Objects.requireNonNull(defaults, "DefaultSettings must not be null");
    }

    @Override
    public Collection<StoredSetting> currentSettings() {
        return store.current(this);
    }

    @Override
    public Optional<SettingOwner> parent() {
        return Optional.ofNullable(parent);
    }

    public void setParent(SettingOwner parent) {
        this.parent = parent;
    }

    @Override
    public SettingsProxy settings() {
        if (settings == null) {
            settings = new SettingsProxy(this, store::newSetting, defaults);
        }
        return settings;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "InMemoryOwner{" + name + '}';
    }
}
