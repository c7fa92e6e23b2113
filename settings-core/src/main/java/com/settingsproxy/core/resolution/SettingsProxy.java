package com.settingsproxy.core.resolution;

import com.settingsproxy.core.HierarchyCycleException;
import com.settingsproxy.core.config.DefaultSettings;
import com.settingsproxy.core.model.Setting;
import com.settingsproxy.core.model.SettingFactory;
import com.settingsproxy.core.model.SettingOwner;
import com.settingsproxy.core.serialization.SettingValueCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Cached, typed access to the settings of one {@link SettingOwner}, including
 * inheritance from its parents and the built-in defaults.
 *
 * <h3>Resolution</h3>
 * <ol>
 * <li>A value set on this owner wins.</li>
 * <li>Otherwise the parent chain is walked; the first ancestor that has the
 * key supplies its stored string.</li>
 * <li>If no owner in the chain has the key, the {@link DefaultSettings}
 * table is consulted, then the caller's default.</li>
 * <li>If nothing matches the result is {@code null}.</li>
 * </ol>
 * <p>
 * The final value is converted with {@link SettingValueCodec#unserialize}.
 * </p>
 *
 * <h3>Cache</h3>
 * <p>
 * The owner's current settings are loaded once, on the first read or write,
 * and never refreshed afterwards. {@link #set} and {@link #delete} keep the
 * cache in step with the store. To observe changes made elsewhere, create a
 * new instance.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. Confine an instance to one
 * logical request or guard it externally.
 * </p>
 *
 * @since 1.0.0
 */
public class SettingsProxy {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsProxy.class);

    private final SettingOwner owner;
    private final SettingFactory factory;
    private final DefaultSettings defaults;

    private final Map<String, Setting> cache = new LinkedHashMap<>();
    private boolean loaded;

    /**
     * Create a proxy that falls back to the built-in defaults.
     *
     * @param owner   the owner whose settings are accessed
     * @param factory creates new records for this owner
     */
    public SettingsProxy(SettingOwner owner, SettingFactory factory) {
        this(owner, factory, DefaultSettings.builtIn());
    }

    /**
     * @param owner    the owner whose settings are accessed
     * @param factory  creates new records for this owner
     * @param defaults table consulted once the hierarchy is exhausted
     * @throws NullPointerException if any argument is {@code null}
     */
    public SettingsProxy(SettingOwner owner, SettingFactory factory, DefaultSettings defaults) {
        this.owner = Objects.requireNonNull(owner, "Owner must not be null");
        this.factory = Objects.requireNonNull(factory, "SettingFactory must not be null");
        this.defaults = Objects.requireNonNull(defaults, "DefaultSettings must not be null");
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    /**
     * @param key setting key
     * @return the resolved string value, or {@code null}
     */
    public String get(String key) {
        return get(key, null, String.class);
    }

    /**
     * @param key          setting key
     * @param defaultValue returned when nothing in the hierarchy or the default
     *                     table defines the key
     * @return the resolved string value
     */
    public String get(String key, String defaultValue) {
        return get(key, defaultValue, String.class);
    }

    /**
     * @param key  setting key
     * @param type requested type
     * @param <T>  requested type
     * @return the resolved value converted to {@code type}
     */
    public <T> T get(String key, Class<T> type) {
        return get(key, null, type);
    }

    /**
     * Resolve a setting.
     *
     * @param key          setting key; must not be {@code null}
     * @param defaultValue caller default, used only when neither the hierarchy
     *                     nor the default table has the key; may be a string or
     *                     a value of the requested type
     * @param type         requested type; must not be {@code null}
     * @param <T>          requested type
     * @return the converted value, {@code null} if absent everywhere
     * @throws com.settingsproxy.core.serialization.TypeCoercionException if the
     *         value cannot be converted to {@code type}
     * @throws HierarchyCycleException if the parent chain contains a cycle
     */
    public <T> T get(String key, Object defaultValue, Class<T> type) {
        Objects.requireNonNull(key, "Setting key must not be null");
        Objects.requireNonNull(type, "Requested type must not be null");

        Setting local = cache().get(key);
        if (local != null) {
            return SettingValueCodec.unserialize(local.getValue(), type);
        }

        String inherited = resolveInherited(key);
        if (inherited != null) {
            return SettingValueCodec.unserialize(inherited, type);
        }

        Optional<String> builtIn = defaults.get(key);
        if (builtIn.isPresent()) {
            LOG.trace("Setting '{}' resolved from default table", key);
            return SettingValueCodec.unserialize(builtIn.get(), type);
        }
        if (defaultValue != null) {
            return SettingValueCodec.unserialize(defaultValue, type);
        }
        return SettingValueCodec.unserialize(null, type);
    }

    /**
     * @param key setting key
     * @return whether the key is set on this owner, ignoring parents and defaults
     */
    public boolean contains(String key) {
        return cache().containsKey(key);
    }

    /**
     * @return unmodifiable snapshot of the keys set on this owner
     */
    public Set<String> keys() {
        return Set.copyOf(cache().keySet());
    }

    /**
     * @return whether the owner's settings have been loaded yet
     */
    public boolean isLoaded() {
        return loaded;
    }

    public SettingOwner getOwner() {
        return owner;
    }

    // ---------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------

    /**
     * Store a value on this owner.
     *
     * <p>
     * An existing record is copied so that the change becomes a new version;
     * otherwise a new record is created through the {@link SettingFactory}.
     * The cache is updated only after the record was saved.
     * </p>
     *
     * @param key   setting key; must not be blank
     * @param value the value; see {@link SettingValueCodec#serialize}
     * @throws com.settingsproxy.core.serialization.SerializationException if the
     *         value's type is unsupported; nothing is written in that case
     */
    public void set(String key, Object value) {
        requireValidKey(key);
        String serialized = SettingValueCodec.serialize(value);

        Setting existing = cache().get(key);
        Setting record = existing != null ? existing.copy() : factory.create(owner, key);
        record.setValue(serialized);
        record.save();
        cache.put(key, record);

        LOG.debug("Setting '{}' {} on {}", key, existing != null ? "updated" : "created", owner);
    }

    /**
     * Remove a value from this owner. Lookups then fall back to the parents and
     * defaults as if the key had never been set here. Unknown keys are ignored.
     *
     * @param key setting key
     */
    public void delete(String key) {
        Objects.requireNonNull(key, "Setting key must not be null");
        Setting existing = cache().get(key);
        if (existing == null) {
            return;
        }
        existing.delete();
        cache.remove(key);
        LOG.debug("Setting '{}' deleted on {}", key, owner);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Map<String, Setting> cache() {
        if (!loaded) {
            for (Setting setting : owner.currentSettings()) {
                cache.put(setting.getKey(), setting);
            }
            loaded = true;
            LOG.debug("Loaded {} setting(s) for {}", cache.size(), owner);
        }
        return cache;
    }

    /**
     * Walk the ancestors of this owner and return the first stored string for
     * {@code key}, or {@code null} if no ancestor has it.
     */
    private String resolveInherited(String key) {
        Set<SettingOwner> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        visited.add(owner);

        Optional<SettingOwner> current = owner.parent();
        while (current.isPresent()) {
            SettingOwner ancestor = current.get();
            if (!visited.add(ancestor)) {
                throw new HierarchyCycleException(key, ancestor);
            }
            SettingsProxy ancestorSettings = ancestor.settings();
            Setting found = ancestorSettings.cache().get(key);
            if (found != null) {
                LOG.trace("Setting '{}' inherited from {}", key, ancestor);
                return found.getValue();
            }
            current = ancestor.parent();
        }
        return null;
    }

    private static void requireValidKey(String key) {
        Objects.requireNonNull(key, "Setting key must not be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("Setting key must not be blank");
        }
    }

    @Override
    public String toString() {
        return "SettingsProxy{owner=" + owner + ", loaded=" + loaded + '}';
    }
}
