package com.settingsproxy.core.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only table of built-in setting defaults, consulted only after a lookup
 * has exhausted the whole owner hierarchy.
 *
 * <p>
 * {@link #builtIn()} is the process-wide table, loaded once through
 * {@link DefaultSettingsLoader#load()}. Other tables can be built with
 * {@link #of(Map)}, mostly for tests.
 * </p>
 *
 * @since 1.0.0
 */
public final class DefaultSettings {

    private static final DefaultSettings EMPTY = new DefaultSettings(Map.of());

    private final Map<String, String> values;

    private DefaultSettings(Map<String, String> values) {
        this.values = values;
    }

    /**
     * @return the process-wide built-in table
     */
    public static DefaultSettings builtIn() {
        return BuiltInHolder.INSTANCE;
    }

    /**
     * @return a table without entries
     */
    public static DefaultSettings empty() {
        return EMPTY;
    }

    /**
     * Build a table from the given entries (copied; insertion order kept).
     *
     * @param values key to serialized default value; must not be {@code null}
     * @return immutable table
     * @throws NullPointerException if the map or any key or value is {@code null}
     */
    public static DefaultSettings of(Map<String, String> values) {
        Objects.requireNonNull(values, "Default values must not be null");
        Map<String, String> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> copy.put(
                Objects.requireNonNull(key, "Default key must not be null"),
                Objects.requireNonNull(value, "Default value for '" + key + "' must not be null")));
        return new DefaultSettings(Collections.unmodifiableMap(copy));
    }

    /**
     * @param key setting key
     * @return the serialized default, or empty if the key has none
     */
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    /**
     * @return unmodifiable view of every entry
     */
    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "DefaultSettings" + values;
    }

    private static final class BuiltInHolder {
        private static final DefaultSettings INSTANCE = DefaultSettingsLoader.load();
    }
}
