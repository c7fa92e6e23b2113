package com.settingsproxy.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-level POJO for the default settings YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * defaults:
 *   max_items_per_order: "10"
 *   attendee_names_asked: "True"
 * </pre>
 *
 * <p>
 * Values must be strings; quote numbers and booleans in the YAML so they
 * reach the table in their persisted form. Call {@link #validate()} after
 * loading.
 * </p>
 *
 * @since 1.0.0
 */
public class DefaultSettingsConfig {

    private Map<String, Object> defaults = new LinkedHashMap<>();

    /**
     * @return unmodifiable view of the configured defaults
     */
    public Map<String, Object> getDefaults() {
        return Collections.unmodifiableMap(defaults);
    }

    /**
     * Set the defaults (used by SnakeYAML during deserialization).
     *
     * @param defaults key to default value
     */
    public void setDefaults(Map<String, Object> defaults) {
        this.defaults = defaults != null ? new LinkedHashMap<>(defaults) : new LinkedHashMap<>();
    }

    /**
     * Validate every entry: keys must be non-blank, values non-null strings.
     * All problems are collected into a single exception.
     *
     * @throws IllegalStateException if one or more entries are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        defaults.forEach((key, value) -> {
            if (key == null || key.isBlank()) {
                errors.add("Default setting key must not be blank");
            } else if (value == null) {
                errors.add("Default setting '" + key + "' has no value");
            } else if (!(value instanceof String)) {
                errors.add("Default setting '" + key + "' must be a string, got "
                        + value.getClass().getSimpleName() + " (quote it in YAML)");
            }
        });

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Default settings validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * Convert to a {@link DefaultSettings} table. Validates first.
     *
     * @return immutable default table
     * @throws IllegalStateException if validation fails
     */
    public DefaultSettings toDefaultSettings() {
        validate();
        Map<String, String> values = new LinkedHashMap<>();
        defaults.forEach((key, value) -> values.put(key, (String) value));
        return DefaultSettings.of(values);
    }

    @Override
    public String toString() {
        return "DefaultSettingsConfig{defaults=" + defaults + '}';
    }
}
