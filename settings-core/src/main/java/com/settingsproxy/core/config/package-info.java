/**
 * Built-in default settings and their YAML configuration.
 *
 * <p>
 * {@link com.settingsproxy.core.config.DefaultSettingsLoader} reads
 * {@code default-settings.yml} into a
 * {@link com.settingsproxy.core.config.DefaultSettingsConfig}, validates it
 * and produces the immutable
 * {@link com.settingsproxy.core.config.DefaultSettings} table.
 * </p>
 *
 * @since 1.0.0
 */
package com.settingsproxy.core.config;
