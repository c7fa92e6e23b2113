/**
 * Hierarchical settings resolution.
 *
 * <p>
 * {@link com.settingsproxy.core.resolution.SettingsProxy} is the per-owner
 * resolver and cache: local values, then the parent chain, then the built-in
 * defaults, then the caller's default.
 * {@link com.settingsproxy.core.resolution.SettingsSandbox} prefixes keys with
 * a namespace and delegates to an owner's proxy.
 * </p>
 *
 * @since 1.0.0
 */
package com.settingsproxy.core.resolution;
