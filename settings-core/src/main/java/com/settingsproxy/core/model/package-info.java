/**
 * Contracts the settings engine expects from the persistence layer.
 *
 * <ul>
 * <li>{@link com.settingsproxy.core.model.SettingOwner}: an entity owning
 * settings, with an optional parent</li>
 * <li>{@link com.settingsproxy.core.model.Setting}: one stored key/value
 * record</li>
 * <li>{@link com.settingsproxy.core.model.SettingFactory}: creates records
 * scoped to an owner</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.settingsproxy.core.model;
