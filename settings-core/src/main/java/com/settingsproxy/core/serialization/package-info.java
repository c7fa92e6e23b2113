/**
 * Conversion between typed setting values and their persisted string form.
 *
 * @since 1.0.0
 */
package com.settingsproxy.core.serialization;
