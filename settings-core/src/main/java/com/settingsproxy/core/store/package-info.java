/**
 * In-memory, versioned implementation of the persistence contracts in
 * {@link com.settingsproxy.core.model}. Suitable for tests and for embedding
 * where durability is not required.
 *
 * @since 1.0.0
 */
package com.settingsproxy.core.store;
