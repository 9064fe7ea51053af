/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the storage contract that adapter modules implement.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.kvcache.core.spi.KeyValueStore} - Thread-safe string key/value mapping</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., kvcache-adapter-inmemory) provide the concrete implementations.
 * Every implementation is expected to pass the contract tests in kvcache-testkit.</p>
 *
 * @since 1.0.0
 * @author KvCache Team
 */
package com.ryuqq.kvcache.core.spi;
