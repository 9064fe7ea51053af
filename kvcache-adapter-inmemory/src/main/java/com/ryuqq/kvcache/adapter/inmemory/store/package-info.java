/**
 * In-memory KeyValueStore adapter implementation package.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.kvcache.adapter.inmemory.store.ConcurrentKeyValueStore}:
 *       Lock-guarded implementation of {@link com.ryuqq.kvcache.core.spi.KeyValueStore}</li>
 * </ul>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Exclusion:</strong> one {@link java.util.concurrent.locks.ReentrantLock} per store
 *       serializes reads and writes</li>
 *   <li><strong>Ownership:</strong> the mapping never leaves the store</li>
 *   <li><strong>Isolation:</strong> stores are freely constructible, so tests use one per test</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>No eviction; entries live until removed or cleared</li>
 * </ul>
 *
 * @see com.ryuqq.kvcache.core.spi.KeyValueStore
 * @author KvCache Team
 * @since 1.0.0
 */
package com.ryuqq.kvcache.adapter.inmemory.store;
