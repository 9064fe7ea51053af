package com.ryuqq.kvcache.core.spi;

import java.util.Optional;

/**
 * Key/value storage SPI shared by every cache implementation.
 *
 * <p>This interface is the only surface through which callers reach the cached
 * mapping. Implementations own the mapping exclusively and never hand out a
 * reference into it.</p>
 *
 * <p><strong>Consistency Contract:</strong></p>
 * <ul>
 *   <li>Every operation is atomic with respect to every other operation</li>
 *   <li>A reader observes either the previous or the new value of a key, never a mix</li>
 *   <li>Operations on the same key are linearizable; different keys carry no ordering guarantee</li>
 *   <li>No operation blocks other than on contention for the mapping</li>
 * </ul>
 *
 * <p><strong>Error Policy:</strong></p>
 * <ul>
 *   <li>{@link #add(String, String)} rejects an invalid key with
 *       {@link com.ryuqq.kvcache.core.exception.InvalidKeyException} and performs no mutation</li>
 *   <li>Read and remove paths treat an invalid key as absent</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods must be safely callable from multiple threads</li>
 *   <li>Critical sections must be released on every exit path, including faults</li>
 *   <li>No I/O or callbacks to external collaborators while the mapping is locked</li>
 * </ul>
 *
 * @author KvCache Team
 * @since 1.0.0
 */
public interface KeyValueStore {

    /**
     * Inserts or replaces the value for the given key.
     *
     * <p>Replacing an existing key is atomic: last writer wins under the
     * store's serialization order.</p>
     *
     * @param key the key (non-empty, within the configured maximum length)
     * @param value the value to store; any string, including the empty string
     * @throws com.ryuqq.kvcache.core.exception.InvalidKeyException if key is null, empty or too long
     * @throws IllegalArgumentException if value is null
     */
    void add(String key, String value);

    /**
     * Returns the current value for the given key.
     *
     * <p>An empty result means the key was never added, has been removed, or is
     * not a valid key. A stored empty string is returned as {@code Optional.of("")}.</p>
     *
     * @param key the key to look up
     * @return the stored value, or {@link Optional#empty()} if absent
     */
    Optional<String> get(String key);

    /**
     * Removes the entry for the given key.
     *
     * <p>Removing an absent or invalid key is a no-op, not an error.</p>
     *
     * @param key the key to remove
     */
    void remove(String key);

    /**
     * Checks whether an entry exists for the given key.
     *
     * @param key the key to check
     * @return true if the key currently has a value
     */
    boolean containsKey(String key);

    /**
     * Returns the number of entries currently stored.
     *
     * @return entry count
     */
    int size();

    /**
     * Removes every entry.
     */
    void clear();
}
