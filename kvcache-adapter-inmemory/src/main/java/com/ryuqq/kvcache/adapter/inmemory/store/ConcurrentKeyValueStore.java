package com.ryuqq.kvcache.adapter.inmemory.store;

import com.ryuqq.kvcache.core.config.StoreConfig;
import com.ryuqq.kvcache.core.model.CacheKey;
import com.ryuqq.kvcache.core.spi.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of {@link KeyValueStore} guarded by a single lock.
 *
 * <p>All reads and writes go through one {@link ReentrantLock}, so every operation
 * observes the mapping either before or after any other operation, never in between.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>entries:</strong> HashMap&lt;String, String&gt; - Owned exclusively by this store, never exposed</li>
 *   <li><strong>lock:</strong> ReentrantLock - Process-wide critical section for the mapping</li>
 * </ul>
 *
 * <p><strong>Concurrency Discipline:</strong></p>
 * <ul>
 *   <li>Key validation runs before the lock is taken</li>
 *   <li>Lock is released in {@code finally}, on normal return and on any fault</li>
 *   <li>Each critical section is a single O(1) map operation</li>
 *   <li>Nothing is logged while the lock is held</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * KeyValueStore store = new ConcurrentKeyValueStore();
 * store.add("username", "john_doe");
 *
 * Optional&lt;String&gt; username = store.get("username"); // Optional[john_doe]
 * Optional&lt;String&gt; email = store.get("email");       // Optional.empty
 * </pre>
 *
 * @author KvCache Team
 * @since 1.0.0
 */
public class ConcurrentKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentKeyValueStore.class);

    private final Map<String, String> entries;
    private final ReentrantLock lock;
    private final int maxKeyLength;

    /**
     * Creates a new store with default configuration.
     */
    public ConcurrentKeyValueStore() {
        this(new StoreConfig());
    }

    /**
     * Creates a new store with the given configuration.
     *
     * @param config store configuration
     * @throws IllegalArgumentException if config is null
     */
    public ConcurrentKeyValueStore(StoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.entries = new HashMap<>(config.initialCapacity());
        this.lock = new ReentrantLock();
        this.maxKeyLength = config.maxKeyLength();
        log.debug("ConcurrentKeyValueStore created: initialCapacity={}, maxKeyLength={}",
            config.initialCapacity(), config.maxKeyLength());
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Validates key and value before acquiring the lock</li>
     *   <li>Single {@code put} inside the critical section</li>
     * </ul>
     */
    @Override
    public void add(String key, String value) {
        CacheKey cacheKey = CacheKey.of(key, maxKeyLength);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }

        lock.lock();
        try {
            entries.put(cacheKey.getValue(), value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<String> get(String key) {
        if (!CacheKey.isValid(key, maxKeyLength)) {
            return Optional.empty();
        }

        String value;
        lock.lock();
        try {
            value = entries.get(key);
        } finally {
            lock.unlock();
        }
        return Optional.ofNullable(value);
    }

    @Override
    public void remove(String key) {
        if (!CacheKey.isValid(key, maxKeyLength)) {
            return;
        }

        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean containsKey(String key) {
        if (!CacheKey.isValid(key, maxKeyLength)) {
            return false;
        }

        lock.lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Logs the number of removed entries after the lock is released.</p>
     */
    @Override
    public void clear() {
        int removed;
        lock.lock();
        try {
            removed = entries.size();
            entries.clear();
        } finally {
            lock.unlock();
        }
        log.info("ConcurrentKeyValueStore cleared: {} entries removed", removed);
    }
}
