package com.ryuqq.kvcache.testkit.contract;

import com.ryuqq.kvcache.core.exception.InvalidKeyException;
import com.ryuqq.kvcache.core.spi.KeyValueStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for {@link KeyValueStore} contract tests.
 *
 * <p>Every {@link KeyValueStore} implementation extends this class and supplies a
 * store through {@link #createStore()}. The inherited tests then validate the
 * consistency contract against that implementation.</p>
 *
 * <p><strong>Test Coverage:</strong></p>
 * <ul>
 *   <li>Example I/O: add then get, lookup of a key never added</li>
 *   <li>Absence: never-added, removed and invalid keys read as absent</li>
 *   <li>Idempotent overwrite and cross-thread visibility of the latest value</li>
 *   <li>Invalid-key rejection without mutation</li>
 *   <li>Same-key atomicity under concurrent writers</li>
 *   <li>Stress: 8 threads x 10,000 operations over 50 keys</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyStoreContractTest extends AbstractKeyValueStoreContractTest {
 *     {@literal @}Override
 *     protected KeyValueStore createStore() {
 *         return new MyStore();
 *     }
 * }
 * </pre>
 *
 * @author KvCache Team
 * @since 1.0.0
 */
public abstract class AbstractKeyValueStoreContractTest {

    protected KeyValueStore store;

    /**
     * Creates the store under test. Called before each test.
     *
     * @return an empty store
     */
    protected abstract KeyValueStore createStore();

    @BeforeEach
    protected void setUpStore() {
        store = createStore();
        assertNotNull(store, "createStore() must not return null");
    }

    /**
     * Clears the store after each test so shared instances do not leak state.
     */
    @AfterEach
    protected void tearDownStore() {
        if (store != null) {
            store.clear();
        }
    }

    @Test
    public void add_ThenGet_ReturnsStoredValue() {
        // When
        store.add("username", "john_doe");

        // Then
        assertEquals(Optional.of("john_doe"), store.get("username"));
    }

    @Test
    public void get_KeyNeverAdded_ReturnsEmpty() {
        // When
        Optional<String> email = store.get("email");

        // Then
        assertTrue(email.isEmpty(), "Never-added key should be absent");
    }

    @Test
    public void get_StoredEmptyString_IsDistinctFromAbsent() {
        // Given
        store.add("nickname", "");

        // When
        Optional<String> nickname = store.get("nickname");

        // Then
        assertTrue(nickname.isPresent(), "Stored empty string should be present");
        assertEquals("", nickname.get());
        assertTrue(store.get("surname").isEmpty());
    }

    @Test
    public void add_SameValueTwice_ThenNewValue_LatestValueVisible() throws Exception {
        // Given
        store.add("region", "eu-west");
        store.add("region", "eu-west");
        assertEquals(Optional.of("eu-west"), store.get("region"));
        assertEquals(1, store.size());

        // When
        store.add("region", "us-east");

        // Then: visible from this and another thread
        assertEquals(Optional.of("us-east"), store.get("region"));
        AtomicReference<Optional<String>> fromOtherThread = new AtomicReference<>();
        Thread reader = new Thread(() -> fromOtherThread.set(store.get("region")));
        reader.start();
        reader.join();
        assertEquals(Optional.of("us-east"), fromOtherThread.get());
    }

    @Test
    public void add_EmptyKey_ThrowsInvalidKeyAndLeavesStoreUnchanged() {
        // Given
        store.add("username", "john_doe");

        // When
        InvalidKeyException exception = assertThrows(InvalidKeyException.class, () -> store.add("", "x"));

        // Then
        assertEquals("", exception.getKey());
        assertTrue(store.get("").isEmpty());
        assertEquals(1, store.size());
        assertEquals(Optional.of("john_doe"), store.get("username"));
    }

    @Test
    public void add_NullKey_ThrowsInvalidKey() {
        assertThrows(InvalidKeyException.class, () -> store.add(null, "x"));
        assertEquals(0, store.size());
    }

    @Test
    public void add_KeyLongerThanDefaultLimit_ThrowsInvalidKey() {
        String key = "k".repeat(256);

        assertThrows(InvalidKeyException.class, () -> store.add(key, "x"));
        assertFalse(store.containsKey(key));
    }

    @Test
    public void add_NullValue_ThrowsIllegalArgumentException() {
        IllegalArgumentException exception =
            assertThrows(IllegalArgumentException.class, () -> store.add("username", null));

        assertTrue(exception.getMessage().contains("value cannot be null"));
        assertTrue(store.get("username").isEmpty());
    }

    @Test
    public void get_InvalidKey_ReturnsEmptyWithoutThrowing() {
        assertTrue(store.get(null).isEmpty());
        assertTrue(store.get("").isEmpty());
        assertTrue(store.get("k".repeat(256)).isEmpty());
    }

    @Test
    public void remove_ExistingKey_MakesKeyAbsent() {
        // Given
        store.add("session", "abc");

        // When
        store.remove("session");

        // Then
        assertTrue(store.get("session").isEmpty());
        assertFalse(store.containsKey("session"));
        assertEquals(0, store.size());
    }

    @Test
    public void remove_AbsentOrInvalidKey_IsNoOp() {
        // Given
        store.add("session", "abc");

        // When & Then
        assertDoesNotThrow(() -> store.remove("missing"));
        assertDoesNotThrow(() -> store.remove(""));
        assertDoesNotThrow(() -> store.remove(null));
        assertEquals(1, store.size());
    }

    @Test
    public void containsKey_ReflectsAddAndRemove() {
        assertFalse(store.containsKey("token"));

        store.add("token", "t-1");
        assertTrue(store.containsKey("token"));

        store.remove("token");
        assertFalse(store.containsKey("token"));
        assertFalse(store.containsKey(""));
    }

    @Test
    public void clear_RemovesAllEntries() {
        // Given
        store.add("a", "1");
        store.add("b", "2");

        // When
        store.clear();

        // Then
        assertEquals(0, store.size());
        assertTrue(store.get("a").isEmpty());
        assertTrue(store.get("b").isEmpty());
    }

    @Test
    public void concurrentWritersOnSameKey_ReaderOnlyObservesWrittenValues() throws Exception {
        // Given
        String key = "shared";
        String v1 = "value-one-" + "a".repeat(64);
        String v2 = "value-two-" + "b".repeat(64);
        int iterations = 5_000;
        ExecutorService pool = Executors.newFixedThreadPool(3);
        CountDownLatch startGate = new CountDownLatch(1);
        List<String> unexpected = new CopyOnWriteArrayList<>();
        List<Future<?>> futures = new ArrayList<>();

        try {
            // When
            futures.add(pool.submit(() -> {
                startGate.await();
                for (int i = 0; i < iterations; i++) {
                    store.add(key, v1);
                }
                return null;
            }));
            futures.add(pool.submit(() -> {
                startGate.await();
                for (int i = 0; i < iterations; i++) {
                    store.add(key, v2);
                }
                return null;
            }));
            futures.add(pool.submit(() -> {
                startGate.await();
                for (int i = 0; i < iterations; i++) {
                    store.get(key).ifPresent(observed -> {
                        if (!observed.equals(v1) && !observed.equals(v2)) {
                            unexpected.add(observed);
                        }
                    });
                }
                return null;
            }));
            startGate.countDown();

            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        // Then
        assertTrue(unexpected.isEmpty(), "Reader observed values never written: " + unexpected);
        String finalValue = store.get(key).orElseThrow();
        assertTrue(finalValue.equals(v1) || finalValue.equals(v2));
        assertEquals(1, store.size());
    }

    @Test
    public void stress_EightThreadsTenThousandOpsFiftyKeys_StaysConsistent() throws Exception {
        // Given
        ConcurrentWorkload workload = new ConcurrentWorkload(store, 8, 10_000, 50, 20240901L);

        // When
        ConcurrentWorkload.Result result = workload.run();

        // Then
        assertEquals(80_000, result.addCount() + result.getCount());
        assertTrue(result.readViolations().isEmpty(), "Read violations: " + result.readViolations());
        List<String> finalViolations = result.finalStateViolations(store);
        assertTrue(finalViolations.isEmpty(), "Final state violations: " + finalViolations);
    }
}
