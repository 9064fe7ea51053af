package com.ryuqq.kvcache.testkit.contract;

import com.ryuqq.kvcache.core.spi.KeyValueStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mixed add/get workload run from several threads against one {@link KeyValueStore}.
 *
 * <p>Every written value is unique and encodes its writer: {@code t<thread>-<op>}.
 * Values are recorded in the written-values set <em>before</em> {@code add} is called,
 * so any value a concurrent reader can observe is already known.</p>
 *
 * <p>Each write is also logged as a {@link Write} with two ticks of one shared
 * sequence: {@code startSeq} taken just before {@code add} is invoked and
 * {@code endSeq} taken just after it returns. The sequence gives all writes a
 * single real-time order across threads.</p>
 *
 * <p><strong>Checks:</strong></p>
 * <ul>
 *   <li>During the run: every {@code get} returns absent or a value written for that key</li>
 *   <li>After the run: for every key, no write to that key (from any thread) started
 *       after the write of the final value returned. Such a write is ordered after the
 *       final value's write and must have replaced it, so its absence is a lost update</li>
 *   <li>After the run: keys that were never written are absent</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ConcurrentWorkload workload = new ConcurrentWorkload(store, 8, 10_000, 50, 42L);
 * ConcurrentWorkload.Result result = workload.run();
 *
 * assertTrue(result.readViolations().isEmpty());
 * assertTrue(result.finalStateViolations(store).isEmpty());
 * </pre>
 *
 * @author KvCache Team
 * @since 1.0.0
 */
public final class ConcurrentWorkload {

    private static final long TIMEOUT_SECONDS = 60;

    private final KeyValueStore store;
    private final int threadCount;
    private final int operationsPerThread;
    private final List<String> keys;
    private final long seed;

    /**
     * 생성자.
     *
     * @param store 대상 저장소
     * @param threadCount 동시 실행 스레드 수
     * @param operationsPerThread 스레드당 연산 수
     * @param keyCount 공유 키 개수
     * @param seed 난수 시드 (스레드별로 seed + threadIndex 사용)
     * @throws IllegalArgumentException 파라미터가 유효하지 않은 경우
     */
    public ConcurrentWorkload(KeyValueStore store, int threadCount, int operationsPerThread, int keyCount, long seed) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (threadCount <= 0 || operationsPerThread <= 0 || keyCount <= 0) {
            throw new IllegalArgumentException(
                "threadCount, operationsPerThread and keyCount must be positive");
        }
        this.store = store;
        this.threadCount = threadCount;
        this.operationsPerThread = operationsPerThread;
        this.seed = seed;

        List<String> generated = new ArrayList<>(keyCount);
        for (int i = 0; i < keyCount; i++) {
            generated.add("key-" + i);
        }
        this.keys = Collections.unmodifiableList(generated);
    }

    /**
     * Runs the workload and waits for every thread to finish.
     *
     * @return collected write log and read violations
     * @throws InterruptedException if interrupted while waiting
     * @throws IllegalStateException if a worker fails or the run times out
     */
    public Result run() throws InterruptedException {
        Map<String, Set<String>> writtenValues = new ConcurrentHashMap<>();
        for (String key : keys) {
            writtenValues.put(key, ConcurrentHashMap.newKeySet());
        }
        List<List<Write>> writesByThread = new ArrayList<>(threadCount);
        for (int t = 0; t < threadCount; t++) {
            writesByThread.add(new ArrayList<>());
        }
        AtomicLong sequence = new AtomicLong();
        List<String> readViolations = new CopyOnWriteArrayList<>();
        AtomicLong adds = new AtomicLong();
        AtomicLong gets = new AtomicLong();

        ExecutorService pool = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int t = 0; t < threadCount; t++) {
                int threadIndex = t;
                List<Write> writes = writesByThread.get(threadIndex);
                futures.add(pool.submit(() -> {
                    startGate.await();
                    Random random = new Random(seed + threadIndex);
                    for (int op = 0; op < operationsPerThread; op++) {
                        String key = keys.get(random.nextInt(keys.size()));
                        if (random.nextBoolean()) {
                            String value = "t" + threadIndex + "-" + op;
                            writtenValues.get(key).add(value);
                            long startSeq = sequence.incrementAndGet();
                            store.add(key, value);
                            long endSeq = sequence.incrementAndGet();
                            writes.add(new Write(key, value, threadIndex, startSeq, endSeq));
                            adds.incrementAndGet();
                        } else {
                            Optional<String> observed = store.get(key);
                            if (observed.isPresent() && !writtenValues.get(key).contains(observed.get())) {
                                readViolations.add(key + " returned never-written value " + observed.get());
                            }
                            gets.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }

            startGate.countDown();

            for (Future<?> future : futures) {
                future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            }
        } catch (ExecutionException e) {
            throw new IllegalStateException("Workload thread failed", e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("Workload did not finish within " + TIMEOUT_SECONDS + "s", e);
        } finally {
            pool.shutdownNow();
        }

        Map<String, List<Write>> writesByKey = new HashMap<>();
        for (String key : keys) {
            writesByKey.put(key, new ArrayList<>());
        }
        for (List<Write> writes : writesByThread) {
            for (Write write : writes) {
                writesByKey.get(write.key()).add(write);
            }
        }

        return new Result(keys, writtenValues, writesByKey, List.copyOf(readViolations), adds.get(), gets.get());
    }

    /**
     * 완료된 add 한 건의 기록.
     *
     * @param key 대상 키
     * @param value 기록한 값 (전체 실행에서 유일)
     * @param threadIndex 기록한 스레드
     * @param startSeq add 호출 직전의 공유 시퀀스
     * @param endSeq add 반환 직후의 공유 시퀀스
     */
    public record Write(String key, String value, int threadIndex, long startSeq, long endSeq) {
    }

    /**
     * Workload 실행 결과.
     *
     * @param keys 사용된 키 목록
     * @param writtenValues 키별 기록된 값 집합
     * @param writesByKey 키별 완료된 쓰기 기록
     * @param readViolations 실행 중 관측된 잘못된 읽기
     * @param addCount 수행된 add 횟수
     * @param getCount 수행된 get 횟수
     */
    public record Result(
        List<String> keys,
        Map<String, Set<String>> writtenValues,
        Map<String, List<Write>> writesByKey,
        List<String> readViolations,
        long addCount,
        long getCount
    ) {

        /**
         * Compares the store's final state against the write log.
         *
         * @param store the store the workload ran against
         * @return human-readable violations, empty when the final state is consistent
         */
        public List<String> finalStateViolations(KeyValueStore store) {
            List<String> violations = new ArrayList<>();
            for (String key : keys) {
                List<Write> writes = writesByKey.get(key);
                Optional<String> finalValue = store.get(key);
                if (writes.isEmpty()) {
                    finalValue.ifPresent(v -> violations.add(key + " was never written but holds " + v));
                    continue;
                }
                if (finalValue.isEmpty()) {
                    violations.add(key + " was written but is absent");
                    continue;
                }
                String value = finalValue.get();
                Write finalWrite = null;
                Write latestStarted = null;
                for (Write write : writes) {
                    if (write.value().equals(value)) {
                        finalWrite = write;
                    }
                    if (latestStarted == null || write.startSeq() > latestStarted.startSeq()) {
                        latestStarted = write;
                    }
                }
                if (finalWrite == null) {
                    violations.add(key + " holds unrecognized value " + value);
                    continue;
                }
                if (latestStarted.startSeq() > finalWrite.endSeq()) {
                    violations.add(key + " holds " + value + " (thread " + finalWrite.threadIndex()
                        + ", finished at " + finalWrite.endSeq() + ") but " + latestStarted.value()
                        + " (thread " + latestStarted.threadIndex() + ") started later at "
                        + latestStarted.startSeq());
                }
            }
            return violations;
        }
    }
}
