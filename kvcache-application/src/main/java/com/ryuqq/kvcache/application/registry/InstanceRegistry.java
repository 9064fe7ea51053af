package com.ryuqq.kvcache.application.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * 지연 생성되는 단일 인스턴스 보관소.
 *
 * <p>최초 {@link #get()} 호출 시 팩토리로 인스턴스를 한 번만 생성하고,
 * 이후 모든 호출에 같은 인스턴스를 반환합니다.</p>
 *
 * <p><strong>초기화 알고리즘 (Double-Checked Locking):</strong></p>
 * <pre>
 * get() 호출
 *   ↓
 * 1. volatile 읽기 → 생성 완료면 즉시 반환 (락 없음)
 *   ↓
 * 2. initLock 획득
 * 3. volatile 재확인 → 다른 스레드가 먼저 생성했으면 그 인스턴스 반환
 * 4. factory.get() 호출 → volatile 필드에 게시
 *   ↓
 * 5. initLock 해제
 * </pre>
 *
 * <p><strong>동시성 보장:</strong></p>
 * <ul>
 *   <li>동시 최초 호출에서도 팩토리는 한 번만 성공적으로 실행됨</li>
 *   <li>volatile 쓰기가 생성 완료 후에만 일어나므로 부분 생성된 인스턴스는 관측되지 않음</li>
 *   <li>초기화 이후 호출은 volatile 읽기 한 번으로 끝남</li>
 * </ul>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>팩토리 예외는 호출자에게 그대로 전파되며 인스턴스는 게시되지 않음</li>
 *   <li>팩토리가 null을 반환하면 IllegalStateException</li>
 * </ul>
 *
 * @param <T> 보관할 인스턴스 타입
 * @author KvCache Team
 * @since 1.0.0
 */
public final class InstanceRegistry<T> {

    private static final Logger log = LoggerFactory.getLogger(InstanceRegistry.class);

    private final String name;
    private final Supplier<? extends T> factory;
    private final Object initLock = new Object();

    private volatile T instance;

    /**
     * 생성자.
     *
     * @param name 로그 및 오류 메시지에 사용할 이름
     * @param factory 인스턴스 팩토리
     * @throws IllegalArgumentException name이 비어 있거나 factory가 null인 경우
     */
    public InstanceRegistry(String name, Supplier<? extends T> factory) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        this.name = name;
        this.factory = factory;
    }

    /**
     * 공유 인스턴스 조회 (필요 시 생성).
     *
     * @return 공유 인스턴스
     * @throws IllegalStateException 팩토리가 null을 반환한 경우
     * @throws RuntimeException 팩토리가 던진 예외 (그대로 전파)
     */
    public T get() {
        T result = instance;
        if (result != null) {
            return result;
        }

        synchronized (initLock) {
            result = instance;
            if (result == null) {
                log.debug("Initializing {}", name);
                result = factory.get();
                if (result == null) {
                    throw new IllegalStateException(name + " factory returned null");
                }
                instance = result;
                log.info("{} initialized", name);
            }
        }
        return result;
    }

    /**
     * 인스턴스 생성 여부 확인.
     *
     * @return 생성 완료 여부
     */
    public boolean isInitialized() {
        return instance != null;
    }

    @Override
    public String toString() {
        return "InstanceRegistry{" + name + ", initialized=" + isInitialized() + '}';
    }
}
