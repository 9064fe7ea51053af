package com.ryuqq.kvcache.core.config;

import com.ryuqq.kvcache.core.model.CacheKey;

import java.util.Properties;

/**
 * KeyValueStore 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>initialCapacity: 내부 매핑의 초기 용량 (기본 16)</li>
 *   <li>maxKeyLength: 허용 최대 키 길이 (기본 255)</li>
 * </ul>
 *
 * <p><strong>프로퍼티 키:</strong></p>
 * <ul>
 *   <li>{@value #INITIAL_CAPACITY_PROPERTY}</li>
 *   <li>{@value #MAX_KEY_LENGTH_PROPERTY}</li>
 * </ul>
 *
 * @author KvCache Team
 * @since 1.0.0
 * @param initialCapacity 초기 용량 (양수여야 함)
 * @param maxKeyLength 최대 키 길이 (양수여야 함)
 */
public record StoreConfig(
    int initialCapacity,
    int maxKeyLength
) {

    public static final String INITIAL_CAPACITY_PROPERTY = "kvcache.store.initial-capacity";
    public static final String MAX_KEY_LENGTH_PROPERTY = "kvcache.store.max-key-length";

    private static final int DEFAULT_INITIAL_CAPACITY = 16;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: initialCapacity=16, maxKeyLength=255</p>
     */
    public StoreConfig() {
        this(DEFAULT_INITIAL_CAPACITY, CacheKey.DEFAULT_MAX_LENGTH);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public StoreConfig {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException(
                "initialCapacity must be positive (current: " + initialCapacity + ")"
            );
        }
        if (maxKeyLength <= 0) {
            throw new IllegalArgumentException(
                "maxKeyLength must be positive (current: " + maxKeyLength + ")"
            );
        }
    }

    /**
     * Properties에서 설정 로드. 누락된 항목은 기본값을 사용합니다.
     *
     * @param properties 설정 소스
     * @return StoreConfig 인스턴스
     * @throws IllegalArgumentException properties가 null이거나 값이 정수가 아닌 경우
     */
    public static StoreConfig fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        return new StoreConfig(
            intProperty(properties, INITIAL_CAPACITY_PROPERTY, DEFAULT_INITIAL_CAPACITY),
            intProperty(properties, MAX_KEY_LENGTH_PROPERTY, CacheKey.DEFAULT_MAX_LENGTH)
        );
    }

    private static int intProperty(Properties properties, String name, int defaultValue) {
        String raw = properties.getProperty(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer (current: " + raw + ")", e);
        }
    }

    /**
     * initialCapacity만 변경한 새 인스턴스 생성.
     */
    public StoreConfig withInitialCapacity(int initialCapacity) {
        return new StoreConfig(initialCapacity, maxKeyLength);
    }

    /**
     * maxKeyLength만 변경한 새 인스턴스 생성.
     */
    public StoreConfig withMaxKeyLength(int maxKeyLength) {
        return new StoreConfig(initialCapacity, maxKeyLength);
    }
}
