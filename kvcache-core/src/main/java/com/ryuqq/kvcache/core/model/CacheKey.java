package com.ryuqq.kvcache.core.model;

import com.ryuqq.kvcache.core.exception.InvalidKeyException;

/**
 * 캐시 엔트리의 키.
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~maxLength자 (기본 255자)</li>
 *   <li>내용 제약 없음 (공백 포함 허용)</li>
 * </ul>
 *
 * @author KvCache Team
 * @since 1.0.0
 */
public final class CacheKey {

    /**
     * 기본 최대 키 길이.
     */
    public static final int DEFAULT_MAX_LENGTH = 255;

    private final String value;

    private CacheKey(String value) {
        this.value = value;
    }

    /**
     * 기본 최대 길이로 CacheKey 생성.
     *
     * @param value 키 값
     * @return CacheKey 인스턴스
     * @throws InvalidKeyException 유효하지 않은 값인 경우
     */
    public static CacheKey of(String value) {
        return of(value, DEFAULT_MAX_LENGTH);
    }

    /**
     * 최대 길이를 지정하여 CacheKey 생성.
     *
     * @param value 키 값
     * @param maxLength 허용 최대 길이
     * @return CacheKey 인스턴스
     * @throws InvalidKeyException 유효하지 않은 값인 경우
     */
    public static CacheKey of(String value, int maxLength) {
        if (value == null) {
            throw new InvalidKeyException(null, "CacheKey cannot be null");
        }
        if (value.isEmpty()) {
            throw new InvalidKeyException(value, "CacheKey cannot be empty");
        }
        if (value.length() > maxLength) {
            throw new InvalidKeyException(value,
                "CacheKey length cannot exceed " + maxLength + " characters (current: " + value.length() + ")");
        }
        return new CacheKey(value);
    }

    /**
     * 예외 없이 키 유효성만 확인 (조회/삭제 경로용).
     *
     * @param value 키 값
     * @param maxLength 허용 최대 길이
     * @return 유효 여부
     */
    public static boolean isValid(String value, int maxLength) {
        return value != null && !value.isEmpty() && value.length() <= maxLength;
    }

    /**
     * 키 값 조회.
     *
     * @return 키 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CacheKey cacheKey = (CacheKey) o;
        return value.equals(cacheKey.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CacheKey{" + value + '}';
    }
}
