package com.ryuqq.kvcache.core.exception;

/**
 * 유효하지 않은 캐시 키로 쓰기를 시도했을 때 발생하는 예외.
 *
 * <p>호출자 입력 오류이므로 호출 단위로 복구 가능합니다.
 * 이 예외가 발생한 호출은 저장소를 변경하지 않습니다.</p>
 *
 * @author KvCache Team
 * @since 1.0.0
 */
public class InvalidKeyException extends IllegalArgumentException {

    private final String key;

    /**
     * InvalidKeyException 생성.
     *
     * @param key 거부된 키 (null 가능)
     * @param message 거부 사유
     */
    public InvalidKeyException(String key, String message) {
        super(message);
        this.key = key;
    }

    /**
     * 거부된 키 조회.
     *
     * @return 거부된 키 (null 가능)
     */
    public String getKey() {
        return key;
    }
}
