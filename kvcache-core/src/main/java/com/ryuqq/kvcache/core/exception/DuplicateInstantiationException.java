package com.ryuqq.kvcache.core.exception;

/**
 * 프로세스 단일 인스턴스 계약 위반.
 *
 * <p>레지스트리를 우회하여 두 번째 인스턴스를 만들려는 시도
 * (리플렉션을 통한 직접 생성, 역직렬화 등)에서 발생합니다.</p>
 *
 * <p>호출자 입력 오류가 아니라 프로그래밍 계약 위반이므로 복구 대상이 아닙니다.</p>
 *
 * @author KvCache Team
 * @since 1.0.0
 */
public class DuplicateInstantiationException extends IllegalStateException {

    /**
     * DuplicateInstantiationException 생성.
     *
     * @param type 중복 생성이 시도된 타입
     * @param message 위반 내용
     */
    public DuplicateInstantiationException(Class<?> type, String message) {
        super(type.getSimpleName() + ": " + message);
    }
}
