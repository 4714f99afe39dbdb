package com.my.integrity.domain.exception;

/**
 * 왜: 컨테이너 런타임에 닿지 못한 경우(일시적 장애, 제한 시간 초과)를 다음 주기에 재시도할 실패로 구분하기 위함.
 */
public class RuntimeUnavailableException extends IntegrityException {
    public RuntimeUnavailableException(String message) {
        super(message);
    }

    public RuntimeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
