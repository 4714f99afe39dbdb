package com.my.integrity.domain.exception;

/**
 * 왜: 외부 입력(컨테이너 이름, 버전 번호 등)이 계약을 위반했을 때 도메인 단계에서 명확히 실패를 알리기 위함.
 */
public class InvalidRequestException extends IntegrityException {
    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
