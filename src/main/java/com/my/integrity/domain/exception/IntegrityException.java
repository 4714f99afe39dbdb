package com.my.integrity.domain.exception;

/**
 * 왜: 무결성 엔진의 도메인 실패를 하나의 계층으로 묶어 CLI와 스케줄러가 종료 코드/상태로 일관되게 매핑하도록 하기 위함.
 */
public abstract class IntegrityException extends RuntimeException {

    protected IntegrityException(String message) {
        super(message);
    }

    protected IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
