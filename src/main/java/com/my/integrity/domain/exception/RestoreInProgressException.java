package com.my.integrity.domain.exception;

/**
 * 왜: 같은 컨테이너에 대한 복구는 대기열에 쌓지 않고 즉시 거절해야 하므로 호출자에게 명시적으로 알리기 위함.
 */
public class RestoreInProgressException extends IntegrityException {
    public RestoreInProgressException(String container) {
        super("이미 복구가 진행 중입니다: " + container);
    }
}
