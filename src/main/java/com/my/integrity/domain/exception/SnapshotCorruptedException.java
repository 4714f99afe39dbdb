package com.my.integrity.domain.exception;

/**
 * 왜: 기준선 아카이브를 읽을 수 없거나 기록된 다이제스트가 재현되지 않으면 재기준선 외에는 복구 방법이 없음을 알리기 위함.
 */
public class SnapshotCorruptedException extends IntegrityException {
    public SnapshotCorruptedException(String message) {
        super(message);
    }

    public SnapshotCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
