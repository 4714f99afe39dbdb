package com.my.integrity.domain.exception;

/**
 * 왜: 읽지 못한 파일을 건너뛰면 그 자체가 변조 경로가 되므로, 해시 계산 전체를 중단시키기 위함.
 */
public class UnreadableEntryException extends IntegrityException {

    private final String path;

    public UnreadableEntryException(String path, Throwable cause) {
        super("파일 트리 항목을 읽을 수 없습니다: " + path, cause);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
