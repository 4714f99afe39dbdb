package com.my.integrity.domain.exception;

public class SnapshotNotFoundException extends IntegrityException {

    public SnapshotNotFoundException(String container) {
        super("스냅샷이 없습니다: " + container);
    }

    public SnapshotNotFoundException(String container, int version) {
        super("스냅샷 버전이 없습니다: " + container + " v" + version);
    }
}
