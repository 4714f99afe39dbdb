package com.my.integrity.domain.model;

/**
 * 왜: 복구 중간 단계를 영속화해 프로세스가 중간에 죽어도 컨테이너가 정지된 채 방치되지 않도록 감지하기 위함.
 */
public enum RestorePhase {
    STOPPING,
    REPLACING,
    STARTING,
    VERIFYING,
    FAILED;

    public boolean isActive() {
        return this != FAILED;
    }
}
