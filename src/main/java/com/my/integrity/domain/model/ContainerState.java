package com.my.integrity.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * 왜: 감시 대상 컨테이너의 상태 전이 규칙을 한 곳에 고정해 스케줄러가 임의로 상태를 바꾸지 못하게 하기 위함.
 */
public enum ContainerState {
    UNVERIFIED,
    CLEAN,
    DRIFTED,
    RESTORING,
    RESTORE_FAILED;

    public boolean canTransitionTo(ContainerState next) {
        return allowedNext().contains(next);
    }

    private Set<ContainerState> allowedNext() {
        return switch (this) {
            case UNVERIFIED -> EnumSet.of(CLEAN, DRIFTED);
            case CLEAN -> EnumSet.of(CLEAN, DRIFTED);
            case DRIFTED -> EnumSet.of(DRIFTED, CLEAN, RESTORING);
            case RESTORING -> EnumSet.of(CLEAN, RESTORE_FAILED);
            // 운영자 재시도(RESTORING) 또는 재기준선(UNVERIFIED)만 허용
            case RESTORE_FAILED -> EnumSet.of(RESTORING, UNVERIFIED);
        };
    }
}
