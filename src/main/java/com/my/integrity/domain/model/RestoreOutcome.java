package com.my.integrity.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * 왜: 복구 결과를 감사 로그와 호출자에게 동일한 형태로 전달하기 위함.
 */
public record RestoreOutcome(
        RestoreStatus status,
        int snapshotVersion,
        String observedDigest,
        Duration elapsed,
        String detail
) {
    public RestoreOutcome {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(elapsed, "elapsed");
    }

    public boolean success() {
        return status == RestoreStatus.RESTORED;
    }
}
