package com.my.integrity.domain.model;

import java.util.Objects;

/**
 * 왜: 한 번의 무결성 점검 결과(기대/관측 다이제스트와 판정)를 스케줄러와 CLI가 같은 계약으로 받기 위함.
 */
public record CheckResult(
        String container,
        int snapshotVersion,
        String expectedDigest,
        String observedDigest,
        Verdict verdict
) {
    public CheckResult {
        Objects.requireNonNull(container, "container");
        Objects.requireNonNull(expectedDigest, "expectedDigest");
        Objects.requireNonNull(observedDigest, "observedDigest");
        Objects.requireNonNull(verdict, "verdict");
    }

    public boolean drifted() {
        return verdict == Verdict.DRIFT;
    }
}
