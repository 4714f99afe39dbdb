package com.my.integrity.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * 왜: 점검/복구/기준선 생성 결과를 추가 전용 감사 기록으로 남겨 오탐(제외 목록 불일치) 여부까지 사후 검토할 수 있게 하기 위함.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntegrityEvent(
        String container,
        OffsetDateTime timestamp,
        EventKind kind,
        Integer snapshotVersion,
        String expectedDigest,
        String observedDigest,
        Verdict verdict,
        RestoreStatus restoreOutcome,
        Long elapsedMillis,
        String error
) {
    public IntegrityEvent {
        Objects.requireNonNull(container, "container");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
    }

    public static IntegrityEvent baseline(Snapshot snapshot, long elapsedMillis) {
        return new IntegrityEvent(snapshot.container(), snapshot.createdAt(), EventKind.BASELINE, snapshot.version(),
                null, snapshot.digest(), null, null, elapsedMillis, null);
    }

    public static IntegrityEvent checked(CheckResult result, OffsetDateTime timestamp, long elapsedMillis) {
        return new IntegrityEvent(result.container(), timestamp, EventKind.CHECK, result.snapshotVersion(),
                result.expectedDigest(), result.observedDigest(), result.verdict(), null, elapsedMillis, null);
    }

    public static IntegrityEvent checkFailed(String container, Snapshot expected, OffsetDateTime timestamp,
                                             long elapsedMillis, String error) {
        return new IntegrityEvent(container, timestamp, EventKind.CHECK,
                expected == null ? null : expected.version(),
                expected == null ? null : expected.digest(),
                null, null, null, elapsedMillis, error);
    }

    public static IntegrityEvent restored(String container, String expectedDigest, RestoreOutcome outcome,
                                          OffsetDateTime timestamp) {
        return new IntegrityEvent(container, timestamp, EventKind.RESTORE, outcome.snapshotVersion(),
                expectedDigest, outcome.observedDigest(), null, outcome.status(),
                outcome.elapsed().toMillis(), outcome.success() ? null : outcome.detail());
    }
}
