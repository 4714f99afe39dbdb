package com.my.integrity.domain.model;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * 왜: 스케줄러가 소유하는 감시 대상의 최소 계약을 불변 값으로 고정해 레지스트리 교체 방식으로만 갱신되도록 하기 위함.
 */
public record MonitoredContainer(
        String name,
        String displayName,
        int snapshotVersion,
        String baselineDigest,
        Duration pollInterval,
        MonitorPolicy policy,
        ContainerState state,
        OffsetDateTime lastCheckedAt
) {
    public MonitoredContainer {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(baselineDigest, "baselineDigest");
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(state, "state");
        if (snapshotVersion < 1) {
            throw new IllegalArgumentException("snapshotVersion은 1 이상이어야 합니다: " + snapshotVersion);
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval은 0보다 커야 합니다: " + pollInterval);
        }
    }

    public static MonitoredContainer watch(Snapshot snapshot, Duration pollInterval, MonitorPolicy policy) {
        return new MonitoredContainer(snapshot.container(), snapshot.container(), snapshot.version(),
                snapshot.digest(), pollInterval, policy, ContainerState.UNVERIFIED, null);
    }

    public MonitoredContainer withState(ContainerState next) {
        return new MonitoredContainer(name, displayName, snapshotVersion, baselineDigest, pollInterval, policy, next, lastCheckedAt);
    }

    public MonitoredContainer withBaseline(int version, String digest) {
        return new MonitoredContainer(name, displayName, version, digest, pollInterval, policy, state, lastCheckedAt);
    }

    public MonitoredContainer checkedAt(OffsetDateTime timestamp) {
        return new MonitoredContainer(name, displayName, snapshotVersion, baselineDigest, pollInterval, policy, state, timestamp);
    }
}
