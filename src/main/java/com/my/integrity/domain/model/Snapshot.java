package com.my.integrity.domain.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/**
 * 왜: 기준선을 버전 단위의 불변 기록으로 남겨, 이후 기준선이 이전 기록을 덮어쓰지 않고 대체만 하도록 하기 위함.
 *
 * <p>{@code exclusions}와 {@code algorithm}은 다이제스트를 만든 정규화 규칙이다. 같은 스냅샷과 비교하는
 * 모든 재계산은 반드시 이 값을 사용한다.
 */
public record Snapshot(
        String container,
        int version,
        OffsetDateTime createdAt,
        String digest,
        String algorithm,
        List<String> exclusions,
        String archive,
        int entryCount
) {
    public Snapshot {
        Objects.requireNonNull(container, "container");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(digest, "digest");
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(archive, "archive");
        exclusions = List.copyOf(exclusions);
        if (version < 1) {
            throw new IllegalArgumentException("version은 1 이상이어야 합니다: " + version);
        }
    }
}
