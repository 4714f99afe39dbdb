package com.my.integrity.domain.model;

import java.time.OffsetDateTime;
import java.util.Objects;

public record RestoreJournalEntry(
        String container,
        int snapshotVersion,
        RestorePhase phase,
        OffsetDateTime updatedAt,
        String detail
) {
    public RestoreJournalEntry {
        Objects.requireNonNull(container, "container");
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(updatedAt, "updatedAt");
    }

    /** 실패로 남은 기록은 운영자 조치 전까지 컨테이너를 RESTORE_FAILED에 고정한다. */
    public boolean isHold() {
        return phase == RestorePhase.FAILED;
    }
}
