package com.my.integrity.domain.port.out;

import com.my.integrity.domain.model.RestoreJournalEntry;
import com.my.integrity.domain.model.RestorePhase;

import java.util.List;
import java.util.Optional;

/**
 * 왜: 정지-교체-재시작 사이의 중간 상태를 영속화해, 프로세스가 죽었을 때 컨테이너가 정지된 채 방치된 것을 감지하기 위함.
 */
public interface RestoreJournalPort {
    void record(String container, int snapshotVersion, RestorePhase phase, String detail);
    Optional<RestoreJournalEntry> find(String container);
    List<RestoreJournalEntry> findAll();
    void clear(String container);
}
