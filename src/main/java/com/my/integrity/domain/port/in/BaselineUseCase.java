package com.my.integrity.domain.port.in;

import com.my.integrity.domain.model.Snapshot;

import java.util.List;

/**
 * 왜: 기준선 생성과 조회를 단일 진입점으로 묶어 CLI와 스케줄러가 같은 규칙으로 스냅샷을 다루게 하기 위함.
 */
public interface BaselineUseCase {
    Snapshot createBaseline(String container, List<String> extraExclusions);
    Snapshot latest(String container);
    Snapshot version(String container, int version);
    List<Snapshot> history(String container);
}
