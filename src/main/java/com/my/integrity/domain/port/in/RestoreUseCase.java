package com.my.integrity.domain.port.in;

import com.my.integrity.domain.model.RestoreOutcome;
import com.my.integrity.domain.model.Snapshot;

import java.util.List;
import java.util.OptionalInt;

/**
 * 왜: 운영자 명령(버전 지정 가능)과 스케줄러 자동 복구가 같은 복구 절차와 상호 배제 규칙을 공유하게 하기 위함.
 */
public interface RestoreUseCase {

    /**
     * @param version 비어 있으면 최신 스냅샷
     * @param force   비정상 종료로 남은 진행 중 기록을 무시한다
     */
    RestoreOutcome restore(String container, OptionalInt version, boolean force);

    /**
     * @param onClaimed 컨테이너 점유에 성공한 직후, 실제 작업 전에 호출된다. 거절되면 호출되지 않는다.
     */
    RestoreOutcome restore(String container, Snapshot snapshot, Runnable onClaimed);

    boolean isRestoring(String container);

    /** 중간 단계에 멈춘 복구 기록을 실패 보류로 바꾸고 그 목록을 반환한다. */
    List<String> recoverInterrupted();
}
