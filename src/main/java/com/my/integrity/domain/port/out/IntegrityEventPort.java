package com.my.integrity.domain.port.out;

import com.my.integrity.domain.model.IntegrityEvent;

import java.util.List;

/**
 * 왜: 감사 기록을 추가 전용으로 남기고, 보고/경보 협력자가 최신 기록을 읽을 수 있게 하기 위함.
 */
public interface IntegrityEventPort {
    void append(IntegrityEvent event);

    /** 최신 기록이 마지막에 오도록 반환한다. */
    List<IntegrityEvent> recent(String container, int limit);
}
