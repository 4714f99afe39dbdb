package com.my.integrity.domain.port.out;

import java.time.OffsetDateTime;

/**
 * 왜: 현재 시간을 주입형으로 분리하여 감사 기록의 시각과 경과 시간 계산을 테스트 가능하게 하기 위함.
 */
public interface ClockPort {
    OffsetDateTime now();
}
