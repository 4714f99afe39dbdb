package com.my.integrity.adapter.out.clock;

import com.my.integrity.domain.port.out.ClockPort;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * 왜: 시스템 시간을 주입형으로 제공해 감사 기록의 시간대를 설정으로 고정하고 테스트에서 시간을 고정할 수 있게 하기 위함.
 */
public class OffsetClockAdapter implements ClockPort {

    private final Clock clock;

    private OffsetClockAdapter(Clock clock) {
        this.clock = clock;
    }

    public static OffsetClockAdapter system(String zone) {
        return new OffsetClockAdapter(Clock.system(ZoneId.of(zone)));
    }

    public static OffsetClockAdapter fixed(Clock clock) {
        return new OffsetClockAdapter(clock);
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
