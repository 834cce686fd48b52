package com.my.memory.adapter.out.clock;

import com.my.memory.domain.port.out.ClockPort;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * 왜: 시스템 시간을 주입형으로 제공해 최근성 필터 테스트를 고정 시각으로 돌릴 수 있게 하기 위함.
 */
public class SystemClockAdapter implements ClockPort {

    private final Clock clock;

    private SystemClockAdapter(Clock clock) {
        this.clock = clock;
    }

    public static SystemClockAdapter system() {
        return new SystemClockAdapter(Clock.systemUTC());
    }

    public static SystemClockAdapter fixed(Instant instant) {
        return new SystemClockAdapter(Clock.fixed(instant, ZoneOffset.UTC));
    }

    @Override
    public Instant now() {
        return clock.instant();
    }
}
