package com.my.memory.domain.port.out;

import java.time.Instant;

/**
 * 현재 시각을 주입형으로 분리해 최근성 필터와 테스트를 단순화한다.
 */
public interface ClockPort {
    Instant now();
}
