package com.my.memory.domain.service;

import java.time.Duration;
import java.util.Objects;

/**
 * 동기화 동작을 조정하는 값. 설정 계층에서 만들어 도메인 서비스에 넘긴다.
 */
public record SyncSettings(
        boolean watchEnabled,
        Duration debounce,
        int queueCapacity,
        Duration maxScanDuration,
        boolean updatePermalinksOnMove,
        boolean writePermalinks
) {
    public SyncSettings {
        Objects.requireNonNull(debounce, "debounce");
        Objects.requireNonNull(maxScanDuration, "maxScanDuration");
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity 는 1 이상이어야 합니다.");
        }
    }

    public static SyncSettings defaults() {
        return new SyncSettings(true, Duration.ofMillis(1000), 256, Duration.ofMinutes(5), false, true);
    }

    /**
     * 0 이하면 스캔 시간 제한이 없다.
     */
    public boolean hasScanCeiling() {
        return !maxScanDuration.isZero() && !maxScanDuration.isNegative();
    }
}
