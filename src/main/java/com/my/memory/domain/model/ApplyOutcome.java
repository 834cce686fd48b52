package com.my.memory.domain.model;

import java.util.List;

/**
 * 하나의 적용 단위(전체 스캔 또는 감시 배치)가 남긴 집계.
 */
public record ApplyOutcome(
        int created,
        int modified,
        int moved,
        int deleted,
        int unchanged,
        List<String> degraded,
        List<String> failed,
        boolean deferred
) {
    public ApplyOutcome {
        degraded = List.copyOf(degraded);
        failed = List.copyOf(failed);
    }

    public int total() {
        return created + modified + moved + deleted;
    }
}
