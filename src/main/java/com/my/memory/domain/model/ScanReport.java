package com.my.memory.domain.model;

import java.util.List;
import java.util.Map;

/**
 * 전체 스캔 결과. 각 목록은 경로 순으로 정렬되어 있어 적용 순서가 결정적이다.
 */
public record ScanReport(
        List<ChangeEvent> moves,
        List<ChangeEvent> deletions,
        List<ChangeEvent> creations,
        List<ChangeEvent> modifications,
        Map<String, String> checksums,
        Map<String, String> errors
) {
    public ScanReport {
        moves = List.copyOf(moves);
        deletions = List.copyOf(deletions);
        creations = List.copyOf(creations);
        modifications = List.copyOf(modifications);
        checksums = Map.copyOf(checksums);
        errors = Map.copyOf(errors);
    }

    public int total() {
        return moves.size() + deletions.size() + creations.size() + modifications.size();
    }

    public boolean isEmpty() {
        return total() == 0;
    }
}
