package com.my.memory.domain.model;

import java.util.Objects;

/**
 * 방향성과 유형을 가진 간선. toEntityId 가 null 이면 아직 대상이 없는 상태다.
 */
public record Relation(
        long id,
        long projectId,
        long fromEntityId,
        Long toEntityId,
        String targetTitle,
        String relationType,
        String context
) {
    public Relation {
        Objects.requireNonNull(targetTitle, "targetTitle");
        Objects.requireNonNull(relationType, "relationType");
    }

    public boolean isDangling() {
        return toEntityId == null;
    }
}
