package com.my.memory.domain.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * 서로 격리된 지식 그래프 네임스페이스. 모든 엔티티, 관찰, 관계는 하나의 프로젝트에 속한다.
 */
public record Project(
        long id,
        String name,
        String permalink,
        Path rootPath,
        boolean isDefault,
        Instant createdAt
) {
    public Project {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(permalink, "permalink");
        Objects.requireNonNull(rootPath, "rootPath");
        Objects.requireNonNull(createdAt, "createdAt");
        if (name.isBlank()) {
            throw new IllegalArgumentException("프로젝트 이름은 비어 있을 수 없습니다.");
        }
    }

    public ProjectScope scope() {
        return new ProjectScope(id, permalink, rootPath);
    }
}
