package com.my.memory.domain.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 동기화와 저장소 호출마다 명시적으로 전달되는 프로젝트 핸들.
 */
public record ProjectScope(long projectId, String permalink, Path rootPath) {
    public ProjectScope {
        Objects.requireNonNull(permalink, "permalink");
        Objects.requireNonNull(rootPath, "rootPath");
    }

    public Path resolve(String relativePath) {
        return rootPath.resolve(relativePath);
    }
}
