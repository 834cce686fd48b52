package com.my.memory.domain.model;

import com.my.memory.domain.exception.InvalidMemoryUrlException;

import java.util.Objects;
import java.util.Set;

/**
 * memory://&lt;project-permalink&gt;/&lt;entity-permalink&gt; 형태의 엔티티 참조.
 * 프로젝트 부분이 없는 참조(permalink, 제목, 패턴)는 project 가 null 이다.
 */
public record MemoryUrl(String project, String path) {

    public static final String SCHEME = "memory://";
    private static final Set<Character> INVALID_CHARS = Set.of('<', '>', '"', '|', '?');

    public MemoryUrl {
        Objects.requireNonNull(path, "path");
    }

    public static MemoryUrl parse(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new InvalidMemoryUrlException("참조가 비어 있습니다.");
        }
        String trimmed = reference.trim();
        if (!trimmed.startsWith(SCHEME)) {
            validatePath(trimmed);
            return new MemoryUrl(null, trimmed);
        }
        String rest = trimmed.substring(SCHEME.length());
        int slash = rest.indexOf('/');
        if (slash <= 0 || slash == rest.length() - 1) {
            throw new InvalidMemoryUrlException("memory URL 에 프로젝트와 경로가 모두 필요합니다: " + reference);
        }
        String path = rest.substring(slash + 1);
        validatePath(path);
        return new MemoryUrl(rest.substring(0, slash), path);
    }

    public static MemoryUrl of(String project, String permalink) {
        return new MemoryUrl(project, permalink);
    }

    public boolean isPattern() {
        return path.contains("*");
    }

    @Override
    public String toString() {
        return project == null ? path : SCHEME + project + "/" + path;
    }

    private static void validatePath(String path) {
        if (path.contains("://")) {
            throw new InvalidMemoryUrlException("경로에 프로토콜이 포함될 수 없습니다: " + path);
        }
        if (path.contains("//")) {
            throw new InvalidMemoryUrlException("경로에 연속된 슬래시가 있습니다: " + path);
        }
        for (char c : path.toCharArray()) {
            if (INVALID_CHARS.contains(c)) {
                throw new InvalidMemoryUrlException("경로에 사용할 수 없는 문자가 있습니다: " + path);
            }
        }
    }
}
