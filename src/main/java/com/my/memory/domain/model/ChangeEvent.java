package com.my.memory.domain.model;

import java.util.Objects;

/**
 * 경로 단위 변경. MOVED 인 경우에만 previousPath 가 채워진다.
 */
public record ChangeEvent(String path, ChangeKind kind, String previousPath) {
    public ChangeEvent {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        if (kind == ChangeKind.MOVED && previousPath == null) {
            throw new IllegalArgumentException("이동 이벤트에는 이전 경로가 필요합니다.");
        }
    }

    public static ChangeEvent created(String path) {
        return new ChangeEvent(path, ChangeKind.CREATED, null);
    }

    public static ChangeEvent modified(String path) {
        return new ChangeEvent(path, ChangeKind.MODIFIED, null);
    }

    public static ChangeEvent deleted(String path) {
        return new ChangeEvent(path, ChangeKind.DELETED, null);
    }

    public static ChangeEvent moved(String from, String to) {
        return new ChangeEvent(to, ChangeKind.MOVED, from);
    }
}
