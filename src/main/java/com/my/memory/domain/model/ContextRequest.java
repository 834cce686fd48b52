package com.my.memory.domain.model;

import java.util.Objects;

public record ContextRequest(
        String reference,
        String project,
        int depth,
        String timeframe,
        int maxRelated,
        PageRequest page
) {
    public static final int DEFAULT_DEPTH = 1;
    public static final int DEFAULT_MAX_RELATED = 10;

    public ContextRequest {
        Objects.requireNonNull(reference, "reference");
        if (depth < 0) {
            throw new IllegalArgumentException("depth 는 0 이상이어야 합니다.");
        }
        if (maxRelated < 0) {
            throw new IllegalArgumentException("maxRelated 는 0 이상이어야 합니다.");
        }
        page = page == null ? PageRequest.first() : page;
    }

    public static ContextRequest of(String reference, int depth) {
        return new ContextRequest(reference, null, depth, null, DEFAULT_MAX_RELATED, PageRequest.first());
    }
}
