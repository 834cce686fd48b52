package com.my.memory.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * hasMore 는 primary 페이지 기준이다. relatedTruncated 는 maxRelated 에 걸려 이웃 탐색이 잘렸음을 뜻한다.
 */
public record GraphSnapshot(
        String uri,
        int depth,
        String timeframe,
        Instant generatedAt,
        List<ContextNode> primary,
        List<ContextNode> related,
        List<ContextEdge> edges,
        int page,
        int pageSize,
        boolean hasMore,
        boolean relatedTruncated
) {
    public GraphSnapshot {
        primary = List.copyOf(primary);
        related = List.copyOf(related);
        edges = List.copyOf(edges);
    }
}
