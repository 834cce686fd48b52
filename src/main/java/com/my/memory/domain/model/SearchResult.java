package com.my.memory.domain.model;

import java.time.Instant;

public record SearchResult(
        long entityId,
        String title,
        String permalink,
        String filePath,
        String entityType,
        double score,
        String snippet,
        Instant updatedAt
) {
}
