package com.my.memory.domain.model;

import java.util.Objects;
import java.util.Set;

public record Observation(
        long id,
        long entityId,
        String category,
        String content,
        Set<String> tags,
        String context
) {
    public Observation {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(content, "content");
        tags = tags == null ? Set.of() : tags;
    }
}
