package com.my.memory.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * 검색 조건. text 가 비어 있으면 최근 수정 순 목록이 된다.
 */
public record SearchQuery(
        String project,
        String text,
        List<String> entityTypes,
        List<String> tags,
        Instant after,
        String permalinkPattern
) {
    public SearchQuery {
        entityTypes = entityTypes == null ? List.of() : List.copyOf(entityTypes);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static SearchQuery text(String project, String text) {
        return new SearchQuery(project, text, List.of(), List.of(), null, null);
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
