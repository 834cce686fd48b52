package com.my.memory.domain.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 마크다운 파일 하나에서 추출한 그래프 조각. 구조 추출에 실패한 부분은 problems 에 남고 본문은 그대로 보존된다.
 */
public record ParsedDraft(
        String title,
        String entityType,
        String permalink,
        List<String> tags,
        Map<String, Object> frontmatter,
        boolean hasFrontmatter,
        String body,
        List<ObservationDraft> observations,
        List<RelationDraft> relations,
        List<String> problems
) {
    public ParsedDraft {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(body, "body");
        entityType = entityType == null || entityType.isBlank() ? Entity.DEFAULT_TYPE : entityType;
        tags = tags == null ? List.of() : List.copyOf(tags);
        frontmatter = frontmatter == null ? new LinkedHashMap<>() : new LinkedHashMap<>(frontmatter);
        observations = observations == null ? List.of() : List.copyOf(observations);
        relations = relations == null ? List.of() : List.copyOf(relations);
        problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public boolean isDegraded() {
        return !problems.isEmpty();
    }
}
