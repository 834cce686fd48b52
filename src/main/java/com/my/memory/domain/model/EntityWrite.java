package com.my.memory.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 저장소의 단일 upsert 트랜잭션에 넘기는 엔티티 상태 전체.
 */
public record EntityWrite(
        String title,
        String permalink,
        String filePath,
        String entityType,
        String contentType,
        String checksum,
        Map<String, Object> frontmatter,
        String content,
        List<String> tags,
        List<ObservationDraft> observations,
        List<RelationDraft> relations,
        Instant modifiedAt
) {
    public EntityWrite {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(permalink, "permalink");
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(modifiedAt, "modifiedAt");
        frontmatter = frontmatter == null ? Map.of() : frontmatter;
        tags = tags == null ? List.of() : List.copyOf(tags);
        observations = observations == null ? List.of() : List.copyOf(observations);
        relations = relations == null ? List.of() : List.copyOf(relations);
    }
}
