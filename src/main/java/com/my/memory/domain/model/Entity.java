package com.my.memory.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 하나의 원본 파일에 대응하는 그래프 노드.
 */
public record Entity(
        long id,
        long projectId,
        String title,
        String permalink,
        String filePath,
        String entityType,
        String contentType,
        String checksum,
        Map<String, Object> frontmatter,
        String content,
        List<String> tags,
        Instant createdAt,
        Instant updatedAt
) {
    public static final String DEFAULT_TYPE = "note";
    public static final String FILE_TYPE = "file";
    public static final String MARKDOWN_CONTENT_TYPE = "text/markdown";

    public Entity {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(permalink, "permalink");
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        frontmatter = frontmatter == null ? Map.of() : frontmatter;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public boolean isMarkdown() {
        return MARKDOWN_CONTENT_TYPE.equals(contentType);
    }
}
