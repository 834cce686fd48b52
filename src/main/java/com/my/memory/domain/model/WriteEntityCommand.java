package com.my.memory.domain.model;

import com.my.memory.domain.exception.InvalidRequestException;

import java.util.List;
import java.util.Objects;

public record WriteEntityCommand(
        String title,
        String content,
        String folder,
        List<String> tags,
        String entityType,
        String project
) {
    public WriteEntityCommand {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(content, "content");
        if (title.isBlank()) {
            throw new InvalidRequestException("제목은 비어 있을 수 없습니다.");
        }
        folder = folder == null ? "" : folder;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
