package com.my.memory.domain.model;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

public record ObservationDraft(String category, String content, Set<String> tags, String context) {

    public static final String DEFAULT_CATEGORY = "note";

    public ObservationDraft {
        Objects.requireNonNull(content, "content");
        category = category == null || category.isBlank() ? DEFAULT_CATEGORY : category;
        tags = tags == null ? Set.of() : new LinkedHashSet<>(tags);
    }
}
