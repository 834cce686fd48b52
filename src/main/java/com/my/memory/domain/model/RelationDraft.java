package com.my.memory.domain.model;

import java.util.Objects;

public record RelationDraft(String relationType, String targetTitle, String context) {

    public static final String DEFAULT_TYPE = "relates_to";
    public static final String INLINE_LINK_TYPE = "links to";

    public RelationDraft {
        Objects.requireNonNull(targetTitle, "targetTitle");
        relationType = relationType == null || relationType.isBlank() ? DEFAULT_TYPE : relationType;
    }
}
