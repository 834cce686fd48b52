package com.my.memory.domain.model;

public record ContextEdge(
        long relationId,
        long fromEntityId,
        Long toEntityId,
        String relationType,
        String targetTitle,
        String context
) {
    public static ContextEdge of(Relation relation) {
        return new ContextEdge(relation.id(), relation.fromEntityId(), relation.toEntityId(),
                relation.relationType(), relation.targetTitle(), relation.context());
    }
}
