package com.my.memory.domain.model;

import java.util.List;

/**
 * 컨텍스트 그래프의 노드. depth 0 은 시작 엔티티다.
 */
public record ContextNode(Entity entity, int depth, Long rootId, List<Observation> observations) {
    public ContextNode {
        observations = observations == null ? List.of() : List.copyOf(observations);
    }

    public long id() {
        return entity.id();
    }
}
