package com.my.memory.domain.service;

import com.my.memory.domain.model.Entity;
import com.my.memory.domain.port.out.KnowledgeStorePort;

import java.util.Optional;

/**
 * permalink, 파일 경로, 제목 순으로 엔티티 참조를 찾는다.
 */
public class EntityLookup {

    private final KnowledgeStorePort store;

    public EntityLookup(KnowledgeStorePort store) {
        this.store = store;
    }

    public Optional<Entity> find(long projectId, String reference) {
        String ref = LinkText.normalize(reference);
        if (ref.isEmpty()) {
            return Optional.empty();
        }
        return store.findByPermalink(projectId, ref)
                .or(() -> store.findByFilePath(projectId, ref))
                .or(() -> store.findByFilePath(projectId, ref + ".md"))
                .or(() -> store.findByTitle(projectId, ref).stream().findFirst());
    }
}
