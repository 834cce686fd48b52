package com.my.memory.domain.service;

import com.my.memory.domain.model.Entity;
import com.my.memory.domain.model.ProjectScope;
import com.my.memory.domain.port.out.KnowledgeStorePort;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * 프로젝트 안에서 유일한 permalink 를 정한다.
 * 우선순위는 다른 파일이 쓰지 않는 frontmatter 값, 같은 경로의 기존 값, 제목에서 만든 새 슬러그 순이다.
 */
public class PermalinkResolver {

    private static final Logger log = Logger.getLogger(PermalinkResolver.class);

    private final KnowledgeStorePort store;

    public PermalinkResolver(KnowledgeStorePort store) {
        this.store = store;
    }

    public String resolve(ProjectScope scope, String filePath, String title, String requestedPermalink) {
        if (requestedPermalink != null && !requestedPermalink.isBlank()) {
            String requested = normalizeRequested(requestedPermalink);
            if (!requested.isEmpty()) {
                Optional<Entity> owner = store.findByPermalink(scope.projectId(), requested);
                if (owner.isEmpty() || owner.get().filePath().equals(filePath)) {
                    return requested;
                }
                log.warnf("permalink 충돌: project=%s, permalink=%s, owner=%s, path=%s",
                        scope.permalink(), requested, owner.get().filePath(), filePath);
            }
        }
        Optional<Entity> existing = store.findByFilePath(scope.projectId(), filePath);
        if (existing.isPresent()) {
            return existing.get().permalink();
        }
        return unique(scope, filePath, null, Slugs.slugOrFallback(title, filePath));
    }

    /**
     * 파일 이동 후 permalink 를 다시 만든다. selfId 엔티티가 이미 가진 값은 충돌로 보지 않는다.
     */
    public String regenerate(ProjectScope scope, long selfId, String filePath, String title) {
        return unique(scope, filePath, selfId, Slugs.slugOrFallback(title, filePath));
    }

    private String unique(ProjectScope scope, String filePath, Long selfId, String base) {
        String candidate = base;
        int suffix = 1;
        while (true) {
            Optional<Entity> owner = store.findByPermalink(scope.projectId(), candidate);
            if (owner.isEmpty()
                    || owner.get().filePath().equals(filePath)
                    || (selfId != null && owner.get().id() == selfId)) {
                return candidate;
            }
            candidate = base + "-" + suffix++;
        }
    }

    private static String normalizeRequested(String permalink) {
        String value = permalink.strip();
        while (value.startsWith("/")) {
            value = value.substring(1);
        }
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
