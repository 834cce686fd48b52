package com.my.memory.domain.service;

import com.my.memory.domain.exception.CrossProjectReferenceException;
import com.my.memory.domain.model.ContextEdge;
import com.my.memory.domain.model.ContextNode;
import com.my.memory.domain.model.ContextRequest;
import com.my.memory.domain.model.Entity;
import com.my.memory.domain.model.GraphSnapshot;
import com.my.memory.domain.model.MemoryUrl;
import com.my.memory.domain.model.Observation;
import com.my.memory.domain.model.PageRequest;
import com.my.memory.domain.model.Project;
import com.my.memory.domain.model.Relation;
import com.my.memory.domain.port.in.BuildContextUseCase;
import com.my.memory.domain.port.out.ClockPort;
import com.my.memory.domain.port.out.KnowledgeStorePort;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 시작 엔티티에서 관계를 양방향으로 따라가며 depth 홉 이내의 이웃을 모은다.
 * 방문한 id 는 다시 펼치지 않으므로 순환이 있어도 끝난다.
 */
public class ContextTraversalService implements BuildContextUseCase {

    private final ProjectResolver projects;
    private final KnowledgeStorePort store;
    private final EntityLookup lookup;
    private final ClockPort clock;
    private final int maxDepth;

    public ContextTraversalService(ProjectResolver projects, KnowledgeStorePort store, ClockPort clock, int maxDepth) {
        this.projects = projects;
        this.store = store;
        this.lookup = new EntityLookup(store);
        this.clock = clock;
        this.maxDepth = maxDepth;
    }

    @Override
    public GraphSnapshot buildContext(ContextRequest request) {
        MemoryUrl url = MemoryUrl.parse(request.reference());
        if (url.project() != null && request.project() != null && !request.project().isBlank()
                && !Slugs.slugify(url.project()).equals(Slugs.slugify(request.project()))) {
            throw new CrossProjectReferenceException(
                    "참조의 프로젝트(" + url.project() + ")가 요청 프로젝트(" + request.project() + ")와 다릅니다.");
        }
        Project project = projects.resolve(url.project() != null ? url.project() : request.project());
        Instant now = clock.now();
        Instant since = TimeframeParser.since(request.timeframe(), now);
        PageRequest page = request.page();
        int depthLimit = Math.min(request.depth(), maxDepth);

        List<Entity> primaries;
        boolean hasMore = false;
        if (url.isPattern()) {
            primaries = store.findByPattern(project.id(), url.path(), page.pageSize() + 1, page.offset());
            if (primaries.size() > page.pageSize()) {
                hasMore = true;
                primaries = primaries.subList(0, page.pageSize());
            }
        } else {
            primaries = page.page() == 1
                    ? lookup.find(project.id(), url.path()).map(List::of).orElse(List.of())
                    : List.of();
        }

        Map<Long, List<Observation>> observations = store.observationsFor(
                primaries.stream().map(Entity::id).toList());
        List<ContextNode> primaryNodes = new ArrayList<>();
        Map<Long, Long> rootOf = new HashMap<>();
        for (Entity entity : primaries) {
            primaryNodes.add(new ContextNode(entity, 0, null, observations.getOrDefault(entity.id(), List.of())));
            rootOf.put(entity.id(), entity.id());
        }

        Set<Long> visited = new LinkedHashSet<>(rootOf.keySet());
        Set<Long> included = new LinkedHashSet<>(rootOf.keySet());
        Map<Long, Relation> relations = new LinkedHashMap<>();
        List<ContextNode> related = new ArrayList<>();
        List<Long> frontier = new ArrayList<>(rootOf.keySet());

        boolean relatedTruncated = false;
        for (int depth = 1; depth <= depthLimit && !frontier.isEmpty() && !relatedTruncated; depth++) {
            Set<Long> frontierSet = new LinkedHashSet<>(frontier);
            Map<Long, Long> candidates = new LinkedHashMap<>();
            for (Relation relation : store.relationsTouching(project.id(), frontier)) {
                relations.putIfAbsent(relation.id(), relation);
                if (frontierSet.contains(relation.fromEntityId())) {
                    offer(candidates, visited, relation.toEntityId(), rootOf.get(relation.fromEntityId()));
                }
                if (relation.toEntityId() != null && frontierSet.contains(relation.toEntityId())) {
                    offer(candidates, visited, relation.fromEntityId(), rootOf.get(relation.toEntityId()));
                }
            }
            Map<Long, Entity> entities = store.findByIds(project.id(), candidates.keySet()).stream()
                    .collect(Collectors.toMap(Entity::id, Function.identity()));
            List<Long> next = new ArrayList<>();
            for (Map.Entry<Long, Long> candidate : candidates.entrySet()) {
                Long id = candidate.getKey();
                visited.add(id);
                Entity entity = entities.get(id);
                if (entity == null || (since != null && entity.updatedAt().isBefore(since))) {
                    continue;
                }
                if (related.size() >= request.maxRelated()) {
                    relatedTruncated = true;
                    break;
                }
                rootOf.put(id, candidate.getValue());
                related.add(new ContextNode(entity, depth, candidate.getValue(), List.of()));
                included.add(id);
                next.add(id);
            }
            frontier = next;
        }

        List<ContextEdge> edges = relations.values().stream()
                .filter(relation -> included.contains(relation.fromEntityId())
                        && (relation.toEntityId() == null || included.contains(relation.toEntityId())))
                .map(ContextEdge::of)
                .toList();
        return new GraphSnapshot(url.toString(), depthLimit, request.timeframe(), now,
                primaryNodes, related, edges, page.page(), page.pageSize(), hasMore, relatedTruncated);
    }

    private static void offer(Map<Long, Long> candidates, Set<Long> visited, Long id, Long root) {
        if (id != null && !visited.contains(id)) {
            candidates.putIfAbsent(id, root);
        }
    }
}
