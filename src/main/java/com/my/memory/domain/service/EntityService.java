package com.my.memory.domain.service;

import com.my.memory.domain.exception.CrossProjectReferenceException;
import com.my.memory.domain.exception.EntityNotFoundException;
import com.my.memory.domain.exception.InvalidRequestException;
import com.my.memory.domain.exception.StoreConsistencyException;
import com.my.memory.domain.model.Entity;
import com.my.memory.domain.model.EntityContent;
import com.my.memory.domain.model.MemoryUrl;
import com.my.memory.domain.model.Project;
import com.my.memory.domain.model.ProjectScope;
import com.my.memory.domain.model.WriteEntityCommand;
import com.my.memory.domain.model.WriteResult;
import com.my.memory.domain.policy.IgnorePolicy;
import com.my.memory.domain.port.in.ManageEntityUseCase;
import com.my.memory.domain.port.out.FilePort;
import com.my.memory.domain.port.out.KnowledgeStorePort;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 도구 계층의 노트 쓰기, 읽기, 이동, 삭제. 파일을 먼저 바꾸고 같은 워커에서 곧바로 색인한다.
 */
public class EntityService implements ManageEntityUseCase {

    private static final Logger log = Logger.getLogger(EntityService.class);

    private final ProjectResolver projects;
    private final KnowledgeStorePort store;
    private final FilePort files;
    private final SyncOrchestrator sync;
    private final FileIndexer indexer;
    private final PermalinkResolver permalinks;
    private final FrontmatterCodec codec;
    private final MarkdownWriter writer;
    private final EntityLookup lookup;

    public EntityService(ProjectResolver projects,
                         KnowledgeStorePort store,
                         FilePort files,
                         SyncOrchestrator sync,
                         FileIndexer indexer,
                         PermalinkResolver permalinks,
                         FrontmatterCodec codec,
                         MarkdownWriter writer) {
        this.projects = projects;
        this.store = store;
        this.files = files;
        this.sync = sync;
        this.indexer = indexer;
        this.permalinks = permalinks;
        this.codec = codec;
        this.writer = writer;
        this.lookup = new EntityLookup(store);
    }

    @Override
    public WriteResult writeEntity(WriteEntityCommand command) {
        Project project = projects.resolve(command.project());
        ProjectScope scope = project.scope();
        String folder = normalizePath(command.folder());
        String path = (folder.isEmpty() ? "" : folder + "/") + Slugs.fileName(command.title()) + ".md";
        if (!IgnorePolicy.shouldIndex(path)) {
            throw new InvalidRequestException("색인되지 않는 경로에는 쓸 수 없습니다: " + path);
        }
        return sync.execute(project, "write-entity", () -> {
            boolean created = store.findByFilePath(scope.projectId(), path).isEmpty();
            Map<String, Object> frontmatter = new LinkedHashMap<>();
            files.read(scope, path)
                    .map(bytes -> codec.decode(new String(bytes, StandardCharsets.UTF_8)).values())
                    .ifPresent(frontmatter::putAll);
            FrontmatterCodec.Decoded supplied = codec.decode(command.content());
            frontmatter.putAll(supplied.values());
            frontmatter.put("title", command.title());
            if (command.entityType() != null && !command.entityType().isBlank()) {
                frontmatter.put("type", command.entityType());
            } else {
                frontmatter.putIfAbsent("type", Entity.DEFAULT_TYPE);
            }
            if (!command.tags().isEmpty()) {
                frontmatter.put("tags", new ArrayList<>(command.tags()));
            }
            Object requested = frontmatter.get("permalink");
            String permalink = permalinks.resolve(scope, path, command.title(),
                    requested == null ? null : String.valueOf(requested));
            frontmatter.put("permalink", permalink);
            files.write(scope, path, writer.compose(frontmatter, supplied.body()));

            FileIndexer.IndexResult result = indexer.index(scope, path);
            if (result.entity() == null) {
                throw new StoreConsistencyException("방금 쓴 파일을 색인하지 못했습니다: " + path);
            }
            log.infof("노트 저장: project=%s, path=%s, permalink=%s, created=%s",
                    project.permalink(), path, result.entity().permalink(), created);
            return new WriteResult(result.entity(), result.entity().permalink(), created);
        });
    }

    @Override
    public EntityContent readEntity(String identifier, String project) {
        Target target = target(identifier, project);
        Entity entity = target.entity();
        if (!entity.isMarkdown()) {
            return new EntityContent(entity, Map.of(), "", null);
        }
        Optional<byte[]> content = files.read(target.project().scope(), entity.filePath());
        if (content.isEmpty()) {
            String body = entity.content() == null ? "" : entity.content();
            return new EntityContent(entity, entity.frontmatter(), body, null);
        }
        String raw = new String(content.get(), StandardCharsets.UTF_8);
        FrontmatterCodec.Decoded decoded = codec.decode(raw);
        return new EntityContent(entity, decoded.values(), decoded.body(), raw);
    }

    @Override
    public Entity moveEntity(String identifier, String destinationPath, String project) {
        Target target = target(identifier, project);
        ProjectScope scope = target.project().scope();
        String from = target.entity().filePath();
        String to = normalizePath(destinationPath);
        if (to.isEmpty()) {
            throw new InvalidRequestException("이동할 경로가 비어 있습니다.");
        }
        if (target.entity().isMarkdown() && !FileIndexer.isMarkdown(to)) {
            to = to + ".md";
        }
        if (to.equals(from)) {
            return target.entity();
        }
        if (!IgnorePolicy.shouldIndex(to)) {
            throw new InvalidRequestException("색인되지 않는 경로로는 옮길 수 없습니다: " + to);
        }
        if (files.exists(scope, to)) {
            throw new InvalidRequestException("대상 경로에 이미 파일이 있습니다: " + to);
        }
        String destination = to;
        return sync.execute(target.project(), "move-entity", () -> {
            files.move(scope, from, destination);
            Entity moved = indexer.move(scope, from, destination).entity();
            log.infof("노트 이동: project=%s, %s -> %s", target.project().permalink(), from, destination);
            return moved;
        });
    }

    @Override
    public boolean deleteEntity(String identifier, String project) {
        Target target;
        try {
            target = target(identifier, project);
        } catch (EntityNotFoundException e) {
            return false;
        }
        ProjectScope scope = target.project().scope();
        String path = target.entity().filePath();
        return sync.execute(target.project(), "delete-entity", () -> {
            files.delete(scope, path);
            int deleted = indexer.delete(scope, path);
            log.infof("노트 삭제: project=%s, path=%s", target.project().permalink(), path);
            return deleted > 0;
        });
    }

    private Target target(String identifier, String project) {
        MemoryUrl url = MemoryUrl.parse(identifier);
        if (url.project() != null && project != null && !project.isBlank()
                && !Slugs.slugify(project).equals(Slugs.slugify(url.project()))) {
            throw new CrossProjectReferenceException(
                    "참조의 프로젝트(" + url.project() + ")가 요청 프로젝트(" + project + ")와 다릅니다.");
        }
        Project resolved = projects.resolve(url.project() != null ? url.project() : project);
        Entity entity = lookup.find(resolved.id(), url.path())
                .orElseThrow(() -> new EntityNotFoundException(identifier));
        return new Target(resolved, entity);
    }

    /**
     * 프로젝트 루트 기준 상대 경로로 정리한다. 절대 경로와 ".." 는 거부한다.
     */
    static String normalizePath(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String value = raw.strip().replace('\\', '/');
        while (value.startsWith("/")) {
            value = value.substring(1);
        }
        List<String> segments = new ArrayList<>();
        for (String segment : value.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                throw new InvalidRequestException("상위 디렉터리 경로는 허용되지 않습니다: " + raw);
            }
            segments.add(segment);
        }
        return String.join("/", segments);
    }

    private record Target(Project project, Entity entity) {
    }
}
