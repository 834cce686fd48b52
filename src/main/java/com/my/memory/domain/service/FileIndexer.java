package com.my.memory.domain.service;

import com.my.memory.domain.model.Entity;
import com.my.memory.domain.model.EntityWrite;
import com.my.memory.domain.model.ParsedDraft;
import com.my.memory.domain.model.ProjectScope;
import com.my.memory.domain.port.out.FilePort;
import com.my.memory.domain.port.out.KnowledgeStorePort;
import org.jboss.logging.Logger;

import java.net.URLConnection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 파일 하나의 생성, 수정, 이동, 삭제를 저장소에 반영한다. 항상 프로젝트 워커 스레드에서 호출된다.
 */
public class FileIndexer {

    private static final Logger log = Logger.getLogger(FileIndexer.class);
    private static final String BINARY_TYPE = "application/octet-stream";
    private static final int DELETE_BATCH = 500;

    private final FilePort files;
    private final KnowledgeStorePort store;
    private final MarkdownKnowledgeParser parser;
    private final MarkdownWriter writer;
    private final PermalinkResolver permalinks;
    private final SyncSettings settings;

    public FileIndexer(FilePort files,
                       KnowledgeStorePort store,
                       MarkdownKnowledgeParser parser,
                       MarkdownWriter writer,
                       PermalinkResolver permalinks,
                       SyncSettings settings) {
        this.files = files;
        this.store = store;
        this.parser = parser;
        this.writer = writer;
        this.permalinks = permalinks;
        this.settings = settings;
    }

    public static boolean isMarkdown(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        return lower.endsWith(".md") || lower.endsWith(".markdown");
    }

    /**
     * 파일 내용이 저장된 checksum 과 같으면 아무것도 쓰지 않는다.
     */
    public IndexResult index(ProjectScope scope, String path) {
        Optional<byte[]> content = files.read(scope, path);
        if (content.isEmpty()) {
            return new IndexResult(path, null, IndexKind.VANISHED, List.of());
        }
        byte[] bytes = content.get();
        String checksum = Checksums.sha256(bytes);
        Optional<Entity> existing = store.findByFilePath(scope.projectId(), path);
        if (existing.isPresent() && checksum.equals(existing.get().checksum())) {
            return new IndexResult(path, existing.get(), IndexKind.UNCHANGED, List.of());
        }
        Instant modifiedAt = files.modifiedAt(scope, path);
        List<String> problems = new ArrayList<>();
        EntityWrite write = isMarkdown(path)
                ? markdownWrite(scope, path, bytes, checksum, modifiedAt, problems)
                : fileWrite(scope, path, checksum, modifiedAt);
        Entity entity = store.upsertEntity(scope.projectId(), write);
        if (!problems.isEmpty()) {
            log.warnf("구조 추출 일부 실패: project=%s, path=%s, problems=%s", scope.permalink(), path, problems);
        }
        return new IndexResult(path, entity, existing.isPresent() ? IndexKind.MODIFIED : IndexKind.CREATED, problems);
    }

    /**
     * 엔티티 id, 관찰, 관계를 그대로 둔 채 경로만 바꾼다. 원래 경로를 모르면 새 파일로 색인한다.
     */
    public IndexResult move(ProjectScope scope, String from, String to) {
        Optional<Entity> source = store.findByFilePath(scope.projectId(), from);
        if (source.isEmpty()) {
            return index(scope, to);
        }
        Entity entity = source.get();
        store.findByFilePath(scope.projectId(), to).ifPresent(stale -> {
            log.warnf("이동 대상 경로에 남아 있던 엔티티를 지웁니다: project=%s, path=%s", scope.permalink(), to);
            store.deleteEntity(scope.projectId(), stale.id());
        });
        String newPermalink = null;
        String newChecksum = null;
        if (settings.updatePermalinksOnMove() && entity.isMarkdown()) {
            Optional<byte[]> content = files.read(scope, to);
            if (content.isPresent()) {
                ParsedDraft draft = parser.parse(content.get(), to);
                newPermalink = permalinks.regenerate(scope, entity.id(), to, draft.title());
                newChecksum = writePermalink(scope, to, draft, newPermalink);
            }
        }
        Entity moved = store.moveEntity(scope.projectId(), entity.id(), to, newPermalink, newChecksum);
        log.debugf("엔티티 이동: project=%s, %s -> %s", scope.permalink(), from, to);
        return new IndexResult(to, moved, IndexKind.MOVED, List.of());
    }

    /**
     * 경로에 엔티티가 없으면 그 경로를 디렉터리로 보고 하위 엔티티를 모두 지운다.
     */
    public int delete(ProjectScope scope, String path) {
        Optional<Entity> entity = store.findByFilePath(scope.projectId(), path);
        if (entity.isPresent()) {
            store.deleteEntity(scope.projectId(), entity.get().id());
            return 1;
        }
        String prefix = path.endsWith("/") ? path : path + "/";
        int deleted = 0;
        while (true) {
            List<Entity> batch = store.findByPattern(scope.projectId(), prefix + "*", DELETE_BATCH, 0).stream()
                    .filter(candidate -> candidate.filePath().startsWith(prefix))
                    .toList();
            if (batch.isEmpty()) {
                return deleted;
            }
            for (Entity candidate : batch) {
                store.deleteEntity(scope.projectId(), candidate.id());
                deleted++;
            }
        }
    }

    /**
     * 디렉터리 경로 아래에 색인된 엔티티 전부. 경로 자체가 엔티티면 비어 있다.
     */
    public List<Entity> entitiesUnder(ProjectScope scope, String path) {
        if (store.findByFilePath(scope.projectId(), path).isPresent()) {
            return List.of();
        }
        String prefix = path.endsWith("/") ? path : path + "/";
        List<Entity> found = new ArrayList<>();
        int offset = 0;
        while (true) {
            List<Entity> batch = store.findByPattern(scope.projectId(), prefix + "*", DELETE_BATCH, offset);
            batch.stream().filter(candidate -> candidate.filePath().startsWith(prefix)).forEach(found::add);
            if (batch.size() < DELETE_BATCH) {
                return found;
            }
            offset += batch.size();
        }
    }

    private EntityWrite markdownWrite(ProjectScope scope, String path, byte[] bytes, String checksum,
                                      Instant modifiedAt, List<String> problems) {
        ParsedDraft draft = parser.parse(bytes, path);
        problems.addAll(draft.problems());
        String permalink = permalinks.resolve(scope, path, draft.title(), draft.permalink());
        Map<String, Object> frontmatter = draft.frontmatter();
        String written = writePermalink(scope, path, draft, permalink);
        if (written != null) {
            checksum = written;
            modifiedAt = files.modifiedAt(scope, path);
            frontmatter = new LinkedHashMap<>(frontmatter);
            frontmatter.put("permalink", permalink);
        }
        return new EntityWrite(
                draft.title(),
                permalink,
                path,
                draft.entityType(),
                Entity.MARKDOWN_CONTENT_TYPE,
                checksum,
                frontmatter,
                draft.body(),
                draft.tags(),
                draft.observations(),
                draft.relations(),
                modifiedAt);
    }

    private EntityWrite fileWrite(ProjectScope scope, String path, String checksum, Instant modifiedAt) {
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        String permalink = permalinks.resolve(scope, path, fileName, null);
        String contentType = URLConnection.guessContentTypeFromName(fileName);
        return new EntityWrite(
                fileName,
                permalink,
                path,
                Entity.FILE_TYPE,
                contentType == null ? BINARY_TYPE : contentType,
                checksum,
                Map.of(),
                null,
                List.of(),
                List.of(),
                List.of(),
                modifiedAt);
    }

    /**
     * 기존 frontmatter 가 있는 문서에만 permalink 를 기록한다. 기록했으면 새 checksum, 아니면 null.
     */
    private String writePermalink(ProjectScope scope, String path, ParsedDraft draft, String permalink) {
        if (!settings.writePermalinks() || !draft.hasFrontmatter() || permalink.equals(draft.permalink())) {
            return null;
        }
        Map<String, Object> frontmatter = new LinkedHashMap<>(draft.frontmatter());
        frontmatter.put("permalink", permalink);
        return files.write(scope, path, writer.compose(frontmatter, draft.body()));
    }

    public enum IndexKind {
        CREATED, MODIFIED, MOVED, UNCHANGED, VANISHED
    }

    public record IndexResult(String path, Entity entity, IndexKind kind, List<String> problems) {
        public IndexResult {
            problems = List.copyOf(problems);
        }

        public boolean degraded() {
            return !problems.isEmpty();
        }
    }
}
