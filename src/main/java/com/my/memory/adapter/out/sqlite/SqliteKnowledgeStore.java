package com.my.memory.adapter.out.sqlite;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.memory.domain.exception.CrossProjectReferenceException;
import com.my.memory.domain.exception.StoreConsistencyException;
import com.my.memory.domain.model.Entity;
import com.my.memory.domain.model.EntityWrite;
import com.my.memory.domain.model.Observation;
import com.my.memory.domain.model.ObservationDraft;
import com.my.memory.domain.model.Relation;
import com.my.memory.domain.model.RelationDraft;
import com.my.memory.domain.model.SearchQuery;
import com.my.memory.domain.model.SearchResult;
import com.my.memory.domain.port.out.KnowledgeStorePort;
import com.my.memory.domain.service.LinkText;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 왜: 엔티티, 관찰, 관계, 검색 색인을 하나의 SQLite 파일에 두고 파일 하나의 반영을 단일 트랜잭션으로 묶기 위함.
 */
@ApplicationScoped
public class SqliteKnowledgeStore implements KnowledgeStorePort {

    private static final Logger log = Logger.getLogger(SqliteKnowledgeStore.class);

    private static final String ENTITY_COLUMNS = """
            e.id, e.project_id, e.title, e.permalink, e.file_path, e.entity_type, e.content_type, e.checksum,
            e.frontmatter, e.content, e.tags, e.created_at, e.updated_at""";

    private static final String SELECT_ENTITY = "SELECT " + ENTITY_COLUMNS + " FROM entity e ";
    private static final String SELECT_BY_ID = SELECT_ENTITY + "WHERE e.project_id = ? AND e.id = ?";
    private static final String SELECT_BY_PATH = SELECT_ENTITY + "WHERE e.project_id = ? AND e.file_path = ?";
    private static final String SELECT_BY_PERMALINK = SELECT_ENTITY + "WHERE e.project_id = ? AND e.permalink = ?";
    private static final String SELECT_BY_TITLE = SELECT_ENTITY
            + "WHERE e.project_id = ? AND e.title = ? COLLATE NOCASE "
            + "ORDER BY CASE WHEN e.title = ? THEN 0 ELSE 1 END, e.id";
    private static final String SELECT_BY_PATTERN = SELECT_ENTITY
            + "WHERE e.project_id = ? AND (e.permalink GLOB ? OR e.file_path GLOB ?) "
            + "ORDER BY e.file_path LIMIT ? OFFSET ?";
    private static final String SELECT_OWNER = "SELECT project_id FROM entity WHERE id = ?";

    private static final String INSERT_ENTITY = """
            INSERT INTO entity(project_id, title, permalink, file_path, entity_type, content_type, checksum,
                               frontmatter, content, tags, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(project_id, permalink) DO UPDATE SET
                title = excluded.title,
                file_path = excluded.file_path,
                entity_type = excluded.entity_type,
                content_type = excluded.content_type,
                checksum = excluded.checksum,
                frontmatter = excluded.frontmatter,
                content = excluded.content,
                tags = excluded.tags,
                updated_at = excluded.updated_at
            """;
    private static final String UPDATE_ENTITY = """
            UPDATE entity SET title = ?, permalink = ?, entity_type = ?, content_type = ?, checksum = ?,
                              frontmatter = ?, content = ?, tags = ?, updated_at = ?
            WHERE id = ?
            """;
    private static final String MOVE_ENTITY = """
            UPDATE entity SET file_path = ?, permalink = COALESCE(?, permalink), checksum = COALESCE(?, checksum)
            WHERE project_id = ? AND id = ?
            """;
    private static final String DELETE_ENTITY = "DELETE FROM entity WHERE project_id = ? AND id = ?";

    private static final String DELETE_OBSERVATIONS = "DELETE FROM observation WHERE entity_id = ?";
    private static final String INSERT_OBSERVATION =
            "INSERT INTO observation(entity_id, category, content, tags, context) VALUES (?, ?, ?, ?, ?)";

    private static final String DELETE_OUTGOING = "DELETE FROM relation WHERE from_entity_id = ?";
    private static final String INSERT_RELATION = """
            INSERT OR IGNORE INTO relation(project_id, from_entity_id, to_entity_id, target_title, relation_type, context)
            VALUES (?, ?, ?, ?, ?, ?)
            """;
    private static final String SELECT_DANGLING = """
            SELECT id, project_id, from_entity_id, to_entity_id, target_title, relation_type, context
            FROM relation WHERE project_id = ? AND to_entity_id IS NULL ORDER BY id
            """;
    private static final String LINK_RELATION = "UPDATE relation SET to_entity_id = ? WHERE id = ? AND to_entity_id IS NULL";

    private static final List<String> TARGET_LOOKUPS = List.of(
            "SELECT id FROM entity WHERE project_id = ? AND permalink = ? ORDER BY id LIMIT 1",
            "SELECT id FROM entity WHERE project_id = ? AND title = ? ORDER BY id LIMIT 1",
            "SELECT id FROM entity WHERE project_id = ? AND title = ? COLLATE NOCASE ORDER BY id LIMIT 1",
            "SELECT id FROM entity WHERE project_id = ? AND file_path = ? ORDER BY id LIMIT 1",
            "SELECT id FROM entity WHERE project_id = ? AND file_path = ? || '.md' ORDER BY id LIMIT 1"
    );

    private static final String DELETE_SEARCH_ROW = "DELETE FROM search_index WHERE rowid = ?";
    private static final String DELETE_SEARCH_ROWS = "DELETE FROM search_index WHERE project_id = ?";
    private static final String INSERT_SEARCH_ROW = """
            INSERT INTO search_index(rowid, title, content, tags, entity_id, project_id) VALUES (?, ?, ?, ?, ?, ?)
            """;
    private static final String SELECT_OBSERVATION_TAGS = "SELECT tags FROM observation WHERE entity_id = ?";

    private static final String SEARCH_MATCH = """
            SELECT e.id, e.title, e.permalink, e.file_path, e.entity_type, e.updated_at,
                   bm25(search_index, 10.0, 1.0, 5.0) AS rank,
                   snippet(search_index, 1, '', '', '...', 16) AS snippet
            FROM search_index
            JOIN entity e ON e.id = search_index.rowid
            WHERE search_index MATCH ? AND e.project_id = ?
            """;
    private static final String SEARCH_PLAIN = """
            SELECT e.id, e.title, e.permalink, e.file_path, e.entity_type, e.updated_at,
                   0.0 AS rank, NULL AS snippet
            FROM entity e
            LEFT JOIN search_index ON search_index.rowid = e.id
            WHERE e.project_id = ?
            """;

    private static final Pattern SEARCH_TOKEN = Pattern.compile("[\\p{L}\\p{N}_]+");
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {
    };

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public SqliteKnowledgeStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        SqliteSchema.apply(dataSource);
    }

    @Override
    public Entity upsertEntity(long projectId, EntityWrite write) {
        return inTransaction("엔티티 저장", conn -> {
            Optional<Entity> existing = selectEntity(conn, SELECT_BY_PATH, projectId, write.filePath());
            long entityId;
            if (existing.isPresent()) {
                entityId = existing.get().id();
                String permalink = write.permalink();
                Optional<Entity> owner = selectEntity(conn, SELECT_BY_PERMALINK, projectId, permalink);
                if (owner.isPresent() && owner.get().id() != entityId) {
                    log.warnf("permalink 가 다른 엔티티에 있어 기존 값을 유지합니다: permalink=%s, path=%s",
                            permalink, write.filePath());
                    permalink = existing.get().permalink();
                }
                updateEntity(conn, entityId, permalink, write);
            } else {
                insertEntity(conn, projectId, write);
                entityId = selectEntity(conn, SELECT_BY_PERMALINK, projectId, write.permalink())
                        .map(Entity::id)
                        .orElseThrow(() -> new StoreConsistencyException("저장한 엔티티를 찾을 수 없습니다: " + write.filePath()));
            }
            replaceObservations(conn, entityId, write.observations());
            replaceRelations(conn, projectId, entityId, write.relations());
            Entity entity = requireEntity(conn, projectId, entityId);
            linkDanglingTo(conn, entity);
            Set<String> tags = new LinkedHashSet<>(entity.tags());
            write.observations().forEach(observation -> tags.addAll(observation.tags()));
            writeSearchRow(conn, entity, tags);
            return entity;
        });
    }

    @Override
    public Entity moveEntity(long projectId, long entityId, String newPath, String newPermalink, String newChecksum) {
        return inTransaction("엔티티 이동", conn -> {
            requireOwned(conn, projectId, entityId);
            try (PreparedStatement ps = conn.prepareStatement(MOVE_ENTITY)) {
                ps.setString(1, newPath);
                ps.setString(2, newPermalink);
                ps.setString(3, newChecksum);
                ps.setLong(4, projectId);
                ps.setLong(5, entityId);
                ps.executeUpdate();
            }
            Entity entity = requireEntity(conn, projectId, entityId);
            linkDanglingTo(conn, entity);
            return entity;
        });
    }

    @Override
    public void deleteEntity(long projectId, long entityId) {
        inTransaction("엔티티 삭제", conn -> {
            if (!isOwned(conn, projectId, entityId)) {
                return null;
            }
            try (PreparedStatement ps = conn.prepareStatement(DELETE_SEARCH_ROW)) {
                ps.setLong(1, entityId);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement(DELETE_ENTITY)) {
                ps.setLong(1, projectId);
                ps.setLong(2, entityId);
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public int resolveDanglingRelations(long projectId) {
        return inTransaction("관계 해석", conn -> {
            int linked = 0;
            for (Relation relation : selectRelations(conn, SELECT_DANGLING, List.of(projectId))) {
                Long target = resolveTarget(conn, projectId, relation.targetTitle());
                if (target != null) {
                    linked += link(conn, relation.id(), target);
                }
            }
            return linked;
        });
    }

    @Override
    public void rebuildSearchIndex(long projectId) {
        inTransaction("검색 색인 재구성", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(DELETE_SEARCH_ROWS)) {
                ps.setLong(1, projectId);
                ps.executeUpdate();
            }
            List<Entity> entities = selectEntities(conn, SELECT_ENTITY + "WHERE e.project_id = ? ORDER BY e.id",
                    List.of(projectId));
            for (Entity entity : entities) {
                Set<String> tags = new LinkedHashSet<>(entity.tags());
                try (PreparedStatement ps = conn.prepareStatement(SELECT_OBSERVATION_TAGS)) {
                    ps.setLong(1, entity.id());
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            tags.addAll(readList(rs.getString(1)));
                        }
                    }
                }
                writeSearchRow(conn, entity, tags);
            }
            log.infof("검색 색인 재구성: projectId=%d, entities=%d", projectId, entities.size());
            return null;
        });
    }

    @Override
    public List<SearchResult> search(long projectId, SearchQuery query, int limit, int offset) {
        if (!query.hasText()) {
            return searchPlain(projectId, query, null, limit, offset);
        }
        String match = matchExpression(query.text());
        if (match == null) {
            return searchPlain(projectId, query, query.text().strip(), limit, offset);
        }
        List<SearchResult> results = searchRanked(projectId, query, match, limit, offset);
        if (results.isEmpty() && offset == 0) {
            return searchPlain(projectId, query, query.text().strip(), limit, offset);
        }
        return results;
    }

    @Override
    public Optional<Entity> findById(long projectId, long entityId) {
        return read("엔티티 조회", conn -> selectEntity(conn, SELECT_BY_ID, projectId, entityId));
    }

    @Override
    public Optional<Entity> findByPermalink(long projectId, String permalink) {
        return read("엔티티 조회", conn -> selectEntity(conn, SELECT_BY_PERMALINK, projectId, permalink));
    }

    @Override
    public Optional<Entity> findByFilePath(long projectId, String filePath) {
        return read("엔티티 조회", conn -> selectEntity(conn, SELECT_BY_PATH, projectId, filePath));
    }

    @Override
    public List<Entity> findByTitle(long projectId, String title) {
        return read("엔티티 조회", conn -> selectEntities(conn, SELECT_BY_TITLE, List.of(projectId, title, title)));
    }

    @Override
    public List<Entity> findByIds(long projectId, Collection<Long> entityIds) {
        if (entityIds.isEmpty()) {
            return List.of();
        }
        List<Object> params = new ArrayList<>();
        params.add(projectId);
        params.addAll(entityIds);
        String sql = SELECT_ENTITY + "WHERE e.project_id = ? AND e.id IN (" + placeholders(entityIds.size()) + ") ORDER BY e.id";
        return read("엔티티 조회", conn -> selectEntities(conn, sql, params));
    }

    @Override
    public List<Entity> findByPattern(long projectId, String pattern, int limit, int offset) {
        return read("패턴 조회", conn -> selectEntities(conn, SELECT_BY_PATTERN,
                List.of(projectId, pattern, pattern, limit, offset)));
    }

    @Override
    public Map<String, String> fileChecksums(long projectId) {
        return read("checksum 조회", conn -> {
            Map<String, String> checksums = new LinkedHashMap<>();
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT file_path, checksum FROM entity WHERE project_id = ? ORDER BY file_path")) {
                ps.setLong(1, projectId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        checksums.put(rs.getString(1), rs.getString(2) == null ? "" : rs.getString(2));
                    }
                }
            }
            return checksums;
        });
    }

    @Override
    public Map<Long, List<Observation>> observationsFor(Collection<Long> entityIds) {
        if (entityIds.isEmpty()) {
            return Map.of();
        }
        String sql = "SELECT id, entity_id, category, content, tags, context FROM observation WHERE entity_id IN ("
                + placeholders(entityIds.size()) + ") ORDER BY id";
        return read("관찰 조회", conn -> {
            Map<Long, List<Observation>> grouped = new LinkedHashMap<>();
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                bind(ps, new ArrayList<>(entityIds));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        Observation observation = new Observation(
                                rs.getLong("id"),
                                rs.getLong("entity_id"),
                                rs.getString("category"),
                                rs.getString("content"),
                                new LinkedHashSet<>(readList(rs.getString("tags"))),
                                rs.getString("context"));
                        grouped.computeIfAbsent(observation.entityId(), id -> new ArrayList<>()).add(observation);
                    }
                }
            }
            return grouped;
        });
    }

    @Override
    public List<Relation> relationsTouching(long projectId, Collection<Long> entityIds) {
        if (entityIds.isEmpty()) {
            return List.of();
        }
        String in = placeholders(entityIds.size());
        String sql = """
                SELECT id, project_id, from_entity_id, to_entity_id, target_title, relation_type, context
                FROM relation WHERE project_id = ? AND (from_entity_id IN (%s) OR to_entity_id IN (%s)) ORDER BY id
                """.formatted(in, in);
        List<Object> params = new ArrayList<>();
        params.add(projectId);
        params.addAll(entityIds);
        params.addAll(entityIds);
        return read("관계 조회", conn -> selectRelations(conn, sql, params));
    }

    @Override
    public List<Relation> danglingRelations(long projectId) {
        return read("관계 조회", conn -> selectRelations(conn, SELECT_DANGLING, List.of(projectId)));
    }

    @Override
    public long countEntities(long projectId) {
        return read("엔티티 수 조회", conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM entity WHERE project_id = ?")) {
                ps.setLong(1, projectId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getLong(1) : 0L;
                }
            }
        });
    }

    private void insertEntity(Connection conn, long projectId, EntityWrite write) throws SQLException {
        long modified = write.modifiedAt().toEpochMilli();
        try (PreparedStatement ps = conn.prepareStatement(INSERT_ENTITY)) {
            ps.setLong(1, projectId);
            ps.setString(2, write.title());
            ps.setString(3, write.permalink());
            ps.setString(4, write.filePath());
            ps.setString(5, write.entityType());
            ps.setString(6, write.contentType());
            ps.setString(7, write.checksum());
            ps.setString(8, toJson(write.frontmatter()));
            ps.setString(9, write.content());
            ps.setString(10, toJson(write.tags()));
            ps.setLong(11, modified);
            ps.setLong(12, modified);
            ps.executeUpdate();
        }
    }

    private void updateEntity(Connection conn, long entityId, String permalink, EntityWrite write) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(UPDATE_ENTITY)) {
            ps.setString(1, write.title());
            ps.setString(2, permalink);
            ps.setString(3, write.entityType());
            ps.setString(4, write.contentType());
            ps.setString(5, write.checksum());
            ps.setString(6, toJson(write.frontmatter()));
            ps.setString(7, write.content());
            ps.setString(8, toJson(write.tags()));
            ps.setLong(9, write.modifiedAt().toEpochMilli());
            ps.setLong(10, entityId);
            ps.executeUpdate();
        }
    }

    private void replaceObservations(Connection conn, long entityId, List<ObservationDraft> observations)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(DELETE_OBSERVATIONS)) {
            ps.setLong(1, entityId);
            ps.executeUpdate();
        }
        if (observations.isEmpty()) {
            return;
        }
        try (PreparedStatement ps = conn.prepareStatement(INSERT_OBSERVATION)) {
            for (ObservationDraft observation : observations) {
                ps.setLong(1, entityId);
                ps.setString(2, observation.category());
                ps.setString(3, observation.content());
                ps.setString(4, toJson(new ArrayList<>(observation.tags())));
                ps.setString(5, observation.context());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void replaceRelations(Connection conn, long projectId, long entityId, List<RelationDraft> relations)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(DELETE_OUTGOING)) {
            ps.setLong(1, entityId);
            ps.executeUpdate();
        }
        for (RelationDraft relation : relations) {
            Long target = resolveTarget(conn, projectId, relation.targetTitle());
            try (PreparedStatement ps = conn.prepareStatement(INSERT_RELATION)) {
                ps.setLong(1, projectId);
                ps.setLong(2, entityId);
                if (target == null) {
                    ps.setNull(3, Types.INTEGER);
                } else {
                    ps.setLong(3, target);
                }
                ps.setString(4, relation.targetTitle());
                ps.setString(5, relation.relationType());
                ps.setString(6, relation.context());
                ps.executeUpdate();
            }
        }
    }

    /**
     * permalink, 정확한 제목, 대소문자 무시 제목, 파일 경로, ".md" 를 붙인 파일 경로 순으로 같은 프로젝트 안에서만 찾는다.
     */
    private Long resolveTarget(Connection conn, long projectId, String targetTitle) throws SQLException {
        String target = LinkText.normalize(targetTitle);
        if (target.isEmpty()) {
            return null;
        }
        for (String sql : TARGET_LOOKUPS) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setLong(1, projectId);
                ps.setString(2, target);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        return rs.getLong(1);
                    }
                }
            }
        }
        return null;
    }

    private void linkDanglingTo(Connection conn, Entity entity) throws SQLException {
        for (Relation relation : selectRelations(conn, SELECT_DANGLING, List.of(entity.projectId()))) {
            if (LinkText.matches(relation.targetTitle(), entity)) {
                link(conn, relation.id(), entity.id());
            }
        }
    }

    private int link(Connection conn, long relationId, long targetId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(LINK_RELATION)) {
            ps.setLong(1, targetId);
            ps.setLong(2, relationId);
            return ps.executeUpdate();
        }
    }

    private void writeSearchRow(Connection conn, Entity entity, Collection<String> tags) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(DELETE_SEARCH_ROW)) {
            ps.setLong(1, entity.id());
            ps.executeUpdate();
        }
        try (PreparedStatement ps = conn.prepareStatement(INSERT_SEARCH_ROW)) {
            ps.setLong(1, entity.id());
            ps.setString(2, entity.title());
            ps.setString(3, entity.content() == null ? "" : entity.content());
            ps.setString(4, String.join(" ", tags));
            ps.setLong(5, entity.id());
            ps.setLong(6, entity.projectId());
            ps.executeUpdate();
        }
    }

    private List<SearchResult> searchRanked(long projectId, SearchQuery query, String match, int limit, int offset) {
        StringBuilder sql = new StringBuilder(SEARCH_MATCH);
        List<Object> params = new ArrayList<>(List.of(match, projectId));
        appendFilters(sql, params, query);
        sql.append(" ORDER BY rank, e.id LIMIT ? OFFSET ?");
        params.add(limit);
        params.add(offset);
        return read("검색", conn -> selectResults(conn, sql.toString(), params, true));
    }

    /**
     * 텍스트가 없으면 최근 수정 순 목록, 있으면 전문 검색이 놓친 부분 문자열 일치를 찾는다.
     */
    private List<SearchResult> searchPlain(long projectId, SearchQuery query, String substring, int limit, int offset) {
        StringBuilder sql = new StringBuilder(SEARCH_PLAIN);
        List<Object> params = new ArrayList<>(List.of(projectId));
        if (substring != null) {
            String like = "%" + escapeLike(substring) + "%";
            sql.append(" AND (e.title LIKE ? ESCAPE '\\' OR e.content LIKE ? ESCAPE '\\')");
            params.add(like);
            params.add(like);
        }
        appendFilters(sql, params, query);
        sql.append(" ORDER BY e.updated_at DESC, e.id DESC LIMIT ? OFFSET ?");
        params.add(limit);
        params.add(offset);
        return read("검색", conn -> selectResults(conn, sql.toString(), params, false));
    }

    private static void appendFilters(StringBuilder sql, List<Object> params, SearchQuery query) {
        if (!query.entityTypes().isEmpty()) {
            sql.append(" AND e.entity_type IN (").append(placeholders(query.entityTypes().size())).append(')');
            params.addAll(query.entityTypes());
        }
        for (String tag : query.tags()) {
            sql.append(" AND (' ' || COALESCE(search_index.tags, '') || ' ') LIKE ? ESCAPE '\\'");
            params.add("% " + escapeLike(tag.startsWith("#") ? tag.substring(1) : tag) + " %");
        }
        if (query.after() != null) {
            sql.append(" AND e.updated_at >= ?");
            params.add(query.after().toEpochMilli());
        }
        if (query.permalinkPattern() != null && !query.permalinkPattern().isBlank()) {
            sql.append(" AND e.permalink GLOB ?");
            params.add(query.permalinkPattern());
        }
    }

    /**
     * 각 토큰을 접두어 검색으로 바꾸고 모두 일치해야 하도록 잇는다. 토큰이 없으면 null.
     */
    static String matchExpression(String text) {
        Matcher matcher = SEARCH_TOKEN.matcher(text);
        List<String> terms = new ArrayList<>();
        while (matcher.find()) {
            terms.add("\"" + matcher.group() + "\"*");
        }
        return terms.isEmpty() ? null : String.join(" ", terms);
    }

    private List<SearchResult> selectResults(Connection conn, String sql, List<Object> params, boolean ranked)
            throws SQLException {
        List<SearchResult> results = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(new SearchResult(
                            rs.getLong("id"),
                            rs.getString("title"),
                            rs.getString("permalink"),
                            rs.getString("file_path"),
                            rs.getString("entity_type"),
                            ranked ? -rs.getDouble("rank") : 0.0,
                            rs.getString("snippet"),
                            Instant.ofEpochMilli(rs.getLong("updated_at"))));
                }
            }
        }
        return results;
    }

    private Entity requireEntity(Connection conn, long projectId, long entityId) throws SQLException {
        return selectEntity(conn, SELECT_BY_ID, projectId, entityId)
                .orElseThrow(() -> new StoreConsistencyException("엔티티가 사라졌습니다: id=" + entityId));
    }

    private void requireOwned(Connection conn, long projectId, long entityId) throws SQLException {
        if (!isOwned(conn, projectId, entityId)) {
            throw new StoreConsistencyException("엔티티가 없습니다: id=" + entityId);
        }
    }

    /**
     * 없으면 false, 다른 프로젝트 소속이면 예외.
     */
    private boolean isOwned(Connection conn, long projectId, long entityId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SELECT_OWNER)) {
            ps.setLong(1, entityId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return false;
                }
                if (rs.getLong(1) != projectId) {
                    throw new CrossProjectReferenceException(projectId, entityId);
                }
                return true;
            }
        }
    }

    private Optional<Entity> selectEntity(Connection conn, String sql, long projectId, Object key) throws SQLException {
        List<Entity> entities = selectEntities(conn, sql, List.of(projectId, key));
        return entities.isEmpty() ? Optional.empty() : Optional.of(entities.get(0));
    }

    private List<Entity> selectEntities(Connection conn, String sql, List<Object> params) throws SQLException {
        List<Entity> entities = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entities.add(mapEntity(rs));
                }
            }
        }
        return entities;
    }

    private List<Relation> selectRelations(Connection conn, String sql, List<Object> params) throws SQLException {
        List<Relation> relations = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long to = rs.getLong("to_entity_id");
                    relations.add(new Relation(
                            rs.getLong("id"),
                            rs.getLong("project_id"),
                            rs.getLong("from_entity_id"),
                            rs.wasNull() ? null : to,
                            rs.getString("target_title"),
                            rs.getString("relation_type"),
                            rs.getString("context")));
                }
            }
        }
        return relations;
    }

    private Entity mapEntity(ResultSet rs) throws SQLException {
        return new Entity(
                rs.getLong("id"),
                rs.getLong("project_id"),
                rs.getString("title"),
                rs.getString("permalink"),
                rs.getString("file_path"),
                rs.getString("entity_type"),
                rs.getString("content_type"),
                rs.getString("checksum"),
                readMap(rs.getString("frontmatter")),
                rs.getString("content"),
                readList(rs.getString("tags")),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                Instant.ofEpochMilli(rs.getLong("updated_at")));
    }

    private static void bind(PreparedStatement ps, List<?> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object value = params.get(i);
            if (value instanceof Long longValue) {
                ps.setLong(i + 1, longValue);
            } else if (value instanceof Integer intValue) {
                ps.setInt(i + 1, intValue);
            } else {
                ps.setString(i + 1, value == null ? null : value.toString());
            }
        }
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreConsistencyException("JSON 직렬화 실패", e);
        }
    }

    private Map<String, Object> readMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new StoreConsistencyException("frontmatter 컬럼을 읽을 수 없습니다.", e);
        }
    }

    private List<String> readList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new StoreConsistencyException("태그 컬럼을 읽을 수 없습니다.", e);
        }
    }

    private <T> T inTransaction(String action, SqlWork<T> work) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreConsistencyException(action + " 실패", e);
        }
    }

    private <T> T read(String action, SqlWork<T> work) {
        try (Connection conn = dataSource.getConnection()) {
            return work.apply(conn);
        } catch (SQLException e) {
            throw new StoreConsistencyException(action + " 실패", e);
        }
    }

    @FunctionalInterface
    interface SqlWork<T> {
        T apply(Connection conn) throws SQLException;
    }
}
