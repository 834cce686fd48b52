package com.my.memory.adapter.out.sqlite;

import org.jboss.logging.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * 지식 그래프 테이블과 전문 검색 색인. 여러 번 적용해도 결과가 같다.
 */
final class SqliteSchema {

    private static final Logger log = Logger.getLogger(SqliteSchema.class);

    private static final String PROJECT_DDL = """
            CREATE TABLE IF NOT EXISTS project (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                name TEXT NOT NULL,
                permalink TEXT NOT NULL UNIQUE COLLATE NOCASE,
                root_path TEXT NOT NULL,
                is_default INTEGER NOT NULL DEFAULT 0,
                created_at INTEGER NOT NULL
            )
            """;

    private static final String ENTITY_DDL = """
            CREATE TABLE IF NOT EXISTS entity (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                project_id INTEGER NOT NULL REFERENCES project(id) ON DELETE CASCADE,
                title TEXT NOT NULL,
                permalink TEXT NOT NULL,
                file_path TEXT NOT NULL,
                entity_type TEXT NOT NULL,
                content_type TEXT,
                checksum TEXT,
                frontmatter TEXT NOT NULL DEFAULT '{}',
                content TEXT,
                tags TEXT NOT NULL DEFAULT '[]',
                created_at INTEGER NOT NULL,
                updated_at INTEGER NOT NULL,
                UNIQUE (project_id, permalink),
                UNIQUE (project_id, file_path)
            )
            """;

    private static final String OBSERVATION_DDL = """
            CREATE TABLE IF NOT EXISTS observation (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                entity_id INTEGER NOT NULL REFERENCES entity(id) ON DELETE CASCADE,
                category TEXT NOT NULL,
                content TEXT NOT NULL,
                tags TEXT NOT NULL DEFAULT '[]',
                context TEXT
            )
            """;

    private static final String RELATION_DDL = """
            CREATE TABLE IF NOT EXISTS relation (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                project_id INTEGER NOT NULL REFERENCES project(id) ON DELETE CASCADE,
                from_entity_id INTEGER NOT NULL REFERENCES entity(id) ON DELETE CASCADE,
                to_entity_id INTEGER REFERENCES entity(id) ON DELETE SET NULL,
                target_title TEXT NOT NULL,
                relation_type TEXT NOT NULL,
                context TEXT,
                UNIQUE (from_entity_id, target_title, relation_type)
            )
            """;

    private static final String SEARCH_DDL = """
            CREATE VIRTUAL TABLE IF NOT EXISTS search_index USING fts5(
                title,
                content,
                tags,
                entity_id UNINDEXED,
                project_id UNINDEXED,
                tokenize = 'unicode61 remove_diacritics 2'
            )
            """;

    private static final List<String> INDEXES = List.of(
            "CREATE INDEX IF NOT EXISTS idx_entity_project_title ON entity(project_id, title COLLATE NOCASE)",
            "CREATE INDEX IF NOT EXISTS idx_entity_project_updated ON entity(project_id, updated_at)",
            "CREATE INDEX IF NOT EXISTS idx_observation_entity ON observation(entity_id)",
            "CREATE INDEX IF NOT EXISTS idx_relation_from ON relation(from_entity_id)",
            "CREATE INDEX IF NOT EXISTS idx_relation_to ON relation(to_entity_id)",
            "CREATE INDEX IF NOT EXISTS idx_relation_dangling ON relation(project_id) WHERE to_entity_id IS NULL"
    );

    private SqliteSchema() {
    }

    static void apply(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(PROJECT_DDL);
            stmt.execute(ENTITY_DDL);
            stmt.execute(OBSERVATION_DDL);
            stmt.execute(RELATION_DDL);
            stmt.execute(SEARCH_DDL);
            for (String index : INDEXES) {
                stmt.execute(index);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("지식 그래프 스키마 초기화 실패", e);
        }
        log.debug("지식 그래프 스키마 적용 완료");
    }
}
