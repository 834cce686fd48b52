package com.my.memory.adapter.out.sqlite;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.memory.domain.exception.ProjectNotFoundException;
import com.my.memory.domain.model.EntityWrite;
import com.my.memory.domain.model.Project;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqliteProjectStoreTest {

    @TempDir
    Path tempDir;

    private SQLiteDataSource dataSource;
    private SqliteProjectStore store;

    @BeforeEach
    void setUp() {
        dataSource = SqliteDataSources.create(tempDir.resolve("db/memory.db"), Duration.ofSeconds(5));
        store = new SqliteProjectStore(dataSource);
        store.init();
    }

    @Test
    void createsProjectsAndKeepsSingleDefault() {
        Project work = store.create("Work", "work", tempDir.resolve("work"), true);
        Project home = store.create("Home", "home", tempDir.resolve("home"), true);

        assertThat(store.findById(work.id()).orElseThrow().isDefault()).isFalse();
        assertThat(store.findDefault()).contains(home);
        assertThat(store.findAll()).extracting(Project::permalink).containsExactly("work", "home");
        assertThat(store.findByPermalink("WORK")).map(Project::id).contains(work.id());
        assertThat(work.rootPath()).isEqualTo(tempDir.resolve("work"));
    }

    @Test
    void setDefaultOnUnknownProjectFails() {
        store.create("Work", "work", tempDir.resolve("work"), true);

        assertThatThrownBy(() -> store.setDefault(999L)).isInstanceOf(ProjectNotFoundException.class);
        assertThat(store.findDefault()).map(Project::permalink).contains("work");
    }

    @Test
    void removeDropsTheProjectsEntities() {
        Project work = store.create("Work", "work", tempDir.resolve("work"), true);
        SqliteKnowledgeStore knowledge = new SqliteKnowledgeStore(dataSource, new ObjectMapper());
        knowledge.init();
        knowledge.upsertEntity(work.id(), new EntityWrite("Note", "note", "note.md", "note", "text/markdown", "c",
                Map.of(), "body", List.of(), List.of(), List.of(), Instant.EPOCH));

        store.remove(work.id());

        assertThat(store.findAll()).isEmpty();
        assertThat(knowledge.countEntities(work.id())).isZero();
    }
}
