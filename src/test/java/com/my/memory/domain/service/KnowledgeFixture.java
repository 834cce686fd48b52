package com.my.memory.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.memory.adapter.out.clock.SystemClockAdapter;
import com.my.memory.adapter.out.filesystem.FileSystemAdapter;
import com.my.memory.adapter.out.sqlite.SqliteDataSources;
import com.my.memory.adapter.out.sqlite.SqliteKnowledgeStore;
import com.my.memory.adapter.out.sqlite.SqliteProjectStore;
import com.my.memory.domain.model.ApplyOutcome;
import com.my.memory.domain.model.Entity;
import com.my.memory.domain.model.Project;
import com.my.memory.domain.port.out.ChangeWatcherPort;
import com.my.memory.domain.port.out.ClockPort;
import org.sqlite.SQLiteDataSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.mockito.Mockito.mock;

/**
 * 임시 디렉터리 위에 실제 SQLite 저장소와 파일 시스템으로 동기화 계층 전체를 묶는다. 파일 감시는 끈다.
 */
final class KnowledgeFixture implements AutoCloseable {

    static final String PROJECT = "main";

    final SqliteProjectStore projectStore;
    final SqliteKnowledgeStore store;
    final FileSystemAdapter files;
    final FrontmatterCodec codec;
    final MarkdownWriter writer;
    final ProjectResolver projectResolver;
    final PermalinkResolver permalinks;
    final FileIndexer indexer;
    final SyncOrchestrator orchestrator;
    final ProjectService projectService;
    final Path root;
    final Project project;

    private KnowledgeFixture(Path dir, SyncSettings settings, ClockPort clock) {
        SQLiteDataSource dataSource = SqliteDataSources.create(dir.resolve("memory.db"), Duration.ofSeconds(5));
        projectStore = new SqliteProjectStore(dataSource);
        projectStore.init();
        store = new SqliteKnowledgeStore(dataSource, new ObjectMapper());
        store.init();
        files = new FileSystemAdapter();
        codec = new FrontmatterCodec();
        writer = new MarkdownWriter(codec);
        projectResolver = new ProjectResolver(projectStore);
        permalinks = new PermalinkResolver(store);
        indexer = new FileIndexer(files, store, new MarkdownKnowledgeParser(codec), writer, permalinks, settings);
        ChangeWatcherPort watcher = mock(ChangeWatcherPort.class);
        orchestrator = new SyncOrchestrator(projectStore, store, files, new ChangeDetector(files, store),
                indexer, watcher, clock, settings);
        projectService = new ProjectService(projectStore, orchestrator);
        root = dir.resolve("notes");
        project = projectService.createProject(PROJECT, root, true);
        settle();
    }

    static KnowledgeFixture create(Path dir) {
        return create(dir, unwatched());
    }

    static KnowledgeFixture create(Path dir, SyncSettings settings) {
        return new KnowledgeFixture(dir, settings, SystemClockAdapter.system());
    }

    static KnowledgeFixture create(Path dir, SyncSettings settings, ClockPort clock) {
        return new KnowledgeFixture(dir, settings, clock);
    }

    static SyncSettings unwatched() {
        return new SyncSettings(false, Duration.ofMillis(50), 64, Duration.ofMinutes(5), false, true);
    }

    void write(String path, String content) throws IOException {
        Path file = root.resolve(path);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    String readFile(String path) throws IOException {
        return Files.readString(root.resolve(path), StandardCharsets.UTF_8);
    }

    void move(String from, String to) throws IOException {
        Path target = root.resolve(to);
        Files.createDirectories(target.getParent());
        Files.move(root.resolve(from), target);
    }

    /**
     * 프로젝트 등록 때 제출된 초기 스캔이 끝날 때까지 기다린다.
     */
    private void settle() {
        try {
            scan();
        } catch (Exception e) {
            throw new IllegalStateException("초기 스캔 실패", e);
        }
    }

    ApplyOutcome scan() throws Exception {
        return orchestrator.requestFullScan(PROJECT).get(30, TimeUnit.SECONDS);
    }

    Entity entityAt(String path) {
        return store.findByFilePath(project.id(), path)
                .orElseThrow(() -> new AssertionError("색인되지 않은 경로: " + path));
    }

    @Override
    public void close() {
        orchestrator.stopAll();
    }
}
