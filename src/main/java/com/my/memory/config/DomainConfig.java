package com.my.memory.config;

import com.my.memory.adapter.out.clock.SystemClockAdapter;
import com.my.memory.adapter.out.sqlite.SqliteDataSources;
import com.my.memory.domain.port.in.BuildContextUseCase;
import com.my.memory.domain.port.in.ManageEntityUseCase;
import com.my.memory.domain.port.in.SearchUseCase;
import com.my.memory.domain.port.out.ChangeWatcherPort;
import com.my.memory.domain.port.out.ClockPort;
import com.my.memory.domain.port.out.FilePort;
import com.my.memory.domain.port.out.KnowledgeStorePort;
import com.my.memory.domain.port.out.ProjectStorePort;
import com.my.memory.domain.service.ChangeDetector;
import com.my.memory.domain.service.ContextTraversalService;
import com.my.memory.domain.service.EntityService;
import com.my.memory.domain.service.FileIndexer;
import com.my.memory.domain.service.FrontmatterCodec;
import com.my.memory.domain.service.MarkdownKnowledgeParser;
import com.my.memory.domain.service.MarkdownWriter;
import com.my.memory.domain.service.PermalinkResolver;
import com.my.memory.domain.service.ProjectResolver;
import com.my.memory.domain.service.ProjectService;
import com.my.memory.domain.service.SearchService;
import com.my.memory.domain.service.SyncOrchestrator;
import com.my.memory.domain.service.SyncSettings;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Duration;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 * SyncOrchestrator 는 SyncControlUseCase, ProjectService 는 ManageProjectUseCase 로도 주입된다.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @ApplicationScoped
    public DataSource dataSource(AppConfig appConfig) {
        return SqliteDataSources.create(Path.of(appConfig.database().path()),
                Duration.ofMillis(appConfig.database().busyTimeoutMs()));
    }

    @Produces
    @Singleton
    public SyncSettings syncSettings(AppConfig appConfig) {
        AppConfig.SyncConfig sync = appConfig.sync();
        return new SyncSettings(
                sync.watchEnabled(),
                Duration.ofMillis(sync.debounceMs()),
                sync.queueCapacity(),
                Duration.ofSeconds(sync.maxScanSeconds()),
                sync.updatePermalinksOnMove(),
                sync.writePermalinks());
    }

    @Produces
    @ApplicationScoped
    public FrontmatterCodec frontmatterCodec() {
        return new FrontmatterCodec();
    }

    @Produces
    @ApplicationScoped
    public MarkdownWriter markdownWriter(FrontmatterCodec codec) {
        return new MarkdownWriter(codec);
    }

    @Produces
    @ApplicationScoped
    public ProjectResolver projectResolver(ProjectStorePort projectStore) {
        return new ProjectResolver(projectStore);
    }

    @Produces
    @ApplicationScoped
    public PermalinkResolver permalinkResolver(KnowledgeStorePort store) {
        return new PermalinkResolver(store);
    }

    @Produces
    @ApplicationScoped
    public FileIndexer fileIndexer(FilePort filePort,
                                   KnowledgeStorePort store,
                                   FrontmatterCodec codec,
                                   MarkdownWriter writer,
                                   PermalinkResolver permalinkResolver,
                                   SyncSettings settings) {
        return new FileIndexer(filePort, store, new MarkdownKnowledgeParser(codec), writer, permalinkResolver, settings);
    }

    @Produces
    @ApplicationScoped
    public SyncOrchestrator syncOrchestrator(ProjectStorePort projectStore,
                                             KnowledgeStorePort store,
                                             FilePort filePort,
                                             FileIndexer fileIndexer,
                                             ChangeWatcherPort watcher,
                                             ClockPort clockPort,
                                             SyncSettings settings) {
        return new SyncOrchestrator(projectStore, store, filePort, new ChangeDetector(filePort, store),
                fileIndexer, watcher, clockPort, settings);
    }

    @Produces
    @ApplicationScoped
    public ProjectService projectService(ProjectStorePort projectStore, SyncOrchestrator orchestrator) {
        return new ProjectService(projectStore, orchestrator);
    }

    @Produces
    @ApplicationScoped
    public ManageEntityUseCase manageEntityUseCase(ProjectResolver projectResolver,
                                                   KnowledgeStorePort store,
                                                   FilePort filePort,
                                                   SyncOrchestrator orchestrator,
                                                   FileIndexer fileIndexer,
                                                   PermalinkResolver permalinkResolver,
                                                   FrontmatterCodec codec,
                                                   MarkdownWriter writer) {
        return new EntityService(projectResolver, store, filePort, orchestrator, fileIndexer,
                permalinkResolver, codec, writer);
    }

    @Produces
    @ApplicationScoped
    public SearchUseCase searchUseCase(ProjectResolver projectResolver, KnowledgeStorePort store, ClockPort clockPort) {
        return new SearchService(projectResolver, store, clockPort);
    }

    @Produces
    @ApplicationScoped
    public BuildContextUseCase buildContextUseCase(ProjectResolver projectResolver,
                                                   KnowledgeStorePort store,
                                                   ClockPort clockPort,
                                                   AppConfig appConfig) {
        return new ContextTraversalService(projectResolver, store, clockPort, appConfig.context().maxDepth());
    }

    @Produces
    @ApplicationScoped
    public ClockPort clockPort() {
        return SystemClockAdapter.system();
    }
}
