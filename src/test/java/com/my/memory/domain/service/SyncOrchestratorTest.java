package com.my.memory.domain.service;

import com.my.memory.adapter.out.clock.SystemClockAdapter;
import com.my.memory.domain.exception.StoreConsistencyException;
import com.my.memory.domain.model.ApplyOutcome;
import com.my.memory.domain.model.ChangeEvent;
import com.my.memory.domain.model.Entity;
import com.my.memory.domain.model.Project;
import com.my.memory.domain.model.Relation;
import com.my.memory.domain.model.SyncState;
import com.my.memory.domain.port.out.ChangeWatcherPort;
import com.my.memory.domain.port.out.FilePort;
import com.my.memory.domain.port.out.KnowledgeStorePort;
import com.my.memory.domain.port.out.ProjectStorePort;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SyncOrchestratorTest {

    @TempDir
    Path tempDir;

    @Test
    void rescanWithoutChangesIsNoOp() throws Exception {
        try (KnowledgeFixture fixture = KnowledgeFixture.create(tempDir)) {
            fixture.write("a.md", "# Alpha\n- [idea] first #seed\n");
            fixture.write("b.md", "---\ntitle: Beta\n---\nbody\n");

            ApplyOutcome first = fixture.scan();
            String betaFile = fixture.readFile("b.md");
            ApplyOutcome second = fixture.scan();

            assertThat(first.created()).isEqualTo(2);
            assertThat(second.total()).isZero();
            assertThat(second.failed()).isEmpty();
            assertThat(fixture.readFile("b.md")).isEqualTo(betaFile);
            assertThat(fixture.store.countEntities(fixture.project.id())).isEqualTo(2);
        }
    }

    @Test
    void writesPermalinkIntoExistingFrontmatterOnly() throws Exception {
        try (KnowledgeFixture fixture = KnowledgeFixture.create(tempDir)) {
            fixture.write("with.md", "---\ntitle: Has Frontmatter\n---\nbody\n");
            fixture.write("without.md", "# Plain\nbody\n");

            fixture.scan();

            assertThat(fixture.readFile("with.md")).contains("permalink: has-frontmatter");
            assertThat(fixture.readFile("without.md")).isEqualTo("# Plain\nbody\n");
            Entity with = fixture.entityAt("with.md");
            assertThat(with.checksum()).isEqualTo(Checksums.sha256(fixture.readFile("with.md")));
        }
    }

    @Test
    void forwardReferenceResolvesWhenTargetArrives() throws Exception {
        try (KnowledgeFixture fixture = KnowledgeFixture.create(tempDir)) {
            fixture.write("coffee.md", "# Coffee\n- pairs_with [[Tea]] (afternoon)\n");
            fixture.scan();

            Entity coffee = fixture.entityAt("coffee.md");
            assertThat(fixture.store.danglingRelations(fixture.project.id()))
                    .extracting(Relation::targetTitle)
                    .containsExactly("Tea");

            fixture.write("tea.md", "# Tea\n");
            fixture.scan();

            Entity tea = fixture.entityAt("tea.md");
            List<Relation> relations = fixture.store.relationsTouching(fixture.project.id(), List.of(coffee.id()));
            assertThat(relations).singleElement().satisfies(relation -> {
                assertThat(relation.toEntityId()).isEqualTo(tea.id());
                assertThat(relation.relationType()).isEqualTo("pairs_with");
                assertThat(relation.context()).isEqualTo("afternoon");
            });
            assertThat(fixture.store.danglingRelations(fixture.project.id())).isEmpty();
        }
    }

    @Test
    void sameTitleInTwoFoldersGetsSuffixedPermalink() throws Exception {
        try (KnowledgeFixture fixture = KnowledgeFixture.create(tempDir)) {
            fixture.write("a/notes.md", "# Notes\n");
            fixture.write("b/notes.md", "# Notes\n");

            fixture.scan();

            assertThat(fixture.entityAt("a/notes.md").permalink()).isEqualTo("notes");
            assertThat(fixture.entityAt("b/notes.md").permalink()).isEqualTo("notes-1");
        }
    }

    @Test
    void moveKeepsEntityIdentityAndRelations() throws Exception {
        try (KnowledgeFixture fixture = KnowledgeFixture.create(tempDir)) {
            fixture.write("draft.md", "# Draft\n- [fact] keeps #history\n- refines [[Other]]\n");
            fixture.scan();
            Entity before = fixture.entityAt("draft.md");

            fixture.move("draft.md", "archive/draft.md");
            ApplyOutcome outcome = fixture.scan();

            Entity after = fixture.entityAt("archive/draft.md");
            assertThat(outcome.moved()).isEqualTo(1);
            assertThat(outcome.deleted()).isZero();
            assertThat(after.id()).isEqualTo(before.id());
            assertThat(after.permalink()).isEqualTo(before.permalink());
            assertThat(fixture.store.findByFilePath(fixture.project.id(), "draft.md")).isEmpty();
            assertThat(fixture.store.observationsFor(List.of(after.id())).get(after.id())).hasSize(1);
            assertThat(fixture.store.relationsTouching(fixture.project.id(), List.of(after.id()))).hasSize(1);
        }
    }

    @Test
    void watchBatchPairsDeleteAndCreateIntoMove() throws Exception {
        try (KnowledgeFixture fixture = KnowledgeFixture.create(tempDir)) {
            fixture.write("inbox/idea.md", "# Idea\n");
            fixture.scan();
            long id = fixture.entityAt("inbox/idea.md").id();
            fixture.move("inbox/idea.md", "ideas/idea.md");
            ProjectSyncWorker batchWorker = new ProjectSyncWorker(fixture.project, 8, worker -> null);

            ApplyOutcome outcome = fixture.orchestrator.applyBatch(batchWorker, List.of(
                    ChangeEvent.created("ideas/idea.md"),
                    ChangeEvent.deleted("inbox/idea.md")));

            assertThat(outcome.moved()).isEqualTo(1);
            assertThat(outcome.deleted()).isZero();
            assertThat(fixture.entityAt("ideas/idea.md").id()).isEqualTo(id);
            assertThat(fixture.store.findByFilePath(fixture.project.id(), "inbox/idea.md")).isEmpty();
        }
    }

    @Test
    void watchBatchKeepsIdentityWhenDirectoryIsRenamed() throws Exception {
        try (KnowledgeFixture fixture = KnowledgeFixture.create(tempDir)) {
            fixture.write("inbox/idea.md", "# Idea\n");
            fixture.write("inbox/plan.md", "# Plan\n- builds_on [[Idea]]\n");
            fixture.scan();
            long ideaId = fixture.entityAt("inbox/idea.md").id();
            long planId = fixture.entityAt("inbox/plan.md").id();
            fixture.move("inbox", "ideas");
            ProjectSyncWorker batchWorker = new ProjectSyncWorker(fixture.project, 8, worker -> null);

            ApplyOutcome outcome = fixture.orchestrator.applyBatch(batchWorker, List.of(
                    ChangeEvent.deleted("inbox"),
                    ChangeEvent.modified("ideas/idea.md"),
                    ChangeEvent.modified("ideas/plan.md")));

            assertThat(outcome.moved()).isEqualTo(2);
            assertThat(outcome.deleted()).isZero();
            assertThat(outcome.created()).isZero();
            assertThat(fixture.entityAt("ideas/idea.md").id()).isEqualTo(ideaId);
            assertThat(fixture.entityAt("ideas/plan.md").id()).isEqualTo(planId);
            assertThat(fixture.store.relationsTouching(fixture.project.id(), List.of(planId)))
                    .extracting(Relation::toEntityId)
                    .containsExactly(ideaId);
            assertThat(fixture.store.countEntities(fixture.project.id())).isEqualTo(2);
        }
    }

    @Test
    void permalinkWriteBackKeepsQuotedScalarsAsStrings() throws Exception {
        try (KnowledgeFixture fixture = KnowledgeFixture.create(tempDir)) {
            fixture.write("release.md", "---\ntitle: Release\nversion: \"1.0\"\nzip: \"02134\"\nflag: \"yes\"\n---\nbody\n");

            fixture.scan();

            String after = fixture.readFile("release.md");
            FrontmatterCodec.Decoded decoded = fixture.codec.decode(after);
            assertThat(after).contains("permalink: release");
            assertThat(decoded.values())
                    .containsEntry("version", "1.0")
                    .containsEntry("zip", "02134")
                    .containsEntry("flag", "yes");
            assertThat(fixture.entityAt("release.md").frontmatter())
                    .containsEntry("version", "1.0")
                    .containsEntry("zip", "02134");
            assertThat(fixture.scan().total()).isZero();
        }
    }

    @Test
    void malformedFrontmatterStillIndexesBodyAndLeavesFileAlone() throws Exception {
        try (KnowledgeFixture fixture = KnowledgeFixture.create(tempDir)) {
            String original = "---\ntitle: [unclosed\n---\n# Broken Header\n- [idea] still parsed\n";
            fixture.write("broken.md", original);

            ApplyOutcome outcome = fixture.scan();

            Entity entity = fixture.entityAt("broken.md");
            assertThat(outcome.degraded()).containsExactly("broken.md");
            assertThat(entity.title()).isEqualTo("Broken Header");
            assertThat(fixture.store.observationsFor(List.of(entity.id())).get(entity.id())).hasSize(1);
            assertThat(fixture.readFile("broken.md")).isEqualTo(original);
            assertThat(fixture.orchestrator.syncStatus(KnowledgeFixture.PROJECT).degradedPaths())
                    .containsExactly("broken.md");
        }
    }

    @Test
    void deletedFileRemovesEntityAndDanglesIncomingRelations() throws Exception {
        try (KnowledgeFixture fixture = KnowledgeFixture.create(tempDir)) {
            fixture.write("coffee.md", "# Coffee\n- pairs_with [[Tea]]\n");
            fixture.write("tea.md", "# Tea\n");
            fixture.scan();

            Files.delete(fixture.root.resolve("tea.md"));
            ApplyOutcome outcome = fixture.scan();

            assertThat(outcome.deleted()).isEqualTo(1);
            assertThat(fixture.store.findByFilePath(fixture.project.id(), "tea.md")).isEmpty();
            assertThat(fixture.store.danglingRelations(fixture.project.id()))
                    .extracting(Relation::targetTitle)
                    .containsExactly("Tea");
        }
    }

    @Test
    void binaryFilesAreIndexedAsFileEntities() throws Exception {
        try (KnowledgeFixture fixture = KnowledgeFixture.create(tempDir)) {
            Files.createDirectories(fixture.root.resolve("img"));
            Files.write(fixture.root.resolve("img/logo.png"), new byte[]{(byte) 0x89, 'P', 'N', 'G'});
            fixture.write(".git/config", "ignored");
            fixture.write("scratch.tmp", "ignored");

            fixture.scan();

            Entity logo = fixture.entityAt("img/logo.png");
            assertThat(logo.entityType()).isEqualTo(Entity.FILE_TYPE);
            assertThat(logo.title()).isEqualTo("logo.png");
            assertThat(logo.contentType()).isEqualTo("image/png");
            assertThat(fixture.store.countEntities(fixture.project.id())).isEqualTo(1);
        }
    }

    @Test
    void scanCeilingDefersRemainingWork() throws Exception {
        SyncSettings tight = new SyncSettings(false, Duration.ofMillis(50), 64, Duration.ofNanos(1), false, true);
        try (KnowledgeFixture fixture = KnowledgeFixture.create(tempDir, tight)) {
            fixture.write("one.md", "# One\n");
            fixture.write("two.md", "# Two\n");
            fixture.write("three.md", "# Three\n");

            ApplyOutcome first = fixture.scan();
            for (int i = 0; i < 5 && fixture.store.countEntities(fixture.project.id()) < 3; i++) {
                fixture.scan();
            }

            assertThat(first.deferred()).isTrue();
            assertThat(first.created()).isGreaterThanOrEqualTo(1);
            assertThat(fixture.store.countEntities(fixture.project.id())).isEqualTo(3);
        }
    }

    @Test
    void storeFailureHaltsProjectUntilReset() throws Exception {
        ProjectStorePort projects = mock(ProjectStorePort.class);
        KnowledgeStorePort store = mock(KnowledgeStorePort.class);
        FilePort files = mock(FilePort.class);
        Project project = new Project(1L, "main", "main", tempDir, true, Instant.EPOCH);
        when(projects.findByPermalink("main")).thenReturn(Optional.of(project));
        when(projects.findAll()).thenReturn(List.of(project));
        when(store.fileChecksums(anyLong()))
                .thenThrow(new StoreConsistencyException("disk full"))
                .thenReturn(Map.of());
        SyncSettings settings = KnowledgeFixture.unwatched();
        SyncOrchestrator orchestrator = new SyncOrchestrator(projects, store, files,
                new ChangeDetector(files, store),
                new FileIndexer(files, store, new MarkdownKnowledgeParser(new FrontmatterCodec()),
                        new MarkdownWriter(new FrontmatterCodec()), new PermalinkResolver(store), settings),
                mock(ChangeWatcherPort.class), SystemClockAdapter.system(), settings);
        try {
            CompletableFuture<ApplyOutcome> failed = orchestrator.requestFullScan("main");
            assertThatThrownBy(() -> failed.get(10, TimeUnit.SECONDS))
                    .hasCauseInstanceOf(StoreConsistencyException.class);
            assertThat(orchestrator.syncStatus("main").state()).isEqualTo(SyncState.ERROR);
            assertThat(orchestrator.syncStatus("main").lastError()).contains("disk full");

            CompletableFuture<ApplyOutcome> refused = orchestrator.requestFullScan("main");
            assertThatThrownBy(() -> refused.get(10, TimeUnit.SECONDS))
                    .hasCauseInstanceOf(StoreConsistencyException.class);

            orchestrator.reset("main");
            ApplyOutcome recovered = orchestrator.requestFullScan("main").get(10, TimeUnit.SECONDS);

            assertThat(recovered.total()).isZero();
            assertThat(orchestrator.syncStatus("main").state()).isEqualTo(SyncState.IDLE);
        } finally {
            orchestrator.stopAll();
        }
    }

    @Test
    void statusListsEveryRegisteredProject() throws Exception {
        try (KnowledgeFixture fixture = KnowledgeFixture.create(tempDir)) {
            fixture.projectService.createProject("Side Project", tempDir.resolve("side"), false);
            fixture.scan();

            assertThat(fixture.orchestrator.syncStatuses())
                    .extracting(status -> status.project())
                    .containsExactly("main", "side-project");
            assertThat(fixture.orchestrator.syncStatus(null).project()).isEqualTo("main");
        }
    }
}
