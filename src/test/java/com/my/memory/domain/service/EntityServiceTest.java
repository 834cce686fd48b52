package com.my.memory.domain.service;

import com.my.memory.domain.exception.CrossProjectReferenceException;
import com.my.memory.domain.exception.EntityNotFoundException;
import com.my.memory.domain.exception.InvalidRequestException;
import com.my.memory.domain.model.Entity;
import com.my.memory.domain.model.EntityContent;
import com.my.memory.domain.model.Observation;
import com.my.memory.domain.model.Relation;
import com.my.memory.domain.model.WriteEntityCommand;
import com.my.memory.domain.model.WriteResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityServiceTest {

    @TempDir
    Path tempDir;

    private KnowledgeFixture fixture;
    private EntityService service;

    @BeforeEach
    void setUp() {
        fixture = KnowledgeFixture.create(tempDir);
        service = new EntityService(fixture.projectResolver, fixture.store, fixture.files, fixture.orchestrator,
                fixture.indexer, fixture.permalinks, fixture.codec, fixture.writer);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void writeCreatesFileWithFrontmatterAndIndexesIt() throws Exception {
        WriteResult result = service.writeEntity(new WriteEntityCommand("Coffee Beans",
                "Notes on beans\n- [taste] bitter #coffee\n- pairs_with [[Tea]]\n",
                "food", List.of("drink"), null, null));

        assertThat(result.created()).isTrue();
        assertThat(result.permalink()).isEqualTo("coffee-beans");
        assertThat(result.entity().filePath()).isEqualTo("food/Coffee_Beans.md");

        String file = fixture.readFile("food/Coffee_Beans.md");
        assertThat(file).startsWith("---\ntitle: Coffee Beans\ntype: note\npermalink: coffee-beans\n");
        assertThat(file).endsWith("---\nNotes on beans\n- [taste] bitter #coffee\n- pairs_with [[Tea]]\n");

        Entity entity = result.entity();
        assertThat(entity.tags()).containsExactly("drink");
        assertThat(fixture.store.observationsFor(List.of(entity.id())).get(entity.id()))
                .extracting(Observation::category)
                .containsExactly("taste");
        assertThat(fixture.store.relationsTouching(fixture.project.id(), List.of(entity.id())))
                .extracting(Relation::targetTitle)
                .containsExactly("Tea");
    }

    @Test
    void rewritingSameTitleUpdatesInPlace() throws Exception {
        WriteResult first = service.writeEntity(new WriteEntityCommand("Daily Log", "v1", "", List.of(), null, null));
        WriteResult second = service.writeEntity(new WriteEntityCommand("Daily Log", "v2", "", List.of(), null, null));

        assertThat(second.created()).isFalse();
        assertThat(second.entity().id()).isEqualTo(first.entity().id());
        assertThat(second.permalink()).isEqualTo(first.permalink());
        assertThat(fixture.readFile("Daily_Log.md")).endsWith("---\nv2");
        assertThat(fixture.scan().total()).isZero();
    }

    @Test
    void readReturnsBodyFromDiskByPermalinkOrUrl() {
        service.writeEntity(new WriteEntityCommand("Reading List", "- [book] Dune #scifi\n", "lists", List.of(), "list", null));

        EntityContent byPermalink = service.readEntity("reading-list", null);
        EntityContent byUrl = service.readEntity("memory://main/reading-list", null);
        EntityContent byPath = service.readEntity("lists/Reading_List", null);

        assertThat(byPermalink.body()).isEqualTo("- [book] Dune #scifi\n");
        assertThat(byPermalink.frontmatter()).containsEntry("type", "list");
        assertThat(byPermalink.rawText()).startsWith("---\n");
        assertThat(byUrl.entity().id()).isEqualTo(byPermalink.entity().id());
        assertThat(byPath.entity().id()).isEqualTo(byPermalink.entity().id());
    }

    @Test
    void markdownNoteTypedAsFileStillBehavesAsMarkdown() throws Exception {
        fixture.write("typed.md", "---\ntitle: Typed\ntype: file\n---\nhello\n");
        fixture.scan();

        EntityContent content = service.readEntity("typed", null);
        Entity moved = service.moveEntity("typed", "archive/typed", null);

        assertThat(content.entity().entityType()).isEqualTo("file");
        assertThat(content.body()).isEqualTo("hello\n");
        assertThat(moved.filePath()).isEqualTo("archive/typed.md");
    }

    @Test
    void readOfUnknownReferenceFails() {
        assertThatThrownBy(() -> service.readEntity("nothing-here", null))
                .isInstanceOf(EntityNotFoundException.class);
    }

    @Test
    void referenceToAnotherProjectIsRejected() {
        service.writeEntity(new WriteEntityCommand("Local", "body", "", List.of(), null, null));

        assertThatThrownBy(() -> service.readEntity("memory://other/local", "main"))
                .isInstanceOf(CrossProjectReferenceException.class);
    }

    @Test
    void moveKeepsIdentityAndAddsExtension() throws Exception {
        WriteResult written = service.writeEntity(new WriteEntityCommand("Plan", "steps", "", List.of(), null, null));

        Entity moved = service.moveEntity("plan", "archive/old-plan", null);

        assertThat(moved.id()).isEqualTo(written.entity().id());
        assertThat(moved.filePath()).isEqualTo("archive/old-plan.md");
        assertThat(Files.exists(fixture.root.resolve("Plan.md"))).isFalse();
        assertThat(Files.exists(fixture.root.resolve("archive/old-plan.md"))).isTrue();
        assertThat(fixture.scan().total()).isZero();
    }

    @Test
    void moveOntoExistingFileIsRejected() {
        service.writeEntity(new WriteEntityCommand("One", "a", "", List.of(), null, null));
        service.writeEntity(new WriteEntityCommand("Two", "b", "", List.of(), null, null));

        assertThatThrownBy(() -> service.moveEntity("one", "Two.md", null))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void deleteRemovesFileAndEntity() {
        service.writeEntity(new WriteEntityCommand("Scratch", "temp", "", List.of(), null, null));

        assertThat(service.deleteEntity("scratch", null)).isTrue();
        assertThat(Files.exists(fixture.root.resolve("Scratch.md"))).isFalse();
        assertThat(fixture.store.findByPermalink(fixture.project.id(), "scratch")).isEmpty();
        assertThat(service.deleteEntity("scratch", null)).isFalse();
    }

    @Test
    void pathsEscapingTheRootAreRejected() {
        assertThat(EntityService.normalizePath("/a//b/./c")).isEqualTo("a/b/c");
        assertThatThrownBy(() -> EntityService.normalizePath("../outside"))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.writeEntity(
                new WriteEntityCommand("Escape", "x", "notes/../../up", List.of(), null, null)))
                .isInstanceOf(InvalidRequestException.class);
    }
}
