package com.my.memory.domain.service;

import com.my.memory.domain.model.Entity;
import com.my.memory.domain.model.ProjectScope;
import com.my.memory.domain.port.out.KnowledgeStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PermalinkResolverTest {

    private static final ProjectScope SCOPE = new ProjectScope(1L, "main", Path.of("/tmp/main"));

    private KnowledgeStorePort store;
    private PermalinkResolver resolver;

    @BeforeEach
    void setUp() {
        store = mock(KnowledgeStorePort.class);
        resolver = new PermalinkResolver(store);
    }

    @Test
    void freeRequestedPermalinkIsUsedAfterTrimmingSlashes() {
        assertThat(resolver.resolve(SCOPE, "a.md", "Title", "/custom/path/")).isEqualTo("custom/path");
    }

    @Test
    void requestedPermalinkOwnedByAnotherFileFallsBackToTitle() {
        when(store.findByPermalink(1L, "taken")).thenReturn(Optional.of(entity(9L, "taken", "other.md")));

        assertThat(resolver.resolve(SCOPE, "a.md", "My Title", "taken")).isEqualTo("my-title");
    }

    @Test
    void existingEntityKeepsItsPermalink() {
        when(store.findByFilePath(1L, "a.md")).thenReturn(Optional.of(entity(3L, "kept-value", "a.md")));

        assertThat(resolver.resolve(SCOPE, "a.md", "Renamed Title", null)).isEqualTo("kept-value");
    }

    @Test
    void collisionsGetNumericSuffixes() {
        when(store.findByPermalink(1L, "notes")).thenReturn(Optional.of(entity(1L, "notes", "a/notes.md")));
        when(store.findByPermalink(1L, "notes-1")).thenReturn(Optional.of(entity(2L, "notes-1", "b/notes.md")));

        assertThat(resolver.resolve(SCOPE, "c/notes.md", "Notes", null)).isEqualTo("notes-2");
    }

    @Test
    void regenerateDoesNotCollideWithItself() {
        when(store.findByPermalink(1L, "plan")).thenReturn(Optional.of(entity(5L, "plan", "old/plan.md")));

        assertThat(resolver.regenerate(SCOPE, 5L, "new/plan.md", "Plan")).isEqualTo("plan");
        assertThat(resolver.regenerate(SCOPE, 6L, "new/plan.md", "Plan")).isEqualTo("plan-1");
    }

    private static Entity entity(long id, String permalink, String path) {
        return new Entity(id, 1L, permalink, permalink, path, "note", "text/markdown", "c",
                Map.of(), "", List.of(), Instant.EPOCH, Instant.EPOCH);
    }
}
