package com.my.memory.adapter.in.watch;

import com.my.memory.domain.model.ChangeEvent;
import com.my.memory.domain.model.ChangeKind;
import com.my.memory.domain.model.ProjectScope;
import com.my.memory.domain.port.out.ChangeListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class FileWatchAdapterTest {

    @TempDir
    Path tempDir;

    private final FileWatchAdapter adapter = new FileWatchAdapter(Duration.ofMillis(100));

    @AfterEach
    void tearDown() {
        adapter.stop();
    }

    @Test
    @SuppressWarnings("unchecked")
    void reportsDebouncedChangesUnderNewDirectories() throws Exception {
        Path root = Files.createDirectories(tempDir.resolve("root"));
        ChangeListener listener = mock(ChangeListener.class);
        adapter.watch(new ProjectScope(1L, "main", root), listener);

        Files.createDirectories(root.resolve("sub"));
        Thread.sleep(200);
        Files.writeString(root.resolve("sub/note.md"), "hello");
        Files.writeString(root.resolve(".hidden.md"), "ignored");

        ArgumentCaptor<List<ChangeEvent>> captor = ArgumentCaptor.forClass(List.class);
        verify(listener, timeout(10_000).atLeastOnce()).onChanges(captor.capture());
        assertThat(captor.getAllValues()).flatExtracting(events -> events)
                .extracting(ChangeEvent::path)
                .contains("sub/note.md")
                .doesNotContain(".hidden.md");
        assertThat(captor.getAllValues()).flatExtracting(events -> events)
                .extracting(ChangeEvent::kind)
                .containsOnly(ChangeKind.MODIFIED);
    }

    @Test
    @SuppressWarnings("unchecked")
    void deletedFilesAreReportedAsDeletions() throws Exception {
        Path root = Files.createDirectories(tempDir.resolve("root"));
        Path file = Files.writeString(root.resolve("gone.md"), "bye");
        ChangeListener listener = mock(ChangeListener.class);
        adapter.watch(new ProjectScope(1L, "main", root), listener);

        Files.delete(file);

        ArgumentCaptor<List<ChangeEvent>> captor = ArgumentCaptor.forClass(List.class);
        verify(listener, timeout(10_000).atLeastOnce()).onChanges(captor.capture());
        assertThat(captor.getAllValues()).flatExtracting(events -> events)
                .contains(ChangeEvent.deleted("gone.md"));
    }
}
