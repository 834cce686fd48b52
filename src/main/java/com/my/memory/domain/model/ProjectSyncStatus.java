package com.my.memory.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record ProjectSyncStatus(
        String project,
        SyncState state,
        String message,
        int filesTotal,
        int filesProcessed,
        List<String> failedPaths,
        List<String> degradedPaths,
        String lastError,
        Instant lastScanAt
) {
    public ProjectSyncStatus {
        Objects.requireNonNull(project, "project");
        Objects.requireNonNull(state, "state");
        failedPaths = failedPaths == null ? List.of() : List.copyOf(failedPaths);
        degradedPaths = degradedPaths == null ? List.of() : List.copyOf(degradedPaths);
    }

    public static ProjectSyncStatus idle(String project) {
        return new ProjectSyncStatus(project, SyncState.IDLE, "", 0, 0, List.of(), List.of(), null, null);
    }
}
