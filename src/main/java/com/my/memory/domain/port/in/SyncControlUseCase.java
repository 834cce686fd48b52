package com.my.memory.domain.port.in;

import com.my.memory.domain.model.ApplyOutcome;
import com.my.memory.domain.model.ProjectSyncStatus;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 프로젝트별 동기화 상태 조회와 운영자 제어.
 */
public interface SyncControlUseCase {

    ProjectSyncStatus syncStatus(String project);

    List<ProjectSyncStatus> syncStatuses();

    CompletableFuture<ApplyOutcome> requestFullScan(String project);

    void reset(String project);
}
