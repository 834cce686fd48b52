package com.my.memory.domain.service;

import com.my.memory.domain.model.ApplyOutcome;
import com.my.memory.domain.model.ProjectSyncStatus;
import com.my.memory.domain.model.SyncState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 프로젝트 하나의 동기화 진행 상태. 워커 스레드가 쓰고 아무 스레드나 스냅샷을 읽는다.
 */
public class SyncStatusTracker {

    private final String project;
    private final Set<String> failedPaths = new LinkedHashSet<>();
    private final Set<String> degradedPaths = new LinkedHashSet<>();
    private SyncState state = SyncState.IDLE;
    private String message = "";
    private int filesTotal;
    private int filesProcessed;
    private String lastError;
    private Instant lastScanAt;

    public SyncStatusTracker(String project) {
        this.project = project;
    }

    public synchronized SyncState state() {
        return state;
    }

    public synchronized void begin(SyncState next, String message, int total) {
        if (state == SyncState.ERROR) {
            return;
        }
        this.state = next;
        this.message = message;
        this.filesTotal = total;
        this.filesProcessed = 0;
    }

    public synchronized void startFullScan() {
        failedPaths.clear();
        degradedPaths.clear();
    }

    public synchronized void advance() {
        filesProcessed++;
    }

    public synchronized void recordFailure(String path, String error) {
        failedPaths.add(path);
        lastError = path + ": " + error;
    }

    public synchronized void recordDegraded(String path) {
        degradedPaths.add(path);
    }

    public synchronized void finish(ApplyOutcome outcome, Instant scannedAt, SyncState settled) {
        if (state == SyncState.ERROR) {
            return;
        }
        state = settled;
        message = outcome.deferred()
                ? "스캔 시간 제한으로 나머지를 다음 스캔으로 미룸"
                : "반영 완료: " + outcome.total() + "건";
        if (scannedAt != null) {
            lastScanAt = scannedAt;
        }
    }

    public synchronized void fail(String error) {
        state = SyncState.ERROR;
        message = "저장소 오류로 쓰기를 중단했습니다.";
        lastError = error;
    }

    public synchronized void reset() {
        state = SyncState.IDLE;
        message = "";
        lastError = null;
        filesTotal = 0;
        filesProcessed = 0;
    }

    public synchronized ProjectSyncStatus snapshot() {
        return new ProjectSyncStatus(project, state, message, filesTotal, filesProcessed,
                new ArrayList<>(failedPaths), new ArrayList<>(degradedPaths), lastError, lastScanAt);
    }
}
