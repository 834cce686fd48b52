package com.my.memory.domain.service;

import com.my.memory.domain.exception.StoreConsistencyException;
import com.my.memory.domain.exception.WatchStreamOverflowException;
import com.my.memory.domain.model.ApplyOutcome;
import com.my.memory.domain.model.Project;
import com.my.memory.domain.model.ProjectSyncStatus;
import com.my.memory.domain.model.SyncState;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * 프로젝트 하나의 모든 쓰기를 단일 스레드에서 도착 순서대로 실행한다.
 * 큐가 가득 차면 작업을 버리고 전체 재스캔을 예약한다.
 */
public class ProjectSyncWorker {

    private static final Logger log = Logger.getLogger(ProjectSyncWorker.class);

    private final Project project;
    private final ThreadPoolExecutor executor;
    private final SyncStatusTracker status;
    private final Function<ProjectSyncWorker, ApplyOutcome> fullScan;
    private final AtomicBoolean rescanPending = new AtomicBoolean();
    private final AtomicBoolean rescanQueued = new AtomicBoolean();
    private volatile boolean stopping;

    public ProjectSyncWorker(Project project, int queueCapacity, Function<ProjectSyncWorker, ApplyOutcome> fullScan) {
        this.project = project;
        this.fullScan = fullScan;
        this.status = new SyncStatusTracker(project.permalink());
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                runnable -> {
                    Thread thread = new Thread(runnable, "sync-" + project.permalink());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    public Project project() {
        return project;
    }

    public SyncStatusTracker tracker() {
        return status;
    }

    public ProjectSyncStatus status() {
        return status.snapshot();
    }

    public boolean isHalted() {
        return status.state() == SyncState.ERROR;
    }

    public <T> CompletableFuture<T> submit(String label, Callable<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        if (stopping) {
            future.completeExceptionally(new RejectedExecutionException("동기화가 중지된 프로젝트입니다: " + project.permalink()));
            return future;
        }
        if (isHalted()) {
            future.completeExceptionally(halted());
            return future;
        }
        try {
            executor.execute(() -> run(label, task, future));
        } catch (RejectedExecutionException e) {
            log.warnf("작업 큐가 가득 찼습니다. 전체 재스캔을 예약합니다: project=%s, task=%s", project.permalink(), label);
            rescanPending.set(true);
            future.completeExceptionally(new WatchStreamOverflowException("작업 큐 초과: " + project.permalink()));
        }
        return future;
    }

    public CompletableFuture<ApplyOutcome> submitFullScan() {
        return submit("full-scan", () -> fullScan.apply(this));
    }

    /**
     * 현재 작업과 이미 대기 중인 작업 뒤에 전체 재스캔을 한 번만 예약한다.
     */
    public void requestRescan() {
        if (rescanPending.compareAndSet(false, true)) {
            scheduleRescanIfPending();
        }
    }

    public boolean rescanPending() {
        return rescanPending.get();
    }

    public void reset() {
        status.reset();
        log.infof("동기화 오류 상태 해제: project=%s", project.permalink());
    }

    /**
     * 실행 중인 작업은 끝까지 수행하고 대기 중인 작업은 실행하지 않는다.
     */
    public void stop(Duration timeout) {
        stopping = true;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warnf("동기화 워커가 제한 시간 안에 끝나지 않았습니다: project=%s", project.permalink());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private <T> void run(String label, Callable<T> task, CompletableFuture<T> future) {
        if (stopping) {
            future.cancel(false);
            return;
        }
        if (isHalted()) {
            future.completeExceptionally(halted());
            return;
        }
        MDC.put("project", project.permalink());
        try {
            future.complete(task.call());
        } catch (StoreConsistencyException e) {
            status.fail(e.getMessage());
            log.errorf(e, "저장소 일관성 오류로 쓰기를 중단합니다: project=%s, task=%s", project.permalink(), label);
            future.completeExceptionally(e);
        } catch (Exception e) {
            log.warnf("동기화 작업 실패: project=%s, task=%s, error=%s", project.permalink(), label, e.getMessage());
            future.completeExceptionally(e);
        } finally {
            MDC.remove("project");
            scheduleRescanIfPending();
        }
    }

    private void scheduleRescanIfPending() {
        if (!rescanPending.get() || stopping || isHalted() || !rescanQueued.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(() -> {
                rescanQueued.set(false);
                if (rescanPending.getAndSet(false)) {
                    run("rescan", () -> fullScan.apply(this), new CompletableFuture<>());
                }
            });
        } catch (RejectedExecutionException e) {
            rescanQueued.set(false);
            log.debugf("재스캔은 다음 작업 뒤로 미룹니다: project=%s", project.permalink());
        }
    }

    private StoreConsistencyException halted() {
        return new StoreConsistencyException("오류 상태라 쓰기를 받지 않습니다: " + project.permalink());
    }
}
