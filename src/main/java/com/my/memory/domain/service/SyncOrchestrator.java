package com.my.memory.domain.service;

import com.my.memory.domain.exception.CrossProjectReferenceException;
import com.my.memory.domain.exception.InvalidRequestException;
import com.my.memory.domain.exception.MarkdownParseException;
import com.my.memory.domain.exception.TransientIoException;
import com.my.memory.domain.model.ApplyOutcome;
import com.my.memory.domain.model.ChangeEvent;
import com.my.memory.domain.model.ChangeKind;
import com.my.memory.domain.model.Entity;
import com.my.memory.domain.model.Project;
import com.my.memory.domain.model.ProjectScope;
import com.my.memory.domain.model.ProjectSyncStatus;
import com.my.memory.domain.model.ScanReport;
import com.my.memory.domain.model.SyncState;
import com.my.memory.domain.port.in.SyncControlUseCase;
import com.my.memory.domain.port.out.ChangeListener;
import com.my.memory.domain.port.out.ChangeWatcherPort;
import com.my.memory.domain.port.out.ClockPort;
import com.my.memory.domain.port.out.FilePort;
import com.my.memory.domain.port.out.KnowledgeStorePort;
import com.my.memory.domain.port.out.ProjectStorePort;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.stream.Stream;

/**
 * 프로젝트별 워커를 관리하고 전체 스캔과 감시 배치를 저장소에 반영한다.
 * 스캔 적용 순서는 이동, 삭제, 생성, 수정이며 마지막에 대상 없는 관계를 다시 해석한다.
 */
public class SyncOrchestrator implements SyncControlUseCase {

    private static final Logger log = Logger.getLogger(SyncOrchestrator.class);
    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(30);

    private final ProjectStorePort projects;
    private final ProjectResolver resolver;
    private final KnowledgeStorePort store;
    private final FilePort files;
    private final ChangeDetector detector;
    private final FileIndexer indexer;
    private final ChangeWatcherPort watcher;
    private final ClockPort clock;
    private final SyncSettings settings;
    private final Map<Long, ProjectSyncWorker> workers = new ConcurrentHashMap<>();

    public SyncOrchestrator(ProjectStorePort projects,
                            KnowledgeStorePort store,
                            FilePort files,
                            ChangeDetector detector,
                            FileIndexer indexer,
                            ChangeWatcherPort watcher,
                            ClockPort clock,
                            SyncSettings settings) {
        this.projects = projects;
        this.resolver = new ProjectResolver(projects);
        this.store = store;
        this.files = files;
        this.detector = detector;
        this.indexer = indexer;
        this.watcher = watcher;
        this.clock = clock;
        this.settings = settings;
    }

    public void startAll() {
        projects.findAll().forEach(this::start);
    }

    /**
     * 감시를 먼저 걸고 초기 스캔을 제출한다. 스캔 중에 들어온 변경은 스캔 뒤에 적용된다.
     */
    public ProjectSyncWorker start(Project project) {
        ProjectSyncWorker worker = workerFor(project);
        files.ensureRoot(project.scope());
        if (settings.watchEnabled()) {
            watcher.watch(project.scope(), listener(worker));
        }
        worker.submitFullScan().whenComplete((outcome, error) -> {
            if (error != null) {
                log.warnf("초기 스캔 실패: project=%s, error=%s", project.permalink(), error.getMessage());
            }
        });
        log.infof("프로젝트 동기화 시작: project=%s, root=%s, watch=%s",
                project.permalink(), project.rootPath(), settings.watchEnabled());
        return worker;
    }

    public void stop(long projectId) {
        watcher.unwatch(projectId);
        ProjectSyncWorker worker = workers.remove(projectId);
        if (worker != null) {
            worker.stop(STOP_TIMEOUT);
            log.infof("프로젝트 동기화 중지: project=%s", worker.project().permalink());
        }
    }

    public void stopAll() {
        new ArrayList<>(workers.keySet()).forEach(this::stop);
    }

    /**
     * 도구 계층의 쓰기를 프로젝트 워커에서 실행하고 끝날 때까지 기다린다.
     */
    public <T> T execute(Project project, String label, Callable<T> task) {
        try {
            return workerFor(project).submit(label, task).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("쓰기 대기 중 인터럽트: " + label, e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    @Override
    public ProjectSyncStatus syncStatus(String project) {
        Project resolved = resolver.resolve(project);
        ProjectSyncWorker worker = workers.get(resolved.id());
        return worker == null ? ProjectSyncStatus.idle(resolved.permalink()) : worker.status();
    }

    @Override
    public List<ProjectSyncStatus> syncStatuses() {
        return projects.findAll().stream()
                .map(project -> Optional.ofNullable(workers.get(project.id()))
                        .map(ProjectSyncWorker::status)
                        .orElseGet(() -> ProjectSyncStatus.idle(project.permalink())))
                .toList();
    }

    @Override
    public CompletableFuture<ApplyOutcome> requestFullScan(String project) {
        return workerFor(resolver.resolve(project)).submitFullScan();
    }

    @Override
    public void reset(String project) {
        workerFor(resolver.resolve(project)).reset();
    }

    ApplyOutcome fullScan(ProjectSyncWorker worker) {
        ProjectScope scope = worker.project().scope();
        SyncStatusTracker tracker = worker.tracker();
        tracker.begin(SyncState.SCANNING, "파일 비교 중", 0);
        tracker.startFullScan();
        ScanReport report = detector.scan(scope);

        tracker.begin(SyncState.APPLYING, "변경 반영 중", report.total());
        OutcomeCounter counter = new OutcomeCounter();
        report.errors().forEach((path, error) -> {
            counter.failed.add(path);
            tracker.recordFailure(path, error);
        });
        long deadline = settings.hasScanCeiling()
                ? System.nanoTime() + settings.maxScanDuration().toNanos()
                : Long.MAX_VALUE;
        boolean deferred = false;
        int processed = 0;
        List<ChangeEvent> ordered = Stream.of(report.moves(), report.deletions(), report.creations(), report.modifications())
                .flatMap(List::stream)
                .toList();
        for (ChangeEvent event : ordered) {
            if (processed > 0 && System.nanoTime() > deadline) {
                deferred = true;
                break;
            }
            apply(scope, event, counter, tracker);
            processed++;
        }
        if (!deferred) {
            int linked = store.resolveDanglingRelations(scope.projectId());
            if (linked > 0) {
                log.debugf("대상 없는 관계 %d 건 연결: project=%s", linked, scope.permalink());
            }
        }
        ApplyOutcome outcome = counter.toOutcome(deferred);
        tracker.finish(outcome, clock.now(), settledState());
        if (deferred) {
            log.infof("스캔 시간 제한 도달, 남은 %d 건은 재스캔으로 미룹니다: project=%s",
                    ordered.size() - processed, scope.permalink());
            worker.requestRescan();
        }
        log.infof("전체 스캔 완료: project=%s, created=%d, modified=%d, moved=%d, deleted=%d, failed=%d, entities=%d",
                scope.permalink(), outcome.created(), outcome.modified(), outcome.moved(), outcome.deleted(),
                outcome.failed().size(), store.countEntities(scope.projectId()));
        return outcome;
    }

    ApplyOutcome applyBatch(ProjectSyncWorker worker, List<ChangeEvent> events) {
        ProjectScope scope = worker.project().scope();
        SyncStatusTracker tracker = worker.tracker();
        List<ChangeEvent> ordered = pairMoves(scope, events);
        tracker.begin(SyncState.APPLYING, "변경 반영 중", ordered.size());
        OutcomeCounter counter = new OutcomeCounter();
        for (ChangeEvent event : ordered) {
            apply(scope, event, counter, tracker);
        }
        ApplyOutcome outcome = counter.toOutcome(false);
        tracker.finish(outcome, null, settledState());
        log.debugf("감시 배치 반영: project=%s, events=%d, changed=%d", scope.permalink(), events.size(), outcome.total());
        return outcome;
    }

    /**
     * 같은 배치 안에서 삭제된 경로와 checksum 이 같은 새 경로를 이동으로 묶는다. 이동이 먼저 적용된다.
     * 삭제된 디렉터리는 그 아래 엔티티별 삭제로 펼친 뒤 묶는다.
     */
    List<ChangeEvent> pairMoves(ProjectScope scope, List<ChangeEvent> batch) {
        List<ChangeEvent> events = expandDirectoryDeletions(scope, batch);
        Map<String, Deque<String>> deletedByChecksum = new HashMap<>();
        for (ChangeEvent event : events) {
            if (event.kind() == ChangeKind.DELETED) {
                store.findByFilePath(scope.projectId(), event.path())
                        .map(Entity::checksum)
                        .ifPresent(checksum -> deletedByChecksum.computeIfAbsent(checksum, k -> new ArrayDeque<>())
                                .add(event.path()));
            }
        }
        if (deletedByChecksum.isEmpty()) {
            return events;
        }
        List<ChangeEvent> moves = new ArrayList<>();
        Set<String> consumed = new HashSet<>();
        for (ChangeEvent event : events) {
            if (event.kind() == ChangeKind.DELETED || event.kind() == ChangeKind.MOVED) {
                continue;
            }
            if (store.findByFilePath(scope.projectId(), event.path()).isPresent()
                    || files.isDirectory(scope, event.path())) {
                continue;
            }
            String checksum;
            try {
                checksum = files.checksum(scope, event.path());
            } catch (TransientIoException e) {
                continue;
            }
            Deque<String> sources = deletedByChecksum.get(checksum);
            if (sources != null && !sources.isEmpty()) {
                String from = sources.poll();
                moves.add(ChangeEvent.moved(from, event.path()));
                consumed.add(from);
                consumed.add(event.path());
            }
        }
        List<ChangeEvent> ordered = new ArrayList<>(moves);
        for (ChangeEvent event : events) {
            if (event.kind() == ChangeKind.MOVED || !consumed.contains(event.path())) {
                ordered.add(event);
            }
        }
        return ordered;
    }

    private List<ChangeEvent> expandDirectoryDeletions(ProjectScope scope, List<ChangeEvent> events) {
        List<ChangeEvent> expanded = new ArrayList<>(events.size());
        for (ChangeEvent event : events) {
            if (event.kind() != ChangeKind.DELETED) {
                expanded.add(event);
                continue;
            }
            List<Entity> children = indexer.entitiesUnder(scope, event.path());
            if (children.isEmpty()) {
                expanded.add(event);
            } else {
                children.forEach(child -> expanded.add(ChangeEvent.deleted(child.filePath())));
            }
        }
        return expanded;
    }

    private void apply(ProjectScope scope, ChangeEvent event, OutcomeCounter counter, SyncStatusTracker tracker) {
        MDC.put("path", event.path());
        try {
            switch (event.kind()) {
                case MOVED -> {
                    indexer.move(scope, event.previousPath(), event.path());
                    counter.moved++;
                }
                case DELETED -> counter.deleted += indexer.delete(scope, event.path());
                case CREATED, MODIFIED -> {
                    if (files.isDirectory(scope, event.path())) {
                        return;
                    }
                    FileIndexer.IndexResult result = indexer.index(scope, event.path());
                    counter.record(result);
                    if (result.kind() == FileIndexer.IndexKind.VANISHED) {
                        counter.deleted += indexer.delete(scope, event.path());
                    }
                    if (result.degraded()) {
                        tracker.recordDegraded(event.path());
                    }
                }
            }
        } catch (TransientIoException | MarkdownParseException | CrossProjectReferenceException
                 | InvalidRequestException e) {
            counter.failed.add(event.path());
            tracker.recordFailure(event.path(), e.getMessage());
            log.warnf("파일 반영 실패, 다음 스캔에서 다시 시도합니다: project=%s, path=%s, error=%s",
                    scope.permalink(), event.path(), e.getMessage());
        } finally {
            tracker.advance();
            MDC.remove("path");
        }
    }

    private ChangeListener listener(ProjectSyncWorker worker) {
        return new ChangeListener() {
            @Override
            public void onChanges(List<ChangeEvent> events) {
                worker.submit("watch-batch", () -> applyBatch(worker, events));
            }

            @Override
            public void onOverflow(String reason) {
                log.warnf("파일 감시 이벤트 유실 가능성, 전체 재스캔: project=%s, reason=%s",
                        worker.project().permalink(), reason);
                worker.requestRescan();
            }
        };
    }

    private ProjectSyncWorker workerFor(Project project) {
        return workers.computeIfAbsent(project.id(),
                id -> new ProjectSyncWorker(project, settings.queueCapacity(), this::fullScan));
    }

    private SyncState settledState() {
        return settings.watchEnabled() ? SyncState.WATCHING : SyncState.IDLE;
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IllegalStateException(cause);
    }

    private static final class OutcomeCounter {
        private int created;
        private int modified;
        private int moved;
        private int deleted;
        private int unchanged;
        private final List<String> degraded = new ArrayList<>();
        private final List<String> failed = new ArrayList<>();

        void record(FileIndexer.IndexResult result) {
            switch (result.kind()) {
                case CREATED -> created++;
                case MODIFIED -> modified++;
                case MOVED -> moved++;
                case UNCHANGED -> unchanged++;
                case VANISHED -> {
                }
            }
            if (result.degraded()) {
                degraded.add(result.path());
            }
        }

        ApplyOutcome toOutcome(boolean deferred) {
            return new ApplyOutcome(created, modified, moved, deleted, unchanged, degraded, failed, deferred);
        }
    }
}
