package com.my.memory.adapter.in.watch;

import com.my.memory.config.AppConfig;
import com.my.memory.domain.model.ChangeEvent;
import com.my.memory.domain.model.ProjectScope;
import com.my.memory.domain.policy.IgnorePolicy;
import com.my.memory.domain.port.out.ChangeListener;
import com.my.memory.domain.port.out.ChangeWatcherPort;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 왜: 프로젝트 루트 아래 변경을 OS 이벤트로 받아 디바운스한 뒤 프로젝트 워커에 묶음으로 넘기기 위함.
 * 이벤트 유실(OVERFLOW)이나 감시 실패는 전체 재스캔 요청으로 바뀐다.
 */
@ApplicationScoped
public class FileWatchAdapter implements ChangeWatcherPort {

    private static final Logger log = Logger.getLogger(FileWatchAdapter.class);

    private final Duration debounce;
    private final ExecutorService pollers;
    private final ScheduledExecutorService scheduler;
    private final Map<Long, ProjectWatch> watches = new ConcurrentHashMap<>();

    @Inject
    public FileWatchAdapter(AppConfig appConfig) {
        this(Duration.ofMillis(appConfig.sync().debounceMs()));
    }

    FileWatchAdapter(Duration debounce) {
        this.debounce = debounce;
        AtomicInteger counter = new AtomicInteger();
        this.pollers = Executors.newCachedThreadPool(runnable -> daemon(runnable, "watch-" + counter.incrementAndGet()));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> daemon(runnable, "watch-debounce"));
    }

    @Override
    public void watch(ProjectScope scope, ChangeListener listener) {
        unwatch(scope.projectId());
        try {
            ProjectWatch watch = new ProjectWatch(scope, listener);
            watches.put(scope.projectId(), watch);
            pollers.execute(watch::poll);
            log.infof("파일 감시 시작: project=%s, root=%s", scope.permalink(), scope.rootPath());
        } catch (IOException e) {
            log.warnf("파일 감시를 시작하지 못했습니다: project=%s, error=%s", scope.permalink(), e.getMessage());
            listener.onOverflow("watch-start-failed");
        }
    }

    @Override
    public void unwatch(long projectId) {
        ProjectWatch watch = watches.remove(projectId);
        if (watch != null) {
            watch.close();
        }
    }

    @PreDestroy
    void stop() {
        new ArrayList<>(watches.keySet()).forEach(this::unwatch);
        pollers.shutdownNow();
        scheduler.shutdownNow();
    }

    private static Thread daemon(Runnable runnable, String name) {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        return thread;
    }

    private final class ProjectWatch {

        private final ProjectScope scope;
        private final Path root;
        private final ChangeListener listener;
        private final WatchService service;
        private final Map<WatchKey, Path> keys = new ConcurrentHashMap<>();
        private final ChangeDebouncer debouncer;
        private volatile boolean running = true;

        ProjectWatch(ProjectScope scope, ChangeListener listener) throws IOException {
            this.scope = scope;
            this.root = scope.rootPath().toAbsolutePath().normalize();
            this.listener = listener;
            this.service = root.getFileSystem().newWatchService();
            this.debouncer = new ChangeDebouncer(debounce, scheduler, this::emit);
            registerTree(root, false);
        }

        void poll() {
            while (running) {
                WatchKey key;
                try {
                    key = service.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (ClosedWatchServiceException e) {
                    return;
                }
                Path dir = keys.get(key);
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                        listener.onOverflow("overflow");
                        continue;
                    }
                    if (dir != null) {
                        handle(event, dir.resolve((Path) event.context()));
                    }
                }
                if (!key.reset()) {
                    keys.remove(key);
                    if (root.equals(dir)) {
                        log.warnf("프로젝트 루트 감시가 끊겼습니다: project=%s", scope.permalink());
                        listener.onOverflow("root-invalid");
                    }
                }
            }
        }

        private void handle(WatchEvent<?> event, Path child) {
            String relative = root.relativize(child).toString().replace('\\', '/');
            if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(child)) {
                if (IgnorePolicy.shouldDescend(child.getFileName().toString())
                        && IgnorePolicy.shouldIndex(relative + "/_")) {
                    registerTree(child, true);
                }
                return;
            }
            if (IgnorePolicy.shouldIndex(relative)) {
                debouncer.record(relative);
            }
        }

        /**
         * 새로 생긴 디렉터리는 등록 전에 만들어진 파일을 놓칠 수 있으므로 안의 파일을 변경으로 기록한다.
         */
        private void registerTree(Path start, boolean recordFiles) {
            try {
                Files.walkFileTree(start, new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                        if (!dir.equals(root) && !IgnorePolicy.shouldDescend(dir.getFileName().toString())) {
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        WatchKey key = dir.register(service,
                                StandardWatchEventKinds.ENTRY_CREATE,
                                StandardWatchEventKinds.ENTRY_MODIFY,
                                StandardWatchEventKinds.ENTRY_DELETE);
                        keys.put(key, dir);
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        String relative = root.relativize(file).toString().replace('\\', '/');
                        if (recordFiles && IgnorePolicy.shouldIndex(relative)) {
                            debouncer.record(relative);
                        }
                        return FileVisitResult.CONTINUE;
                    }
                });
            } catch (IOException | ClosedWatchServiceException e) {
                log.warnf("디렉터리 감시 등록 실패: project=%s, dir=%s, error=%s", scope.permalink(), start, e.getMessage());
                listener.onOverflow("register-failed");
            }
        }

        /**
         * 만료 시점의 파일 존재 여부로 이벤트 종류를 정한다. 생성과 수정의 구분은 저장소 상태로 한다.
         */
        private void emit(List<String> paths) {
            List<ChangeEvent> events = new ArrayList<>(paths.size());
            for (String path : paths) {
                events.add(Files.exists(root.resolve(path)) ? ChangeEvent.modified(path) : ChangeEvent.deleted(path));
            }
            listener.onChanges(events);
        }

        void close() {
            running = false;
            debouncer.close();
            try {
                service.close();
            } catch (IOException e) {
                log.debugf("감시 서비스 종료 실패: project=%s, error=%s", scope.permalink(), e.getMessage());
            }
        }
    }
}
