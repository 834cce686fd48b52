package com.my.memory.adapter.in.watch;

import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * 경로별 마지막 이벤트 시각을 모아 두고, 조용한 구간이 지난 경로만 한 번에 넘긴다.
 * 같은 경로의 연속 이벤트는 하나로 합쳐지고 처음 도착한 순서를 유지한다.
 */
class ChangeDebouncer {

    private static final Logger log = Logger.getLogger(ChangeDebouncer.class);

    private final long windowNanos;
    private final ScheduledExecutorService scheduler;
    private final Consumer<List<String>> sink;
    private final LongSupplier nanoTime;
    private final Map<String, Long> pending = new LinkedHashMap<>();
    private ScheduledFuture<?> scheduled;
    private boolean closed;

    ChangeDebouncer(Duration window, ScheduledExecutorService scheduler, Consumer<List<String>> sink) {
        this(window, scheduler, sink, System::nanoTime);
    }

    ChangeDebouncer(Duration window, ScheduledExecutorService scheduler, Consumer<List<String>> sink,
                    LongSupplier nanoTime) {
        this.windowNanos = window.toNanos();
        this.scheduler = scheduler;
        this.sink = sink;
        this.nanoTime = nanoTime;
    }

    synchronized void record(String path) {
        if (closed) {
            return;
        }
        pending.put(path, nanoTime.getAsLong());
        if (scheduled == null || scheduled.isDone()) {
            schedule(windowNanos);
        }
    }

    synchronized int pendingCount() {
        return pending.size();
    }

    synchronized void close() {
        closed = true;
        pending.clear();
        if (scheduled != null) {
            scheduled.cancel(false);
        }
    }

    /**
     * 조용한 구간이 지난 경로를 넘기고, 남은 경로가 있으면 가장 이른 만료 시각에 다시 예약한다.
     */
    void flush() {
        List<String> ready = new ArrayList<>();
        synchronized (this) {
            if (closed) {
                return;
            }
            long now = nanoTime.getAsLong();
            long nextDelay = Long.MAX_VALUE;
            Iterator<Map.Entry<String, Long>> iterator = pending.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<String, Long> entry = iterator.next();
                long quiet = now - entry.getValue();
                if (quiet >= windowNanos) {
                    ready.add(entry.getKey());
                    iterator.remove();
                } else {
                    nextDelay = Math.min(nextDelay, windowNanos - quiet);
                }
            }
            scheduled = null;
            if (!pending.isEmpty()) {
                schedule(nextDelay);
            }
        }
        if (!ready.isEmpty()) {
            try {
                sink.accept(ready);
            } catch (RuntimeException e) {
                log.warnf("변경 묶음 전달 실패: paths=%d, error=%s", ready.size(), e.getMessage());
            }
        }
    }

    private void schedule(long delayNanos) {
        scheduled = scheduler.schedule(this::flush, delayNanos, TimeUnit.NANOSECONDS);
    }
}
