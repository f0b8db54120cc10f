package com.pageharvest.core.service;

import com.pageharvest.core.model.ProgressSnapshot;
import com.pageharvest.core.util.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 실행 한 번의 진행 카운터.
 * 갱신은 하나의 락 안에서만 하고, 로그/콜백은 락 밖에서 한다.
 */
public final class ProgressTracker {
    private static final Logger LOG = LoggerFactory.getLogger(ProgressTracker.class);
    private static final long MB = 1024L * 1024L;

    private final int total;
    private final ProgressListener listener;
    private final int logEvery;
    private final long startNanos = System.nanoTime();

    private final ReentrantLock lock = new ReentrantLock();
    // ---- lock 보호 ----
    private long processed;
    private long succeeded;
    private long failed;
    private long retried;
    private long clientsRecycled;
    private long heapPeakMb;
    private final Set<String> seen = new HashSet<>();

    public ProgressTracker(int total, ProgressListener listener) {
        this.total = Math.max(0, total);
        this.listener = (listener != null) ? listener : ProgressListener.NONE;
        // 대략 5% 간격으로 INFO 진행 로그
        this.logEvery = Math.max(1, this.total / 20);
    }

    /**
     * 시도 한 번 반영.
     * @param success 성공(최종)
     * @param retry   재큐잉됨. success=false일 때만 의미 있음. 둘 다 false면 최종 실패.
     */
    public void update(String identity, boolean success, boolean retry) {
        ProgressSnapshot s;
        lock.lock();
        try {
            processed++;
            seen.add(identity);
            if (success) succeeded++;
            else if (retry) retried++;
            else failed++;
            s = snapshotLocked();
        } finally {
            lock.unlock();
        }

        if (s.processed % logEvery == 0 || (!retry && s.completed() == total)) {
            LOG.info(progressLine(s));
        } else if (LOG.isDebugEnabled()) {
            LOG.debug(progressLine(s));
        }
        try {
            listener.onProgress(s.progress(), "fetch", s.completed(), s.total);
        } catch (RuntimeException e) {
            LOG.debug("Progress listener failed: {}", e.toString());
        }
    }

    public void recordRecycle() {
        lock.lock();
        try {
            clientsRecycled++;
        } finally {
            lock.unlock();
        }
    }

    public ProgressSnapshot snapshot() {
        lock.lock();
        try {
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    public int getTotal() { return total; }

    public void logSummary() {
        ProgressSnapshot s = snapshot();
        LOG.info("Fetch summary: total={}, successful={}, failed={}, retries={}, uniqueSeen={}, clientsRecycled={}, "
                        + "elapsed={}s, rate={}/s, heapUsed={}MB, heapPeak={}MB",
                s.total, s.succeeded, s.failed, s.retried, s.uniqueSeen, s.clientsRecycled,
                String.format(Locale.ROOT, "%.1f", s.elapsedMs / 1000.0), String.format(Locale.ROOT, "%.2f", s.itemsPerSecond()),
                s.heapUsedMb, s.heapPeakMb);
    }

    private ProgressSnapshot snapshotLocked() {
        Runtime rt = Runtime.getRuntime();
        long usedMb = (rt.totalMemory() - rt.freeMemory()) / MB;
        heapPeakMb = Math.max(heapPeakMb, usedMb);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        return new ProgressSnapshot(total, processed, succeeded, failed, retried, seen.size(),
                clientsRecycled, elapsedMs, usedMb, heapPeakMb);
    }

    static String progressLine(ProgressSnapshot s) {
        return String.format(Locale.ROOT, "Progress: %.1f%% (%d/%d) | Success: %d | Failed: %d | Retries: %d | Rate: %.2f/s | Heap: %dMB",
                s.progress() * 100.0, s.completed(), s.total, s.succeeded, s.failed, s.retried,
                s.itemsPerSecond(), s.heapUsedMb);
    }
}
