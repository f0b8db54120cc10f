package com.pageharvest.core.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pageharvest.core.model.ProgressSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.function.Supplier;

/**
 * ProgressSnapshot을 주기적으로 NDJSON으로 기록한다.
 * - 단일 writer 유지(Append)
 * - close() 시 마지막 스냅샷 한 줄을 더 남긴다
 */
public final class ProgressDumper implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ProgressDumper.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Supplier<ProgressSnapshot> snapshotSupplier;
    private final Path outFile;
    private final long periodMs;

    private final ScheduledExecutorService ses;
    private BufferedWriter writer;
    private final Object lock = new Object();
    private volatile boolean started = false;
    private volatile boolean closed  = false;

    public ProgressDumper(Supplier<ProgressSnapshot> snapshotSupplier, Path outFile, long periodMs) {
        this.snapshotSupplier = Objects.requireNonNull(snapshotSupplier, "snapshotSupplier");
        this.outFile = Objects.requireNonNull(outFile, "outFile");
        this.periodMs = Math.max(100L, periodMs);
        this.ses = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "progress-dumper");
            t.setDaemon(true);
            return t;
        });
    }

    /** 주기적 기록 시작(중복 호출 안전) */
    public void start() throws IOException {
        if (started || closed) return;
        synchronized (lock) {
            if (started || closed) return;

            Path parent = outFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            writer = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);

            ses.scheduleAtFixedRate(this::safeWriteOnce, periodMs, periodMs, TimeUnit.MILLISECONDS);
            started = true;
        }
    }

    private void safeWriteOnce() {
        try {
            writeOnce();
        } catch (IOException | RuntimeException e) {
            LOG.warn("Progress dump to {} failed: {}", outFile, e.toString());
        }
    }

    private void writeOnce() throws IOException {
        ProgressSnapshot s = snapshotSupplier.get();
        if (s == null) return;

        String json = toNdjson(s);
        synchronized (lock) {
            if (writer == null) return;
            writer.write(json);
            writer.newLine();
            writer.flush();
        }
    }

    static String toNdjson(ProgressSnapshot s) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("ts", Instant.now().toString());
        n.put("percent", Math.round(s.progress() * 1000) / 10.0);
        n.put("total", s.total);
        n.put("processed", s.processed);
        n.put("successful", s.succeeded);
        n.put("failed", s.failed);
        n.put("retries", s.retried);
        n.put("clientsRecycled", s.clientsRecycled);
        n.put("itemsPerSec", Math.round(s.itemsPerSecond() * 100) / 100.0);
        n.put("heapUsedMb", s.heapUsedMb);
        n.put("heapPeakMb", s.heapPeakMb);
        return n.toString();
    }

    @Override
    public void close() {
        if (closed) return;
        ses.shutdownNow();
        if (started) safeWriteOnce();
        synchronized (lock) {
            closed = true;
            if (writer != null) {
                try {
                    writer.close();
                } catch (IOException e) {
                    LOG.warn("Failed to close {}: {}", outFile, e.getMessage());
                }
                writer = null;
            }
        }
    }
}
