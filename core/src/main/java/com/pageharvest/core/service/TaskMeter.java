package com.pageharvest.core.service;

import com.pageharvest.core.executor.ExecutionOutcome;
import com.pageharvest.core.model.FetchTask;
import com.pageharvest.core.util.StructuredLog;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/** 시도 단위 계측: 소요 시간 누적 + task-attempt 이벤트. 워커가 명시적으로 감싼다. */
public final class TaskMeter {
    private static final StructuredLog SLOG = StructuredLog.get(TaskMeter.class);

    private final AtomicLong attempts = new AtomicLong();
    private final AtomicLong totalMs = new AtomicLong();
    private final AtomicLong maxMs = new AtomicLong();

    public ExecutionOutcome measure(int workerId, String proxyName, FetchTask task, Supplier<ExecutionOutcome> attempt) {
        int attemptNo = task.getRetries() + 1; // 실행 전에 읽는다(재시도 시 실행기가 카운터를 올림)
        long t0 = System.nanoTime();
        ExecutionOutcome o = attempt.get();
        long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

        attempts.incrementAndGet();
        totalMs.addAndGet(ms);
        maxMs.accumulateAndGet(ms, Math::max);

        if (SLOG.isDebugEnabled()) {
            SLOG.debug("task-attempt",
                    "identity", task.identity(),
                    "attempt", attemptNo,
                    "worker", workerId,
                    "proxy", proxyName,
                    "durationMs", ms,
                    "success", o.isSuccess(),
                    "error", o.isSuccess() ? null : String.valueOf(o.failureKind()),
                    "retryScheduled", o.needsRetry());
        }
        return o;
    }

    public long attempts() { return attempts.get(); }

    public long avgAttemptMs() {
        long n = attempts.get();
        return n == 0 ? 0 : totalMs.get() / n;
    }

    public long maxAttemptMs() { return maxMs.get(); }
}
