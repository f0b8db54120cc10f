package com.pageharvest.core.service;

import com.pageharvest.core.api.ITaskExecutor;
import com.pageharvest.core.client.ClientCreationException;
import com.pageharvest.core.client.ClientFactory;
import com.pageharvest.core.client.ClientHandle;
import com.pageharvest.core.executor.ExecutionOutcome;
import com.pageharvest.core.model.FetchTask;
import com.pageharvest.core.model.ProxyEndpoint;
import com.pageharvest.core.model.ResultRecord;
import com.pageharvest.core.proxy.ProxyPool;
import com.pageharvest.core.util.Jitter;
import com.pageharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

/**
 * 워커 한 개의 순차 루프.
 * NO_CLIENT → ACTIVE ⇄ RECYCLING → DONE.
 * 큐가 비면(비차단 poll) 클라이언트를 닫고 프록시를 반납한 뒤 자기 결과만 돌려준다.
 */
final class FetchWorker<C extends ClientHandle> implements Callable<List<ResultRecord>> {
    private static final Logger LOG = LoggerFactory.getLogger(FetchWorker.class);
    private static final StructuredLog SLOG = StructuredLog.get(FetchWorker.class);

    private final int id;
    private final Queue<FetchTask> queue;
    private final ProxyPool pool;
    private final ClientFactory<C> factory;
    private final ITaskExecutor<C> executor;
    private final ProgressTracker tracker;
    private final TaskMeter meter;
    private final int maxTasksPerClient;
    private final Jitter jitter;

    FetchWorker(int id, Queue<FetchTask> queue, ProxyPool pool, ClientFactory<C> factory, ITaskExecutor<C> executor,
                ProgressTracker tracker, TaskMeter meter, int maxTasksPerClient, Jitter jitter) {
        this.id = id;
        this.queue = Objects.requireNonNull(queue, "queue");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.meter = Objects.requireNonNull(meter, "meter");
        this.maxTasksPerClient = Math.max(1, maxTasksPerClient);
        this.jitter = Objects.requireNonNull(jitter, "jitter");
    }

    @Override
    public List<ResultRecord> call() {
        List<ResultRecord> results = new ArrayList<>();
        C client = null;
        int used = 0; // 현재 클라이언트로 실행한 시도 수(재시도 포함)
        try {
            client = openClient();
            jitter.pause();

            FetchTask task;
            while ((task = queue.poll()) != null) {
                if (used >= maxTasksPerClient) {
                    LOG.info("Worker {} recycling client after {} tasks", id, used);
                    SLOG.info("client-recycled", "worker", id, "proxy", client.proxyName(), "tasks", used);
                    C old = client;
                    client = null;
                    closeClient(old);
                    tracker.recordRecycle();
                    used = 0;
                    client = openClient();
                    jitter.pause();
                }

                final C c = client;
                final FetchTask t = task;
                ExecutionOutcome o = meter.measure(id, c.proxyName(), t, () -> executor.execute(c, t));
                used++;

                if (o.needsRetry()) {
                    queue.add(task); // 꼬리로
                    tracker.update(task.identity(), false, true);
                } else {
                    results.add(o.record());
                    tracker.update(task.identity(), o.isSuccess(), false);
                    if (!o.isSuccess()) {
                        LOG.warn("Task {} failed after {} retries: {}", task.identity(),
                                o.record().getRetriesUsed(), o.record().getErrorMessage());
                    }
                }
                jitter.pause();
            }
            LOG.info("Worker {} finished: {} results", id, results.size());
            return results;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Worker " + id + " interrupted");
        } finally {
            if (client != null) closeClient(client);
        }
    }

    /**
     * 프록시를 잡고 클라이언트를 만든다.
     * 생성 실패한 프록시는 이번 실행에서 빼고 다음 후보(없으면 직접 연결)로 다시 시도.
     * 직접 연결마저 실패하면 ClientCreationException.
     */
    C openClient() {
        while (true) {
            ProxyEndpoint proxy = pool.acquire().orElse(null);
            try {
                C c = factory.create(id, proxy);
                SLOG.info("client-created", "worker", id, "proxy", proxy != null ? proxy.name() : "direct");
                return c;
            } catch (IOException | RuntimeException e) {
                if (proxy == null) {
                    throw new ClientCreationException(id, "direct client creation failed: " + e.getMessage(), e);
                }
                LOG.warn("Worker {} failed to create client with proxy {}: {}", id, proxy.name(), e.getMessage());
                pool.markFailed(proxy);
            }
        }
    }

    /** 닫은 뒤에 반납한다. 닫히기 전의 프록시를 다른 워커가 잡지 않도록. */
    private void closeClient(C client) {
        try {
            client.close();
        } catch (RuntimeException e) {
            LOG.warn("Worker {} client close failed: {}", id, e.getMessage());
        } finally {
            client.proxy().ifPresent(pool::release);
        }
    }
}
