package com.pageharvest.core.service;

import com.pageharvest.core.api.IProxySource;
import com.pageharvest.core.api.ITaskExecutor;
import com.pageharvest.core.client.ClientFactory;
import com.pageharvest.core.client.ClientHandle;
import com.pageharvest.core.client.browser.BrowserClient;
import com.pageharvest.core.client.browser.PlaywrightBrowserFactory;
import com.pageharvest.core.client.http.HttpSession;
import com.pageharvest.core.client.http.HttpSessionFactory;
import com.pageharvest.core.executor.BrowserPageExecutor;
import com.pageharvest.core.executor.HttpRequestExecutor;
import com.pageharvest.core.executor.PageExtractor;
import com.pageharvest.core.model.CookieSpec;
import com.pageharvest.core.model.FetchConfig;
import com.pageharvest.core.model.FetchTask;
import com.pageharvest.core.model.ProgressSnapshot;
import com.pageharvest.core.model.ResultRecord;
import com.pageharvest.core.model.WorkItem;
import com.pageharvest.core.proxy.ProxyPool;
import com.pageharvest.core.retry.DefaultRetryPolicy;
import com.pageharvest.core.util.CookieLoader;
import com.pageharvest.core.util.Jitter;
import com.pageharvest.core.util.ProgressDumper;
import com.pageharvest.core.util.ProgressListener;
import com.pageharvest.core.util.Sleeper;
import com.pageharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 수집 오케스트레이터:
 *  - 작업 전부를 공유 FIFO 큐에 싣고 W개 워커를 고정 스레드풀에서 돌린다
 *  - 워커는 클라이언트+프록시를 쥐고 큐가 빌 때까지 실행/재큐잉
 *  - 워커 하나라도 예외로 끝나면 나머지를 중단하고 WorkerFailureException
 *  - DI 생성자는 테스트/대체 구현 주입용
 */
public final class FetchService<C extends ClientHandle> {

    private static final Logger LOG = LoggerFactory.getLogger(FetchService.class);
    private static final StructuredLog SLOG = StructuredLog.get(FetchService.class);

    private final FetchConfig config;
    private final Supplier<ProxyPool> poolSupplier;
    private final ClientFactory<C> factory;
    private final ITaskExecutor<C> executor;
    private final Sleeper sleeper;

    private volatile ProgressTracker lastTracker;
    private volatile int lastWorkerCount = 0;

    /** 기본 구현: 프록시 공급원은 run()마다 한 번 읽는다 */
    public FetchService(FetchConfig config, IProxySource proxySource, ClientFactory<C> factory, ITaskExecutor<C> executor) {
        this(config, () -> loadPool(config, proxySource), factory, executor, Sleeper.SYSTEM);
    }

    /** DI/테스트용 */
    public FetchService(FetchConfig config, Supplier<ProxyPool> poolSupplier, ClientFactory<C> factory,
                        ITaskExecutor<C> executor, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.poolSupplier = Objects.requireNonNull(poolSupplier, "poolSupplier");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /* =========================
       기본 조립
       ========================= */

    public static FetchService<HttpSession> http(FetchConfig config, IProxySource proxySource) {
        List<CookieSpec> cookies = CookieLoader.load(config.getCookiesFile());
        return new FetchService<>(config, proxySource,
                new HttpSessionFactory(config, cookies),
                new HttpRequestExecutor(config, new DefaultRetryPolicy(config.getMaxRetries())));
    }

    public static FetchService<BrowserClient> browser(FetchConfig config, IProxySource proxySource, PageExtractor extractor) {
        List<CookieSpec> cookies = CookieLoader.load(config.getCookiesFile());
        PlaywrightBrowserFactory browsers = new PlaywrightBrowserFactory(config.getBrowser());
        ClientFactory<BrowserClient> factory = browsers::create;
        return new FetchService<>(config, proxySource, factory,
                new BrowserPageExecutor(config, new DefaultRetryPolicy(config.getMaxRetries()), extractor, cookies));
    }

    static ProxyPool loadPool(FetchConfig config, IProxySource source) {
        if (!config.isUseProxies() || source == null) return ProxyPool.empty();
        try {
            ProxyPool pool = ProxyPool.fromSource(source, config.proxyWorkingSetCap());
            LOG.info("Proxy working set: {} endpoints (cap {})", pool.size(), config.proxyWorkingSetCap());
            return pool;
        } catch (IOException e) {
            throw new UncheckedIOException("failed to load proxy endpoints", e);
        }
    }

    /* =========================
       실행 API
       ========================= */

    public List<ResultRecord> run(List<WorkItem> items) {
        return run(items, ProgressListener.NONE);
    }

    /**
     * 모든 작업을 처리하고 작업당 정확히 하나의 최종 결과를 돌려준다(순서 무보장).
     * @throws WorkerFailureException 워커가 예외로 끝남(클라이언트 생성 불가 포함)
     * @throws CancellationException  호출 스레드 인터럽트
     */
    public List<ResultRecord> run(List<WorkItem> items, ProgressListener listener) {
        Objects.requireNonNull(items, "items");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;

        if (items.isEmpty()) {
            lastWorkerCount = 0;
            lastTracker = new ProgressTracker(0, pl);
            pl.onProgress(1.0, "done", 0, 0);
            LOG.info("Fetch done. nothing to do");
            return List.of();
        }

        final ProxyPool pool = poolSupplier.get();
        final int workers = workerCount(items.size(), config.getMaxConcurrency(), pool.size());
        lastWorkerCount = workers;

        final ConcurrentLinkedQueue<FetchTask> queue = new ConcurrentLinkedQueue<>();
        for (WorkItem item : items) queue.add(new FetchTask(item));

        final ProgressTracker tracker = new ProgressTracker(items.size(), pl);
        final TaskMeter meter = new TaskMeter();
        lastTracker = tracker;

        LOG.info("Fetch start: items={}, workers={}, proxies={}, maxRetries={}, maxTasksPerClient={}",
                items.size(), workers, pool.size(), config.getMaxRetries(), config.getMaxTasksPerClient());
        SLOG.info("fetch-start",
                "items", items.size(),
                "workers", workers,
                "proxies", pool.size(),
                "maxRetries", config.getMaxRetries(),
                "maxTasksPerClient", config.getMaxTasksPerClient());

        pl.onProgress(0.0, "fetch", 0, items.size());
        ProgressDumper dumper = startDumper(tracker);

        ExecutorService exec = Executors.newFixedThreadPool(workers, new NamedThreadFactory("fetch-worker"));
        ExecutorCompletionService<List<ResultRecord>> ecs = new ExecutorCompletionService<>(exec);
        Jitter jitter = new Jitter(config.getJitterMin(), config.getJitterMax(), sleeper);
        for (int i = 0; i < workers; i++) {
            ecs.submit(new FetchWorker<>(i, queue, pool, factory, executor, tracker, meter,
                    config.getMaxTasksPerClient(), jitter));
        }

        final List<ResultRecord> results = new ArrayList<>(items.size());
        try {
            for (int i = 0; i < workers; i++) {
                try {
                    results.addAll(ecs.take().get());
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    LOG.error("Worker failed, aborting run: {}", cause.toString());
                    SLOG.error("worker-failed", cause, "cause", cause.toString());
                    throw new WorkerFailureException("worker failed: " + cause.getMessage(), cause);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while collecting results");
                }
            }
        } finally {
            exec.shutdownNow();
            try {
                if (!exec.awaitTermination(30, TimeUnit.SECONDS)) {
                    LOG.warn("Workers did not terminate within 30s");
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
            if (dumper != null) dumper.close();
        }

        ProgressSnapshot s = tracker.snapshot();
        pl.onProgress(1.0, "done", s.completed(), s.total);
        tracker.logSummary();
        SLOG.info("fetch-done",
                "results", results.size(),
                "successful", s.succeeded,
                "failed", s.failed,
                "retries", s.retried,
                "clientsRecycled", s.clientsRecycled,
                "elapsedMs", s.elapsedMs,
                "avgAttemptMs", meter.avgAttemptMs(),
                "maxAttemptMs", meter.maxAttemptMs());
        return results;
    }

    private ProgressDumper startDumper(ProgressTracker tracker) {
        if (config.getStatsFile() == null) return null;
        ProgressDumper d = new ProgressDumper(tracker::snapshot, config.getStatsFile(), config.getStatsPeriodMs());
        try {
            d.start();
            return d;
        } catch (IOException e) {
            LOG.warn("Progress stats disabled, cannot open {}: {}", config.getStatsFile(), e.getMessage());
            d.close();
            return null;
        }
    }

    /** min(items, max(2, min(maxConcurrency, 프록시 수 또는 1))) */
    public static int workerCount(int items, int maxConcurrency, int proxyPoolSize) {
        if (items <= 0) return 0;
        int bySupply = Math.min(maxConcurrency, Math.max(1, proxyPoolSize));
        return Math.min(items, Math.max(2, bySupply));
    }

    /* =========================
       게터
       ========================= */

    public int lastWorkerCount() { return lastWorkerCount; }

    /** 마지막 run()의 진행 스냅샷. run() 전이면 null. */
    public ProgressSnapshot getLastSnapshot() {
        ProgressTracker t = lastTracker;
        return t == null ? null : t.snapshot();
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
