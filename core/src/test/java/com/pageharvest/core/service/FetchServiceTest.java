package com.pageharvest.core.service;

import com.pageharvest.core.api.ITaskExecutor;
import com.pageharvest.core.client.ClientCreationException;
import com.pageharvest.core.executor.ExecutionOutcome;
import com.pageharvest.core.model.FailureKind;
import com.pageharvest.core.model.FetchConfig;
import com.pageharvest.core.model.ProxyEndpoint;
import com.pageharvest.core.model.ResultRecord;
import com.pageharvest.core.model.WorkItem;
import com.pageharvest.core.proxy.ProxyPool;
import com.pageharvest.core.retry.DefaultRetryPolicy;
import com.pageharvest.core.retry.RetryPolicy;
import com.pageharvest.core.util.Sleeper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FetchService — 스케줄링/재시도/프록시 점유")
class FetchServiceTest {

    private static FetchConfig cfg(int maxConcurrency, int maxRetries) {
        return FetchConfig.defaults()
                .setMaxConcurrency(maxConcurrency)
                .setMaxRetries(maxRetries)
                .setJitterMs(0, 0);
    }

    private static List<WorkItem> items(int n) {
        List<WorkItem> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) out.add(WorkItem.ofUrl("https://ex.com/p" + i));
        return out;
    }

    private static List<ProxyEndpoint> proxies(int n) {
        List<ProxyEndpoint> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) out.add(ProxyEndpoint.of("p" + i, "http://127.0.0.1:" + (10800 + i)));
        return out;
    }

    private static FetchService<FakeClient> service(FetchConfig cfg, ProxyPool pool, FakeClientFactory factory,
                                                    ITaskExecutor<FakeClient> executor) {
        return new FetchService<>(cfg, () -> pool, factory, executor, Sleeper.NONE);
    }

    @Test
    @DisplayName("N개 입력 → 식별자가 겹치지 않는 N개 결과")
    void everyItemYieldsExactlyOneRecord() {
        FakeClientFactory factory = new FakeClientFactory();
        var svc = service(cfg(4, 3), new ProxyPool(proxies(3)), factory,
                (client, task) -> ExecutionOutcome.success(task, "ok"));

        List<WorkItem> input = items(50);
        List<ResultRecord> results = svc.run(input);

        assertThat(results).hasSize(50);
        assertThat(results).allMatch(ResultRecord::isSuccess);
        Set<String> ids = results.stream().map(ResultRecord::getIdentity).collect(Collectors.toSet());
        assertThat(ids).hasSize(50)
                .isEqualTo(input.stream().map(WorkItem::identity).collect(Collectors.toSet()));
        assertThat(factory.openCount()).as("all clients closed at the end").isZero();
        assertThat(svc.getLastSnapshot().succeeded).isEqualTo(50);
        assertThat(svc.getLastSnapshot().uniqueSeen).isEqualTo(50);
    }

    @Test
    @DisplayName("워커 수 = min(items, max(2, min(maxConcurrency, 프록시 수 또는 1)))")
    void workerCountFormula() {
        assertThat(FetchService.workerCount(100, 5, 2)).isEqualTo(2);
        assertThat(FetchService.workerCount(100, 5, 0)).isEqualTo(2);
        assertThat(FetchService.workerCount(100, 8, 10)).isEqualTo(8);
        assertThat(FetchService.workerCount(100, 1, 10)).isEqualTo(2);
        assertThat(FetchService.workerCount(1, 5, 10)).isEqualTo(1);
        assertThat(FetchService.workerCount(0, 5, 10)).isZero();

        var svc = service(cfg(5, 0), new ProxyPool(proxies(2)), new FakeClientFactory(),
                (client, task) -> ExecutionOutcome.success(task, null));
        svc.run(items(100));
        assertThat(svc.lastWorkerCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("maxRetries+1번 모두 실패 → 에러 레코드 하나, retriesUsed == maxRetries")
    void exhaustedRetryBudgetYieldsSingleErrorRecord() {
        int maxRetries = 3;
        RetryPolicy policy = new DefaultRetryPolicy(maxRetries);
        Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();

        var svc = service(cfg(2, maxRetries), ProxyPool.empty(), new FakeClientFactory(), (client, task) -> {
            attempts.computeIfAbsent(task.identity(), k -> new AtomicInteger()).incrementAndGet();
            return ExecutionOutcome.failure(task, policy, FailureKind.TRANSPORT, "connection reset");
        });

        List<ResultRecord> results = svc.run(List.of(WorkItem.ofUrl("https://ex.com/broken")));

        assertThat(results).hasSize(1);
        ResultRecord r = results.get(0);
        assertThat(r.isSuccess()).isFalse();
        assertThat(r.getErrorKind()).isEqualTo(FailureKind.TRANSPORT);
        assertThat(r.getRetriesUsed()).isEqualTo(maxRetries);
        assertThat(attempts.get("https://ex.com/broken")).hasValue(maxRetries + 1);

        var s = svc.getLastSnapshot();
        assertThat(s.failed).isEqualTo(1);
        assertThat(s.retried).isEqualTo(maxRetries);
        assertThat(s.processed).isEqualTo(maxRetries + 1);
    }

    @Test
    @DisplayName("k번 실패 후 성공 → 성공 레코드 하나, retriesUsed == k")
    void successAfterTransientFailures() {
        int k = 2;
        RetryPolicy policy = new DefaultRetryPolicy(5);
        AtomicInteger calls = new AtomicInteger();

        var svc = service(cfg(2, 5), ProxyPool.empty(), new FakeClientFactory(), (client, task) -> {
            if (calls.incrementAndGet() <= k) {
                return ExecutionOutcome.failure(task, policy, FailureKind.TIMEOUT, "timeout");
            }
            return ExecutionOutcome.success(task, Map.of("title", "ok"));
        });

        List<ResultRecord> results = svc.run(List.of(WorkItem.ofUrl("https://ex.com/flaky")));

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.isSuccess()).isTrue();
            assertThat(r.getRetriesUsed()).isEqualTo(k);
            assertThat(r.getPayload()).isEqualTo(Map.of("title", "ok"));
        });
    }

    @Test
    @DisplayName("같은 프록시를 두 클라이언트가 동시에 쥐지 않는다")
    void proxyIsNeverHeldByTwoClients() {
        CheckingProxyPool pool = new CheckingProxyPool(proxies(3));
        FetchConfig cfg = cfg(3, 0).setMaxTasksPerClient(1); // 매 작업마다 재생성 → acquire/release 반복

        var svc = service(cfg, pool, new FakeClientFactory(), (client, task) -> {
            client.proxy().ifPresent(p -> {
                String holder = pool.holders.get(p.name());
                if (!Thread.currentThread().getName().equals(holder)) pool.violations.incrementAndGet();
            });
            try {
                Thread.sleep(2);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ExecutionOutcome.success(task, null);
        });

        List<ResultRecord> results = svc.run(items(60));

        assertThat(results).hasSize(60);
        assertThat(pool.violations).hasValue(0);
        assertThat(pool.inUseCount()).isZero();
    }

    @Test
    @DisplayName("직접 연결 클라이언트마저 만들 수 없으면 실행 전체 중단")
    void clientCreationFailureAbortsRun() {
        var svc = service(cfg(2, 0), ProxyPool.empty(), new FakeClientFactory(Set.of("direct")),
                (client, task) -> ExecutionOutcome.success(task, null));

        assertThatThrownBy(() -> svc.run(items(5)))
                .isInstanceOf(WorkerFailureException.class)
                .hasCauseInstanceOf(ClientCreationException.class);
    }

    @Test
    @DisplayName("프록시로 생성 실패 → 그 프록시를 빼고 직접 연결로 계속")
    void failedProxyIsDroppedAndWorkerFallsBack() {
        ProxyPool pool = new ProxyPool(List.of(ProxyEndpoint.of("bad", "http://127.0.0.1:1")));
        FakeClientFactory factory = new FakeClientFactory(Set.of("bad"));
        var svc = service(cfg(2, 0), pool, factory, (client, task) -> ExecutionOutcome.success(task, null));

        List<ResultRecord> results = svc.run(items(6));

        assertThat(results).hasSize(6).allMatch(ResultRecord::isSuccess);
        assertThat(pool.size()).isZero();
        assertThat(factory.created).allMatch(c -> c.proxy == null);
    }

    @Test
    @DisplayName("빈 입력 → 워커 없이 빈 결과")
    void emptyInputStartsNoWorkers() {
        FakeClientFactory factory = new FakeClientFactory();
        var svc = service(cfg(2, 0), ProxyPool.empty(), factory, (client, task) -> ExecutionOutcome.success(task, null));

        assertThat(svc.run(List.of())).isEmpty();
        assertThat(factory.attempts).isEmpty();
        assertThat(svc.lastWorkerCount()).isZero();
    }

    @Test
    @DisplayName("진행 콜백: 마지막은 done 1.0")
    void listenerSeesDonePhase() {
        List<String> phases = new ArrayList<>();
        List<Double> progress = new ArrayList<>();
        var svc = service(cfg(2, 0), ProxyPool.empty(), new FakeClientFactory(),
                (client, task) -> ExecutionOutcome.success(task, null));

        svc.run(items(4), (p, phase, done, total) -> {
            synchronized (phases) {
                phases.add(phase);
                progress.add(p);
            }
        });

        assertThat(phases).last().isEqualTo("done");
        assertThat(progress).last().isEqualTo(1.0);
    }

    /** acquire/release 사이의 점유자를 기록해 중복 점유를 잡아낸다 */
    static final class CheckingProxyPool extends ProxyPool {
        final Map<String, String> holders = new ConcurrentHashMap<>(); // 프록시 이름 → 워커 스레드 이름
        final AtomicInteger violations = new AtomicInteger();

        CheckingProxyPool(List<ProxyEndpoint> endpoints) { super(endpoints); }

        @Override
        public Optional<ProxyEndpoint> acquire() {
            Optional<ProxyEndpoint> p = super.acquire();
            p.ifPresent(e -> {
                if (holders.putIfAbsent(e.name(), Thread.currentThread().getName()) != null) violations.incrementAndGet();
            });
            return p;
        }

        @Override
        public void release(ProxyEndpoint proxy) {
            if (proxy != null) holders.remove(proxy.name());
            super.release(proxy);
        }
    }
}
