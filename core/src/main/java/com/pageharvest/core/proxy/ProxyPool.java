package com.pageharvest.core.proxy;

import com.pageharvest.core.api.IProxySource;
import com.pageharvest.core.model.ProxyEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;

/**
 * 프록시 점유 관리. 한 엔드포인트는 동시에 하나의 클라이언트만 쥔다.
 * - acquire(): 비차단. 빈 자리가 없으면 empty → 호출자는 직접 연결로 진행
 * - 빈 엔드포인트 중 균등 랜덤 선택
 * - 모든 변경은 this 모니터 안에서만 (I/O 없음)
 */
public class ProxyPool {
    private static final Logger LOG = LoggerFactory.getLogger(ProxyPool.class);

    private final List<ProxyEndpoint> working;
    private final Set<String> inUse = new HashSet<>();
    private final Random random;

    public ProxyPool(List<ProxyEndpoint> endpoints) {
        this(endpoints, new Random());
    }

    public ProxyPool(List<ProxyEndpoint> endpoints, Random random) {
        this.random = Objects.requireNonNull(random, "random");
        // 이름 중복은 첫 항목만 유지
        Map<String, ProxyEndpoint> byName = new LinkedHashMap<>();
        for (ProxyEndpoint p : (endpoints == null ? List.<ProxyEndpoint>of() : endpoints)) {
            if (byName.putIfAbsent(p.name(), p) != null) {
                LOG.warn("Duplicate proxy name '{}' ignored", p.name());
            }
        }
        this.working = new ArrayList<>(byName.values());
    }

    public static ProxyPool empty() {
        return new ProxyPool(List.of());
    }

    /** 공급원 스냅샷을 한 번 읽어 앞에서부터 cap개만 작업 세트로 쓴다. */
    public static ProxyPool fromSource(IProxySource source, int cap) throws IOException {
        List<ProxyEndpoint> all = Objects.requireNonNull(source, "source").listAvailableEndpoints();
        List<ProxyEndpoint> head = all.size() > cap ? all.subList(0, Math.max(0, cap)) : all;
        return new ProxyPool(head);
    }

    public synchronized Optional<ProxyEndpoint> acquire() {
        List<ProxyEndpoint> available = new ArrayList<>(working.size());
        for (ProxyEndpoint p : working) {
            if (!inUse.contains(p.name())) available.add(p);
        }
        if (available.isEmpty()) return Optional.empty();

        ProxyEndpoint chosen = available.get(random.nextInt(available.size()));
        inUse.add(chosen.name());
        return Optional.of(chosen);
    }

    public synchronized void release(ProxyEndpoint proxy) {
        if (proxy == null) return;
        inUse.remove(proxy.name());
    }

    /** 점유 해제 + 이번 실행의 작업 세트에서 제외 */
    public synchronized void markFailed(ProxyEndpoint proxy) {
        if (proxy == null) return;
        inUse.remove(proxy.name());
        if (working.removeIf(p -> p.name().equals(proxy.name()))) {
            LOG.warn("Proxy {} marked as failed and removed from working pool", proxy.name());
        }
    }

    /** 작업 세트 크기(점유 여부 무관) */
    public synchronized int size() { return working.size(); }

    public synchronized int inUseCount() { return inUse.size(); }

    public synchronized boolean isInUse(String name) { return inUse.contains(name); }
}
