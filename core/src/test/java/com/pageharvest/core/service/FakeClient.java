package com.pageharvest.core.service;

import com.pageharvest.core.client.ClientHandle;
import com.pageharvest.core.model.ProxyEndpoint;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/** 아무 I/O도 하지 않는 클라이언트. 닫힘 여부만 기록. */
final class FakeClient implements ClientHandle {
    final int workerId;
    final ProxyEndpoint proxy;
    final AtomicBoolean closed = new AtomicBoolean(false);

    FakeClient(int workerId, ProxyEndpoint proxy) {
        this.workerId = workerId;
        this.proxy = proxy;
    }

    @Override public int workerId() { return workerId; }
    @Override public Optional<ProxyEndpoint> proxy() { return Optional.ofNullable(proxy); }
    @Override public void close() { closed.set(true); }
}
