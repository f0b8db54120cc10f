package com.pageharvest.core.client;

import com.pageharvest.core.model.ProxyEndpoint;

import java.io.IOException;

/** 워커별 클라이언트 생성기. proxy가 null이면 직접 연결. */
@FunctionalInterface
public interface ClientFactory<C extends ClientHandle> {
    C create(int workerId, ProxyEndpoint proxy) throws IOException;
}
