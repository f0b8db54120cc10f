package com.pageharvest.core.proxy;

import com.pageharvest.core.api.IProxySource;
import com.pageharvest.core.model.ProxyEndpoint;

import java.util.List;

/** 코드/테스트에서 직접 넘긴 고정 목록 */
public final class StaticProxySource implements IProxySource {
    private final List<ProxyEndpoint> endpoints;

    public StaticProxySource(List<ProxyEndpoint> endpoints) {
        this.endpoints = (endpoints == null) ? List.of() : List.copyOf(endpoints);
    }

    @Override public List<ProxyEndpoint> listAvailableEndpoints() {
        return endpoints;
    }
}
