package com.pageharvest.core.api;

import com.pageharvest.core.model.ProxyEndpoint;

import java.io.IOException;
import java.util.List;

/** 프록시 공급원 최소 계약: 실행당 한 번 읽는 읽기 전용 스냅샷. */
@FunctionalInterface
public interface IProxySource {
    List<ProxyEndpoint> listAvailableEndpoints() throws IOException;

    IProxySource NONE = List::of;
}
