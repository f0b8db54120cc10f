package com.pageharvest.core.client;

import com.pageharvest.core.model.ProxyEndpoint;

import java.util.Optional;

/**
 * 워커 하나에 묶인 살아있는 수집 자원(HTTP 세션 또는 브라우저 인스턴스).
 * 프록시는 최대 한 개. 반납은 워커가 close() 뒤에 ProxyPool로 한다.
 */
public interface ClientHandle extends AutoCloseable {
    int workerId();

    Optional<ProxyEndpoint> proxy();

    default String proxyName() {
        return proxy().map(ProxyEndpoint::name).orElse("direct");
    }

    /** 정리 실패는 로그로만 남기고 던지지 않는다. */
    @Override void close();
}
