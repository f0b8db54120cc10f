package com.pageharvest.core.model;

import java.util.Objects;

/**
 * 업스트림 프록시 한 개.
 * @param name           풀 내 고유 이름(점유 여부의 키)
 * @param server         "http://127.0.0.1:10801" 같은 주소
 * @param acceptLanguage 이 프록시 지역에 맞춘 Accept-Language (null이면 설정 기본값)
 * @param userAgent      이 프록시 전용 User-Agent (null이면 설정 기본값)
 */
public record ProxyEndpoint(String name, String server, String acceptLanguage, String userAgent) {

    public ProxyEndpoint {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(server, "server");
        if (name.isBlank()) throw new IllegalArgumentException("proxy name must not be blank");
        if (server.isBlank()) throw new IllegalArgumentException("proxy server must not be blank");
    }

    public static ProxyEndpoint of(String name, String server) {
        return new ProxyEndpoint(name, server, null, null);
    }
}
