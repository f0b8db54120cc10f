package com.pageharvest.core.client.http;

import com.pageharvest.core.client.ClientHandle;
import com.pageharvest.core.model.ProxyEndpoint;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 워커 전용 HTTP 세션: 프록시/쿠키가 묶인 HttpClient + 세션 기본 헤더(User-Agent, Accept-Language).
 */
public final class HttpSession implements ClientHandle {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final int workerId;
    private final ProxyEndpoint proxy;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 실제 송신 (client 기반 또는 주입)
    private final Map<String, String> defaultHeaders;
    private volatile boolean closed = false;

    public HttpSession(int workerId, ProxyEndpoint proxy, HttpClient client, Map<String, String> defaultHeaders) {
        this.workerId = workerId;
        this.proxy = proxy;
        this.client = Objects.requireNonNull(client, "client");
        this.sender = req -> client.send(req, HttpResponse.BodyHandlers.ofString());
        this.defaultHeaders = Map.copyOf(defaultHeaders);
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpSession(int workerId, ProxyEndpoint proxy, HttpSender testSender, Map<String, String> defaultHeaders) {
        this.workerId = workerId;
        this.proxy = proxy;
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
        this.defaultHeaders = Map.copyOf(defaultHeaders);
    }

    public HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException {
        if (closed) throw new IOException("session of worker " + workerId + " is closed");
        return sender.send(req);
    }

    public Map<String, String> defaultHeaders() { return defaultHeaders; }

    @Override public int workerId() { return workerId; }
    @Override public Optional<ProxyEndpoint> proxy() { return Optional.ofNullable(proxy); }

    public boolean isClosed() { return closed; }

    /** java.net.http.HttpClient는 JDK 17에서 명시적 종료가 없어 참조만 끊는다. */
    @Override public void close() {
        closed = true;
    }

    @Override public String toString() {
        return "HttpSession{worker=" + workerId + ", proxy=" + proxyName() + (client == null ? ", stub" : "") + "}";
    }
}
