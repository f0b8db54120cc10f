package com.pageharvest.core.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pageharvest.core.api.ITaskExecutor;
import com.pageharvest.core.client.http.HttpSession;
import com.pageharvest.core.model.FailureKind;
import com.pageharvest.core.model.FetchConfig;
import com.pageharvest.core.model.FetchTask;
import com.pageharvest.core.model.HttpResponseData;
import com.pageharvest.core.model.WorkItem;
import com.pageharvest.core.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * 워커 세션으로 HTTP 요청 한 건을 보낸다.
 * 2xx면 HttpResponseData payload, 그 외(비2xx/전송 실패/타임아웃)는 재시도 결정으로 접는다.
 */
public final class HttpRequestExecutor implements ITaskExecutor<HttpSession> {
    private static final Logger LOG = LoggerFactory.getLogger(HttpRequestExecutor.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final FetchConfig config;
    private final RetryPolicy retryPolicy;

    public HttpRequestExecutor(FetchConfig config, RetryPolicy retryPolicy) {
        this.config = Objects.requireNonNull(config, "config");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    @Override
    public ExecutionOutcome execute(HttpSession session, FetchTask task) {
        WorkItem item = task.getItem();
        long start = System.nanoTime();
        HttpRequest req;
        try {
            req = buildRequest(session, item);
        } catch (IllegalArgumentException e) {
            return fail(task, FailureKind.TRANSPORT, "invalid request: " + e.getMessage());
        }

        HttpResponse<String> resp;
        try {
            resp = session.send(req);
        } catch (HttpConnectTimeoutException e) {
            return fail(task, FailureKind.TIMEOUT, "connect timeout: " + e.getMessage());
        } catch (HttpTimeoutException e) {
            return fail(task, FailureKind.TIMEOUT, "request timeout after " + config.getRequestTimeout().toMillis() + "ms");
        } catch (IOException e) {
            return fail(task, FailureKind.TRANSPORT, e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while sending " + item.getUrl());
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            return fail(task, FailureKind.HTTP_STATUS, "HTTP " + status + " for " + req.uri());
        }

        HttpHeaders hh = resp.headers();
        String contentType = hh.firstValue("Content-Type").orElse(null);
        String body = resp.body() == null ? "" : resp.body();

        HttpResponseData.Builder data = HttpResponseData.builder()
                .requestId(item.getRequestId())
                .url(req.uri())
                .statusCode(status)
                .headers(hh.map())
                .contentType(contentType)
                .responseTimeMs(elapsedMs);
        JsonNode json = isJson(contentType) ? parseJson(body, req.uri()) : null;
        if (json != null) data.json(json); else data.text(body);
        return ExecutionOutcome.success(task, data.build());
    }

    HttpRequest buildRequest(HttpSession session, WorkItem item) {
        HttpRequest.Builder b = HttpRequest.newBuilder(withParams(item.getUrl(), item.getParams()))
                .timeout(config.getRequestTimeout());
        // 세션 기본 → 요청별 순으로 덮어쓴다
        applyHeaders(b, session.defaultHeaders());
        applyHeaders(b, item.getHeaders());

        HttpRequest.BodyPublisher publisher = (item.getBody() == null)
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(item.getBody(), StandardCharsets.UTF_8);
        b.method(item.getMethod(), publisher);
        return b.build();
    }

    private static void applyHeaders(HttpRequest.Builder b, Map<String, String> headers) {
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            try {
                b.setHeader(e.getKey(), e.getValue());
            } catch (IllegalArgumentException restricted) {
                // Host, Connection 등은 java.net.http가 직접 관리
                LOG.debug("Header {} skipped: {}", e.getKey(), restricted.getMessage());
            }
        }
    }

    /** 쿼리 파라미터를 기존 쿼리 뒤에 UTF-8 인코딩으로 붙인다. */
    static URI withParams(URI url, Map<String, String> params) {
        if (params == null || params.isEmpty()) return url;
        StringBuilder q = new StringBuilder();
        for (Map.Entry<String, String> e : params.entrySet()) {
            if (q.length() > 0) q.append('&');
            q.append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8));
            q.append('=');
            q.append(URLEncoder.encode(e.getValue() == null ? "" : e.getValue(), StandardCharsets.UTF_8));
        }
        String s = url.toString();
        int hash = s.indexOf('#');
        String fragment = hash >= 0 ? s.substring(hash) : "";
        String base = hash >= 0 ? s.substring(0, hash) : s;
        String sep = (url.getRawQuery() == null || url.getRawQuery().isEmpty())
                ? (base.endsWith("?") ? "" : "?")
                : "&";
        return URI.create(base + sep + q + fragment);
    }

    static boolean isJson(String contentType) {
        if (contentType == null) return false;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("application/json") || ct.contains("+json");
    }

    private static JsonNode parseJson(String body, URI uri) {
        if (body.isBlank()) return null;
        try {
            return MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            LOG.debug("Body of {} declared JSON but did not parse, keeping text: {}", uri, e.getOriginalMessage());
            return null;
        }
    }

    private ExecutionOutcome fail(FetchTask task, FailureKind kind, String message) {
        return ExecutionOutcome.failure(task, retryPolicy, kind, message);
    }
}
