package com.pageharvest.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 수집 작업 한 건(불변). 단순 URL 또는 요청 디스크립터 {url, method, params, headers, body, requestId}.
 * 식별자는 requestId, 없으면 url.
 */
public final class WorkItem {
    private final URI url;
    private final String method;
    private final Map<String, String> params;
    private final Map<String, String> headers;
    private final String body;
    private final String requestId;

    private WorkItem(Builder b) {
        this.url = b.url;
        this.method = (b.method == null || b.method.isBlank()) ? "GET" : b.method.trim().toUpperCase(Locale.ROOT);
        this.params = (b.params == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(b.params));
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.body = b.body;
        this.requestId = (b.requestId == null || b.requestId.isBlank()) ? null : b.requestId;
    }

    public static WorkItem ofUrl(String url) {
        return builder().url(URI.create(url)).build();
    }

    public URI getUrl() { return url; }
    public String getMethod() { return method; }
    public Map<String, String> getParams() { return params; }
    public Map<String, String> getHeaders() { return headers; }
    public String getBody() { return body; }
    public String getRequestId() { return requestId; }

    /** 결과 상관관계용 식별자: requestId 우선, 없으면 url 문자열 */
    public String identity() {
        return requestId != null ? requestId : url.toString();
    }

    @Override public String toString() {
        return method + " " + url + (requestId != null ? " [" + requestId + "]" : "");
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private String method;
        private Map<String, String> params;
        private Map<String, String> headers;
        private String body;
        private String requestId;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder url(String url) { this.url = URI.create(url); return this; }
        public Builder method(String method) { this.method = method; return this; }
        public Builder params(Map<String, String> params) { this.params = params; return this; }
        public Builder headers(Map<String, String> headers) { this.headers = headers; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder requestId(String requestId) { this.requestId = requestId; return this; }

        public WorkItem build() {
            Objects.requireNonNull(url, "url");
            return new WorkItem(this);
        }
    }
}
