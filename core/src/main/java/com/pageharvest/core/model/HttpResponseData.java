package com.pageharvest.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** HTTP 실행기의 성공 payload. JSON 응답이면 json, 아니면 text 본문만 채운다. */
public final class HttpResponseData {
    private final String requestId;
    private final URI url;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String text;
    private final JsonNode json;
    private final String contentType;
    private final long responseTimeMs;

    private HttpResponseData(Builder b) {
        this.requestId = b.requestId;
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.text = b.text;
        this.json = b.json;
        this.contentType = b.contentType;
        this.responseTimeMs = b.responseTimeMs;
    }

    public String getRequestId() { return requestId; }
    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getText() { return text; }
    public JsonNode getJson() { return json; }
    public String getContentType() { return contentType; }
    public long getResponseTimeMs() { return responseTimeMs; }

    public boolean isJson() { return json != null; }

    /** JSON이면 파싱된 트리, 아니면 텍스트 본문 */
    public Object getData() { return json != null ? json : text; }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                final List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String requestId;
        private URI url;
        private int statusCode;
        private Map<String, List<String>> headers;
        private String text;
        private JsonNode json;
        private String contentType;
        private long responseTimeMs;

        public Builder requestId(String requestId) { this.requestId = requestId; return this; }
        public Builder url(URI url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder text(String text) { this.text = text; return this; }
        public Builder json(JsonNode json) { this.json = json; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }

        public HttpResponseData build() {
            Objects.requireNonNull(url, "url");
            return new HttpResponseData(this);
        }
    }
}
