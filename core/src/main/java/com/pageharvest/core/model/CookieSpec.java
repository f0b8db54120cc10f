package com.pageharvest.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 쿠키 파일(브라우저 export 형식 JSON 배열)의 한 항목.
 * expires는 epoch 초, 음수/null이면 세션 쿠키.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CookieSpec(String name, String value, String domain, String path,
                         Boolean secure, Boolean httpOnly, Double expires) {

    public String pathOrRoot() {
        return (path == null || path.isBlank()) ? "/" : path;
    }

    /** ".example.com" → "example.com" */
    public String bareDomain() {
        if (domain == null) return null;
        return domain.startsWith(".") ? domain.substring(1) : domain;
    }
}
