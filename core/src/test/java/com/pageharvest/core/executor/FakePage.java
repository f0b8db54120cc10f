package com.pageharvest.core.executor;

import com.pageharvest.core.client.browser.LoadedPage;
import com.pageharvest.core.client.browser.PageTimeoutException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** 셀렉터 존재 여부/evaluate 결과를 미리 정해 두는 페이지 */
final class FakePage implements LoadedPage {
    final Map<String, Boolean> selectors = new HashMap<>();
    final Map<String, Object> scripts = new HashMap<>();
    final List<String> waited = new ArrayList<>();
    final List<String> scrolled = new ArrayList<>();
    final List<Duration> pauses = new ArrayList<>();
    String html = "<html><head><title>t</title></head><body></body></html>";
    String url = "about:blank";
    boolean navigationTimesOut = false;
    boolean closed = false;

    FakePage present(String selector) { selectors.put(selector, true); return this; }

    @Override
    public void navigate(String url, Duration timeout, String waitUntil) {
        if (navigationTimesOut) throw new PageTimeoutException("navigation timeout after " + timeout.toMillis() + "ms: " + url, null);
        this.url = url;
    }

    @Override
    public boolean waitForSelector(String selector, Duration timeout) {
        waited.add(selector);
        return selectors.getOrDefault(selector, false);
    }

    @Override public void scrollIntoView(String selector) { scrolled.add(selector); }
    @Override public void pause(Duration d) { pauses.add(d); }
    @Override public String content() { return html; }

    @Override
    public Object evaluate(String script) {
        if (!scripts.containsKey(script)) return "2026-01-01T00:00:00.000Z";
        return scripts.get(script);
    }

    @Override public String url() { return url; }
    @Override public void close() { closed = true; }
}
