package com.pageharvest.core.client.browser;

import java.time.Duration;

/**
 * 실행기와 추출 루틴이 보는 페이지 추상화.
 * 실패는 PageOperationException(시간 초과는 PageTimeoutException)으로만 던진다.
 */
public interface LoadedPage extends AutoCloseable {

    /** waitUntil: load | domcontentloaded | networkidle | commit */
    void navigate(String url, Duration timeout, String waitUntil);

    /** selector가 DOM에 붙을 때까지 대기. 시간 초과면 false. */
    boolean waitForSelector(String selector, Duration timeout);

    void scrollIntoView(String selector);

    /** 지연 로딩 대기 */
    void pause(Duration d);

    String content();

    Object evaluate(String script);

    String url();

    @Override void close();
}
