package com.pageharvest.core.client.browser;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitForSelectorState;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/** Playwright Page + 그것을 소유한 BrowserContext. close()는 둘 다 닫는다. */
final class PlaywrightLoadedPage implements LoadedPage {
    private static final Logger LOG = LoggerFactory.getLogger(PlaywrightLoadedPage.class);

    private final BrowserContext context;
    private final Page page;

    PlaywrightLoadedPage(BrowserContext context, Page page) {
        this.context = Objects.requireNonNull(context, "context");
        this.page = Objects.requireNonNull(page, "page");
    }

    @Override
    public void navigate(String url, Duration timeout, String waitUntil) {
        try {
            page.navigate(url, new Page.NavigateOptions()
                    .setTimeout((double) timeout.toMillis())
                    .setWaitUntil(waitUntilState(waitUntil)));
        } catch (TimeoutError e) {
            throw new PageTimeoutException("navigation timeout after " + timeout.toMillis() + "ms: " + url, e);
        } catch (PlaywrightException e) {
            throw new PageOperationException("navigation failed: " + url + ": " + firstLine(e), e);
        }
    }

    @Override
    public boolean waitForSelector(String selector, Duration timeout) {
        try {
            page.waitForSelector(selector, new Page.WaitForSelectorOptions()
                    .setTimeout((double) timeout.toMillis())
                    .setState(WaitForSelectorState.ATTACHED));
            return true;
        } catch (TimeoutError e) {
            return false;
        } catch (PlaywrightException e) {
            throw new PageOperationException("waitForSelector failed: " + selector + ": " + firstLine(e), e);
        }
    }

    @Override
    public void scrollIntoView(String selector) {
        try {
            page.locator(selector).first().scrollIntoViewIfNeeded();
        } catch (PlaywrightException e) {
            // 스크롤은 부가 동작. 실패해도 추출은 진행
            LOG.debug("scrollIntoView failed for {}: {}", selector, firstLine(e));
        }
    }

    @Override
    public void pause(Duration d) {
        if (d.isZero() || d.isNegative()) return;
        page.waitForTimeout((double) d.toMillis());
    }

    @Override
    public String content() {
        try {
            return page.content();
        } catch (PlaywrightException e) {
            throw new PageOperationException("content() failed: " + firstLine(e), e);
        }
    }

    @Override
    public Object evaluate(String script) {
        // 스크립트 오류는 추출 단계에서 EXTRACTION으로 분류되므로 그대로 던진다
        return page.evaluate(script);
    }

    @Override
    public String url() {
        return page.url();
    }

    @Override
    public void close() {
        try {
            page.close();
        } catch (PlaywrightException e) {
            LOG.debug("page close failed: {}", firstLine(e));
        }
        try {
            context.close();
        } catch (PlaywrightException e) {
            LOG.debug("context close failed: {}", firstLine(e));
        }
    }

    static WaitUntilState waitUntilState(String s) {
        if (s == null) return WaitUntilState.DOMCONTENTLOADED;
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "load" -> WaitUntilState.LOAD;
            case "networkidle" -> WaitUntilState.NETWORKIDLE;
            case "commit" -> WaitUntilState.COMMIT;
            default -> WaitUntilState.DOMCONTENTLOADED;
        };
    }

    private static String firstLine(Throwable t) {
        String m = String.valueOf(t.getMessage());
        int nl = m.indexOf('\n');
        return nl < 0 ? m : m.substring(0, nl);
    }
}
