package com.pageharvest.core.executor;

import com.pageharvest.core.api.ITaskExecutor;
import com.pageharvest.core.client.browser.BrowserClient;
import com.pageharvest.core.client.browser.LoadedPage;
import com.pageharvest.core.client.browser.PageOperationException;
import com.pageharvest.core.client.browser.PageProfile;
import com.pageharvest.core.client.browser.PageTimeoutException;
import com.pageharvest.core.model.CookieSpec;
import com.pageharvest.core.model.FailureKind;
import com.pageharvest.core.model.FetchConfig;
import com.pageharvest.core.model.FetchTask;
import com.pageharvest.core.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 브라우저 페이지 한 건 수집.
 * 흐름: 격리 컨텍스트 오픈 → navigate → 준비 대기(primary/fallback) → 추출 → 페이지/컨텍스트 정리.
 */
public final class BrowserPageExecutor implements ITaskExecutor<BrowserClient> {
    private static final Logger LOG = LoggerFactory.getLogger(BrowserPageExecutor.class);

    private final FetchConfig config;
    private final RetryPolicy retryPolicy;
    private final PageExtractor extractor;
    private final List<CookieSpec> cookies;
    private final ReadinessWaiter readiness;

    public BrowserPageExecutor(FetchConfig config, RetryPolicy retryPolicy, PageExtractor extractor, List<CookieSpec> cookies) {
        this.config = Objects.requireNonNull(config, "config");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.cookies = (cookies == null) ? List.of() : List.copyOf(cookies);
        this.readiness = new ReadinessWaiter(config.getReadiness());
    }

    @Override
    public ExecutionOutcome execute(BrowserClient browser, FetchTask task) {
        String url = task.getItem().getUrl().toString();
        FetchConfig.BrowserCfg bc = config.getBrowser();
        PageProfile profile = PageProfile.pick(bc, browser.proxy().orElse(null), cookies, ThreadLocalRandom.current());

        try (LoadedPage page = browser.openPage(profile)) {
            page.navigate(url, bc.getNavigationTimeout(), bc.getWaitUntil());

            boolean partial = false;
            ReadinessWaiter.Stage stage = readiness.await(page);
            if (!stage.isReady()) {
                String msg = readiness.describeTimeout(url);
                if (config.getReadiness().isContinueOnExhausted() && !retryPolicy.shouldRetry(task)) {
                    LOG.warn("{} - No more retries, continuing with partial results", msg);
                    partial = true;
                } else {
                    return fail(task, FailureKind.READINESS_TIMEOUT, msg);
                }
            }

            Map<String, Object> payload = new LinkedHashMap<>();
            try {
                Map<String, Object> extracted = extractor.extract(page);
                if (extracted != null) payload.putAll(extracted);
                if (bc.isIncludeHtml()) payload.put("html", page.content());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted during extraction of " + url);
            } catch (Exception e) {
                return fail(task, FailureKind.EXTRACTION, "extraction failed on " + url + ": " + e.getMessage());
            }
            payload.put("url", url);
            if (partial) payload.put("partial", true);
            if (task.getRetries() > 0) payload.put("retries", task.getRetries());
            return ExecutionOutcome.success(task, payload);

        } catch (PageTimeoutException e) {
            return fail(task, FailureKind.TIMEOUT, e.getMessage());
        } catch (PageOperationException e) {
            return fail(task, FailureKind.TRANSPORT, e.getMessage());
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            // 드라이버 쪽 예기치 않은 오류도 작업 실패로 접는다
            return fail(task, FailureKind.TRANSPORT, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private ExecutionOutcome fail(FetchTask task, FailureKind kind, String message) {
        ExecutionOutcome o = ExecutionOutcome.failure(task, retryPolicy, kind, message);
        if (o.needsRetry()) {
            LOG.error("{} - Will retry ({}/{})", message, task.getRetries(), retryPolicy.maxRetries());
        }
        return o;
    }
}
