package com.pageharvest.core.executor;

import com.pageharvest.core.client.browser.LoadedPage;
import com.pageharvest.core.model.FetchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 2단계 준비 대기: primary selector → (시간 초과 시) fallback selector.
 * 각 단계는 같은 timeout을 쓴다. 찾은 요소로 스크롤 + 지연 로딩 대기(옵션).
 */
public final class ReadinessWaiter {
    private static final Logger LOG = LoggerFactory.getLogger(ReadinessWaiter.class);

    public enum Stage {
        /** primary selector 미설정: 대기 없이 통과 */
        NOT_CONFIGURED,
        PRIMARY,
        FALLBACK,
        TIMED_OUT;

        public boolean isReady() { return this != TIMED_OUT; }
    }

    private final FetchConfig.ReadinessCfg cfg;

    public ReadinessWaiter(FetchConfig.ReadinessCfg cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    public Stage await(LoadedPage page) {
        String primary = cfg.getPrimarySelector();
        if (primary == null) return Stage.NOT_CONFIGURED;

        if (page.waitForSelector(primary, cfg.getTimeout())) {
            afterFound(page, primary);
            return Stage.PRIMARY;
        }
        String fallback = cfg.getFallbackSelector();
        if (fallback == null) return Stage.TIMED_OUT;

        LOG.info("Primary selector failed, trying fallback selector '{}' on {}", fallback, page.url());
        if (page.waitForSelector(fallback, cfg.getTimeout())) {
            afterFound(page, fallback);
            return Stage.FALLBACK;
        }
        return Stage.TIMED_OUT;
    }

    /** 실패 메시지용 */
    public String describeTimeout(String url) {
        long ms = cfg.getTimeout().toMillis();
        if (cfg.getFallbackSelector() == null) {
            return "Timeout waiting for selector '" + cfg.getPrimarySelector() + "' on " + url + " (" + ms + "ms)";
        }
        return "Both primary '" + cfg.getPrimarySelector() + "' and fallback '" + cfg.getFallbackSelector()
                + "' selectors failed on " + url + " (" + ms + "ms each)";
    }

    private void afterFound(LoadedPage page, String selector) {
        if (!cfg.isScrollToElement()) return;
        page.scrollIntoView(selector);
        page.pause(cfg.getLazyLoadWait());
    }
}
