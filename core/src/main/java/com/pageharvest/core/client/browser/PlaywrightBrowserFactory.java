package com.pageharvest.core.client.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.Proxy;
import com.pageharvest.core.client.ClientFactory;
import com.pageharvest.core.model.FetchConfig;
import com.pageharvest.core.model.ProxyEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/** 워커마다 Playwright + Chromium을 띄운다. 프록시는 브라우저 단위로 건다. */
public final class PlaywrightBrowserFactory implements ClientFactory<PlaywrightBrowserClient> {
    private static final Logger LOG = LoggerFactory.getLogger(PlaywrightBrowserFactory.class);

    private final FetchConfig.BrowserCfg config;

    public PlaywrightBrowserFactory(FetchConfig.BrowserCfg config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public PlaywrightBrowserClient create(int workerId, ProxyEndpoint proxy) throws IOException {
        Playwright playwright = null;
        try {
            playwright = Playwright.create();
            BrowserType.LaunchOptions launch = new BrowserType.LaunchOptions().setHeadless(config.isHeadless());
            if (proxy != null) {
                launch.setProxy(new Proxy(proxy.server()));
            }
            Browser browser = playwright.chromium().launch(launch);
            LOG.info("worker_id {} using proxy {}", workerId, proxy != null ? proxy.name() : null);
            return new PlaywrightBrowserClient(workerId, proxy, playwright, browser);
        } catch (PlaywrightException e) {
            if (playwright != null) {
                try {
                    playwright.close();
                } catch (PlaywrightException closeError) {
                    e.addSuppressed(closeError);
                }
            }
            throw new IOException("browser launch failed for worker " + workerId + ": " + e.getMessage(), e);
        }
    }
}
