package com.pageharvest.core.client.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Route;
import com.microsoft.playwright.options.ColorScheme;
import com.microsoft.playwright.options.Cookie;
import com.pageharvest.core.model.CookieSpec;
import com.pageharvest.core.model.ProxyEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Playwright 브라우저 한 개. Playwright 객체는 스레드 안전하지 않으므로 워커(스레드)마다 따로 소유한다.
 */
public final class PlaywrightBrowserClient implements BrowserClient {
    private static final Logger LOG = LoggerFactory.getLogger(PlaywrightBrowserClient.class);

    private final int workerId;
    private final ProxyEndpoint proxy;
    private final Playwright playwright;
    private final Browser browser;

    PlaywrightBrowserClient(int workerId, ProxyEndpoint proxy, Playwright playwright, Browser browser) {
        this.workerId = workerId;
        this.proxy = proxy;
        this.playwright = Objects.requireNonNull(playwright, "playwright");
        this.browser = Objects.requireNonNull(browser, "browser");
    }

    @Override
    public LoadedPage openPage(PageProfile profile) {
        BrowserContext context = null;
        try {
            Browser.NewContextOptions opts = new Browser.NewContextOptions()
                    .setUserAgent(profile.userAgent())
                    .setViewportSize(profile.viewport().width(), profile.viewport().height())
                    .setExtraHTTPHeaders(Map.of("Accept-Language", profile.acceptLanguage()));
            if (profile.locale() != null) opts.setLocale(profile.locale());
            if (profile.timezoneId() != null) opts.setTimezoneId(profile.timezoneId());
            ColorScheme scheme = colorScheme(profile.colorScheme());
            if (scheme != null) opts.setColorScheme(scheme);

            context = browser.newContext(opts);
            if (profile.blockImages()) {
                context.route("**/*.{png,jpg,jpeg,gif,svg,webp}", Route::abort);
            }
            if (profile.blockFonts()) {
                context.route("**/*.{woff,woff2,ttf,otf,eot}", Route::abort);
            }
            if (!profile.cookies().isEmpty()) {
                context.addCookies(toPlaywrightCookies(profile.cookies()));
            }
            Page page = context.newPage();
            return new PlaywrightLoadedPage(context, page);
        } catch (PlaywrightException e) {
            if (context != null) {
                try {
                    context.close();
                } catch (PlaywrightException closeError) {
                    e.addSuppressed(closeError);
                }
            }
            throw new PageOperationException("failed to open browser context: " + e.getMessage(), e);
        }
    }

    static List<Cookie> toPlaywrightCookies(List<CookieSpec> specs) {
        List<Cookie> out = new ArrayList<>(specs.size());
        for (CookieSpec c : specs) {
            if (c.domain() == null || c.domain().isBlank()) continue;
            Cookie ck = new Cookie(c.name(), c.value())
                    .setDomain(c.domain())
                    .setPath(c.pathOrRoot());
            if (c.secure() != null) ck.setSecure(c.secure());
            if (c.httpOnly() != null) ck.setHttpOnly(c.httpOnly());
            if (c.expires() != null && c.expires() > 0) ck.setExpires(c.expires());
            out.add(ck);
        }
        return out;
    }

    private static ColorScheme colorScheme(String s) {
        if (s == null || s.isBlank()) return null;
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "dark" -> ColorScheme.DARK;
            case "no-preference", "no_preference" -> ColorScheme.NO_PREFERENCE;
            default -> ColorScheme.LIGHT;
        };
    }

    @Override public int workerId() { return workerId; }
    @Override public Optional<ProxyEndpoint> proxy() { return Optional.ofNullable(proxy); }

    @Override
    public void close() {
        try {
            browser.close();
        } catch (PlaywrightException e) {
            LOG.warn("Worker {} browser close failed: {}", workerId, e.getMessage());
        }
        try {
            playwright.close();
        } catch (PlaywrightException e) {
            LOG.warn("Worker {} playwright close failed: {}", workerId, e.getMessage());
        }
    }
}
