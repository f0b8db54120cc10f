package com.pageharvest.core.client.browser;

import com.pageharvest.core.model.CookieSpec;
import com.pageharvest.core.model.FetchConfig;
import com.pageharvest.core.model.ProxyEndpoint;

import java.util.List;
import java.util.Random;

/**
 * 컨텍스트 한 개의 지문(fingerprint) 설정.
 * User-Agent/뷰포트는 목록에서 랜덤, 프록시 전용 값이 있으면 그것이 우선.
 */
public record PageProfile(String userAgent, FetchConfig.Viewport viewport, String locale, String timezoneId,
                          String colorScheme, String acceptLanguage, boolean blockImages, boolean blockFonts,
                          List<CookieSpec> cookies) {

    public PageProfile {
        cookies = (cookies == null) ? List.of() : List.copyOf(cookies);
    }

    public static PageProfile pick(FetchConfig.BrowserCfg cfg, ProxyEndpoint proxy, List<CookieSpec> cookies, Random rnd) {
        String ua = (proxy != null && proxy.userAgent() != null)
                ? proxy.userAgent()
                : cfg.getUserAgents().get(rnd.nextInt(cfg.getUserAgents().size()));
        String lang = (proxy != null && proxy.acceptLanguage() != null) ? proxy.acceptLanguage() : cfg.getAcceptLanguage();
        FetchConfig.Viewport vp = cfg.getViewports().get(rnd.nextInt(cfg.getViewports().size()));
        return new PageProfile(ua, vp, cfg.getLocale(), cfg.getTimezoneId(), cfg.getColorScheme(), lang,
                cfg.isBlockImages(), cfg.isBlockFonts(), cookies);
    }
}
