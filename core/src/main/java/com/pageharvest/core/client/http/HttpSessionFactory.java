package com.pageharvest.core.client.http;

import com.pageharvest.core.client.ClientFactory;
import com.pageharvest.core.model.CookieSpec;
import com.pageharvest.core.model.FetchConfig;
import com.pageharvest.core.model.ProxyEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.HttpCookie;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 워커별 HttpSession 생성.
 * 프록시별 User-Agent / Accept-Language가 있으면 그것을, 없으면 http 섹션 기본값을 쓴다.
 */
public final class HttpSessionFactory implements ClientFactory<HttpSession> {
    private static final Logger LOG = LoggerFactory.getLogger(HttpSessionFactory.class);

    private final FetchConfig config;
    private final List<CookieSpec> cookies;

    public HttpSessionFactory(FetchConfig config, List<CookieSpec> cookies) {
        this.config = Objects.requireNonNull(config, "config");
        this.cookies = (cookies == null) ? List.of() : List.copyOf(cookies);
    }

    @Override
    public HttpSession create(int workerId, ProxyEndpoint proxy) throws IOException {
        var http = config.getHttp();
        String userAgent = (proxy != null && proxy.userAgent() != null) ? proxy.userAgent() : http.getDefaultUserAgent();
        String acceptLanguage = (proxy != null && proxy.acceptLanguage() != null)
                ? proxy.acceptLanguage() : http.getDefaultAcceptLanguage();

        HttpClient.Builder b = HttpClient.newBuilder()
                .followRedirects(http.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getRequestTimeout())
                .cookieHandler(cookieManager());
        if (proxy != null) {
            b.proxy(ProxySelector.of(proxyAddress(proxy)));
        }

        Map<String, String> headers = new LinkedHashMap<>(http.getHeaders());
        headers.put("User-Agent", userAgent);
        headers.put("Accept-Language", acceptLanguage);

        LOG.info("Worker {} using proxy {}, user agent {}, language {}",
                workerId, proxy != null ? proxy.name() : null, userAgent, acceptLanguage);
        return new HttpSession(workerId, proxy, b.build(), headers);
    }

    private CookieManager cookieManager() {
        CookieManager cm = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
        for (CookieSpec c : cookies) {
            String domain = c.bareDomain();
            if (domain == null || domain.isBlank()) continue;
            HttpCookie hc = new HttpCookie(c.name(), c.value());
            hc.setDomain(c.domain());
            hc.setPath(c.pathOrRoot());
            hc.setVersion(0);
            if (c.secure() != null) hc.setSecure(c.secure());
            if (c.httpOnly() != null) hc.setHttpOnly(c.httpOnly());
            cm.getCookieStore().add(URI.create("https://" + domain + "/"), hc);
        }
        return cm;
    }

    /**
     * "http://host:port" → 주소. java.net.http는 HTTP 프록시만 지원하므로
     * socks 계열은 세션 생성 실패로 처리한다.
     */
    static InetSocketAddress proxyAddress(ProxyEndpoint proxy) throws IOException {
        URI u;
        try {
            u = URI.create(proxy.server().contains("://") ? proxy.server() : "http://" + proxy.server());
        } catch (IllegalArgumentException e) {
            throw new IOException("invalid proxy address for " + proxy.name() + ": " + proxy.server(), e);
        }
        String scheme = u.getScheme() == null ? "http" : u.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IOException("unsupported proxy scheme for HTTP sessions: " + scheme + " (" + proxy.name() + ")");
        }
        if (u.getHost() == null) {
            throw new IOException("proxy address has no host: " + proxy.server());
        }
        int port = u.getPort() > 0 ? u.getPort() : (scheme.equals("https") ? 443 : 80);
        return InetSocketAddress.createUnresolved(u.getHost(), port);
    }
}
