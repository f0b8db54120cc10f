package com.pageharvest.core.util;

import com.pageharvest.core.model.FetchConfig;
import com.pageharvest.core.model.FetchConfig.Viewport;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * harvest.yml을 읽어 FetchConfig로 변환.
 *
 * 예상 YAML 키:
 * maxConcurrency: 4
 * maxRetries: 5
 * maxTasksPerClient: 20
 * requestTimeoutMs: 30000
 * jitter:
 *   minMs: 200
 *   maxMs: 500
 * proxies:
 *   enabled: true
 *   file: "proxies.yml"
 * cookies:
 *   file: "cookies.json"
 * stats:
 *   file: "out/progress.ndjson"
 *   periodMs: 2000
 *
 * http:
 *   followRedirects: true
 *   userAgent: "PageHarvest/0.3"
 *   acceptLanguage: "en-US,en;q=0.9"
 *   headers: { X-Requested-With: "XMLHttpRequest" }
 *
 * browser:
 *   headless: true
 *   navigationTimeoutMs: 30000
 *   waitUntil: domcontentloaded
 *   blockImages: true
 *   blockFonts: false
 *   locale: "en-US"
 *   timezoneId: "UTC"
 *   colorScheme: light
 *   acceptLanguage: "en-US,en;q=0.9"
 *   userAgents: ["..."]
 *   viewports: ["1920x1080", {width: 1366, height: 768}]
 *   scriptFile: "js/parse_listing_page.js"
 *   includeHtml: false
 *
 * readiness:
 *   primarySelector: "div.listing"
 *   fallbackSelector: "div.empty-result"
 *   timeoutMs: 10000
 *   continueOnExhausted: true
 *   scrollToElement: false
 *   lazyLoadWaitMs: 2000
 *
 * 상대 경로(proxies.file, cookies.file, stats.file, browser.scriptFile)는 YAML 파일 위치 기준.
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static FetchConfig loadDefault() throws IOException {
        return load(Path.of("harvest.yml"));
    }

    public static FetchConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("harvest.yml not found at: " + yamlPath.toAbsolutePath());
        }
        Path baseDir = yamlPath.toAbsolutePath().getParent();
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Object root = newYaml().load(in);

            FetchConfig cfg = FetchConfig.defaults();

            if (!(root instanceof Map<?, ?> map)) {
                // 비어있거나 단순 스칼라면 defaults 유지
                cfg.validate();
                return cfg;
            }

            // 1) 평면 키
            setInt(map, "maxConcurrency", cfg::setMaxConcurrency);
            setInt(map, "maxRetries", cfg::setMaxRetries);
            setInt(map, "maxTasksPerClient", cfg::setMaxTasksPerClient);
            setDurationMs(map, "requestTimeoutMs", cfg::setRequestTimeout);

            // 2) jitter.*
            Map<String, Object> jitter = getMap(map, "jitter");
            if (jitter != null) {
                long min = longOr(jitter.get("minMs"), cfg.getJitterMin().toMillis());
                long max = longOr(jitter.get("maxMs"), Math.max(min, cfg.getJitterMax().toMillis()));
                cfg.setJitterMs(min, max);
            }

            // 3) proxies.* / cookies.* / stats.*
            Map<String, Object> proxies = getMap(map, "proxies");
            if (proxies != null) {
                setBoolean(proxies, "enabled", cfg::setUseProxies);
                setPath(proxies, "file", baseDir, cfg::setProxyFile);
            }
            Map<String, Object> cookies = getMap(map, "cookies");
            if (cookies != null) {
                setPath(cookies, "file", baseDir, cfg::setCookiesFile);
            }
            Map<String, Object> stats = getMap(map, "stats");
            if (stats != null) {
                setPath(stats, "file", baseDir, cfg::setStatsFile);
                Object p = stats.get("periodMs");
                if (p != null) cfg.setStatsPeriodMs(longOr(p, cfg.getStatsPeriodMs()));
            }

            // 4) http.*
            Map<String, Object> http = getMap(map, "http");
            if (http != null) {
                var h = cfg.getHttp();
                setBoolean(http, "followRedirects", h::setFollowRedirects);
                setString(http, "userAgent", h::setDefaultUserAgent);
                setString(http, "acceptLanguage", h::setDefaultAcceptLanguage);
                setStringMap(http, "headers", h::setHeaders);
            }

            // 5) browser.*
            Map<String, Object> browser = getMap(map, "browser");
            if (browser != null) {
                var b = cfg.getBrowser();
                setBoolean(browser, "headless", b::setHeadless);
                setDurationMs(browser, "navigationTimeoutMs", b::setNavigationTimeout);
                setString(browser, "waitUntil", b::setWaitUntil);
                setBoolean(browser, "blockImages", b::setBlockImages);
                setBoolean(browser, "blockFonts", b::setBlockFonts);
                setString(browser, "locale", b::setLocale);
                setString(browser, "timezoneId", b::setTimezoneId);
                setString(browser, "colorScheme", b::setColorScheme);
                setString(browser, "acceptLanguage", b::setAcceptLanguage);
                setStringList(browser, "userAgents", b::setUserAgents);
                setViewports(browser, "viewports", b::setViewports);
                setPath(browser, "scriptFile", baseDir, b::setScriptFile);
                setBoolean(browser, "includeHtml", b::setIncludeHtml);
            }

            // 6) readiness.*
            Map<String, Object> rd = getMap(map, "readiness");
            if (rd != null) {
                var r = cfg.getReadiness();
                setString(rd, "primarySelector", r::setPrimarySelector);
                setString(rd, "fallbackSelector", r::setFallbackSelector);
                setDurationMs(rd, "timeoutMs", r::setTimeout);
                setBoolean(rd, "continueOnExhausted", r::setContinueOnExhausted);
                setBoolean(rd, "scrollToElement", r::setScrollToElement);
                Object lazy = rd.get("lazyLoadWaitMs");
                if (lazy != null) r.setLazyLoadWait(Duration.ofMillis(Math.max(0, longOr(lazy, 0))));
            }

            // 기본값/필수값 확인
            cfg.validate();
            return cfg;
        }
    }

    static Yaml newYaml() {
        LoaderOptions opts = new LoaderOptions();
        return new Yaml(new SafeConstructor(opts));
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    static String stringOrNull(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return v == null ? null : String.valueOf(v);
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof List<?> list) {
            List<String> out = new ArrayList<>();
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
            if (!out.isEmpty()) setter.accept(List.copyOf(out));
        }
    }

    private static void setStringMap(Map<?, ?> map, String key, Consumer<Map<String, String>> setter) {
        Object v = map.get(key);
        if (!(v instanceof Map<?, ?> m)) return;
        Map<String, String> out = new LinkedHashMap<>();
        for (var e : m.entrySet()) {
            if (e.getKey() != null && e.getValue() != null) {
                out.put(String.valueOf(e.getKey()), String.valueOf(e.getValue()));
            }
        }
        setter.accept(out);
    }

    /** "1920x1080" 문자열 또는 {width, height} 맵 */
    private static void setViewports(Map<?, ?> map, String key, Consumer<List<Viewport>> setter) {
        Object v = map.get(key);
        if (!(v instanceof List<?> list)) return;
        List<Viewport> out = new ArrayList<>();
        for (Object o : list) {
            if (o instanceof Map<?, ?> m) {
                out.add(new Viewport(intOf(m.get("width")), intOf(m.get("height"))));
            } else if (o != null) {
                String[] wh = String.valueOf(o).trim().toLowerCase(Locale.ROOT).split("x", 2);
                if (wh.length != 2) throw new IllegalArgumentException("viewport must look like 1920x1080: " + o);
                out.add(new Viewport(Integer.parseInt(wh[0].trim()), Integer.parseInt(wh[1].trim())));
            }
        }
        if (!out.isEmpty()) setter.accept(out);
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(intOf(v));
    }

    private static void setDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = longOr(v, 0);
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }

    private static void setPath(Map<?, ?> map, String key, Path baseDir, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v == null) return;
        Path p = Path.of(String.valueOf(v));
        setter.accept((p.isAbsolute() || baseDir == null) ? p : baseDir.resolve(p).normalize());
    }

    private static int intOf(Object v) {
        if (v instanceof Number n) return n.intValue();
        return Integer.parseInt(String.valueOf(v).trim());
    }

    private static long longOr(Object v, long def) {
        if (v == null) return def;
        if (v instanceof Number n) return n.longValue();
        return Long.parseLong(String.valueOf(v).trim());
    }
}
