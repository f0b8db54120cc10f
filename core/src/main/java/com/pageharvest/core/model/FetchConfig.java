package com.pageharvest.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 수집 실행 설정 (harvest.yml 매핑 대상). 순수 설정 보관용.
 * 로딩은 YamlConfigLoader, 검증은 validate().
 */
public final class FetchConfig {

    /** YAML `http:` 섹션 */
    public static final class HttpCfg {
        private boolean followRedirects = true;
        private String defaultUserAgent = "PageHarvest/0.3";
        private String defaultAcceptLanguage = "en-US,en;q=0.9";
        /** 모든 요청에 붙는 추가 헤더 (WorkItem 헤더가 우선) */
        private Map<String, String> headers = Map.of();

        public boolean isFollowRedirects() { return followRedirects; }
        public HttpCfg setFollowRedirects(boolean v) { this.followRedirects = v; return this; }

        public String getDefaultUserAgent() { return defaultUserAgent; }
        public HttpCfg setDefaultUserAgent(String v) { if (v != null && !v.isBlank()) this.defaultUserAgent = v; return this; }

        public String getDefaultAcceptLanguage() { return defaultAcceptLanguage; }
        public HttpCfg setDefaultAcceptLanguage(String v) { if (v != null && !v.isBlank()) this.defaultAcceptLanguage = v; return this; }

        public Map<String, String> getHeaders() { return headers; }
        public HttpCfg setHeaders(Map<String, String> headers) {
            this.headers = (headers == null) ? Map.of() : Map.copyOf(new LinkedHashMap<>(headers));
            return this;
        }
    }

    /** 브라우저 뷰포트 */
    public record Viewport(int width, int height) {
        public Viewport {
            if (width <= 0 || height <= 0) throw new IllegalArgumentException("viewport must be positive: " + width + "x" + height);
        }
    }

    /** YAML `browser:` 섹션 */
    public static final class BrowserCfg {
        private boolean headless = true;
        private Duration navigationTimeout = Duration.ofSeconds(30);
        private String waitUntil = "domcontentloaded";
        private boolean blockImages = true;
        private boolean blockFonts = false;
        private String locale = "en-US";
        private String timezoneId = "UTC";
        private String colorScheme = "light";
        private String acceptLanguage = "en-US,en;q=0.9";
        private List<String> userAgents = List.of(
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
                "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.4 Safari/605.1.15",
                "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36");
        private List<Viewport> viewports = List.of(
                new Viewport(1920, 1080),
                new Viewport(1366, 768),
                new Viewport(1440, 900),
                new Viewport(1536, 864));
        /** 페이지에서 evaluate할 파싱 스크립트. null이면 타임스탬프만 기록 */
        private Path scriptFile;
        /** 결과 payload에 전체 HTML 포함 여부 */
        private boolean includeHtml = false;

        public boolean isHeadless() { return headless; }
        public BrowserCfg setHeadless(boolean v) { this.headless = v; return this; }

        public Duration getNavigationTimeout() { return navigationTimeout; }
        public BrowserCfg setNavigationTimeout(Duration v) { this.navigationTimeout = v; return this; }

        public String getWaitUntil() { return waitUntil; }
        public BrowserCfg setWaitUntil(String v) { if (v != null && !v.isBlank()) this.waitUntil = v.trim(); return this; }

        public boolean isBlockImages() { return blockImages; }
        public BrowserCfg setBlockImages(boolean v) { this.blockImages = v; return this; }

        public boolean isBlockFonts() { return blockFonts; }
        public BrowserCfg setBlockFonts(boolean v) { this.blockFonts = v; return this; }

        public String getLocale() { return locale; }
        public BrowserCfg setLocale(String v) { this.locale = v; return this; }

        public String getTimezoneId() { return timezoneId; }
        public BrowserCfg setTimezoneId(String v) { this.timezoneId = v; return this; }

        public String getColorScheme() { return colorScheme; }
        public BrowserCfg setColorScheme(String v) { this.colorScheme = v; return this; }

        public String getAcceptLanguage() { return acceptLanguage; }
        public BrowserCfg setAcceptLanguage(String v) { if (v != null && !v.isBlank()) this.acceptLanguage = v; return this; }

        public List<String> getUserAgents() { return userAgents; }
        public BrowserCfg setUserAgents(List<String> v) { if (v != null && !v.isEmpty()) this.userAgents = List.copyOf(v); return this; }

        public List<Viewport> getViewports() { return viewports; }
        public BrowserCfg setViewports(List<Viewport> v) { if (v != null && !v.isEmpty()) this.viewports = List.copyOf(v); return this; }

        public Path getScriptFile() { return scriptFile; }
        public BrowserCfg setScriptFile(Path v) { this.scriptFile = v; return this; }

        public boolean isIncludeHtml() { return includeHtml; }
        public BrowserCfg setIncludeHtml(boolean v) { this.includeHtml = v; return this; }
    }

    /** YAML `readiness:` 섹션. 2단계(primary → fallback) 대기 조건 */
    public static final class ReadinessCfg {
        private String primarySelector;
        private String fallbackSelector;
        private Duration timeout = Duration.ofSeconds(10);
        /** 재시도 예산이 바닥난 마지막 시도에서는 부분 페이지로 계속 진행 */
        private boolean continueOnExhausted = true;
        private boolean scrollToElement = false;
        private Duration lazyLoadWait = Duration.ofSeconds(2);

        public String getPrimarySelector() { return primarySelector; }
        public ReadinessCfg setPrimarySelector(String v) { this.primarySelector = blankToNull(v); return this; }

        public String getFallbackSelector() { return fallbackSelector; }
        public ReadinessCfg setFallbackSelector(String v) { this.fallbackSelector = blankToNull(v); return this; }

        public Duration getTimeout() { return timeout; }
        public ReadinessCfg setTimeout(Duration v) { this.timeout = v; return this; }

        public boolean isContinueOnExhausted() { return continueOnExhausted; }
        public ReadinessCfg setContinueOnExhausted(boolean v) { this.continueOnExhausted = v; return this; }

        public boolean isScrollToElement() { return scrollToElement; }
        public ReadinessCfg setScrollToElement(boolean v) { this.scrollToElement = v; return this; }

        public Duration getLazyLoadWait() { return lazyLoadWait; }
        public ReadinessCfg setLazyLoadWait(Duration v) { this.lazyLoadWait = v; return this; }

        private static String blankToNull(String s) { return (s == null || s.isBlank()) ? null : s; }
    }

    // ---------- 기본 필드 ----------
    private int maxConcurrency = 2;       // 워커 수 상한
    private int maxRetries = 5;           // 작업당 재시도 허용 횟수
    private int maxTasksPerClient = 20;   // 이 횟수만큼 처리하면 클라이언트 재생성
    private Duration requestTimeout = Duration.ofSeconds(30);
    private Duration jitterMin = Duration.ofMillis(200);
    private Duration jitterMax = Duration.ofMillis(500);

    private boolean useProxies = true;
    private Path proxyFile;               // proxies.yml (없으면 직접 연결)
    private Path cookiesFile;             // 쿠키 JSON (없으면 미사용)
    private Path statsFile;               // 진행 스냅샷 NDJSON (없으면 미기록)
    private long statsPeriodMs = 2_000;

    private HttpCfg http = new HttpCfg();
    private BrowserCfg browser = new BrowserCfg();
    private ReadinessCfg readiness = new ReadinessCfg();

    // ---------- getters ----------
    public int getMaxConcurrency() { return maxConcurrency; }
    public int getMaxRetries() { return maxRetries; }
    public int getMaxTasksPerClient() { return maxTasksPerClient; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public Duration getJitterMin() { return jitterMin; }
    public Duration getJitterMax() { return jitterMax; }
    public boolean isUseProxies() { return useProxies; }
    public Path getProxyFile() { return proxyFile; }
    public Path getCookiesFile() { return cookiesFile; }
    public Path getStatsFile() { return statsFile; }
    public long getStatsPeriodMs() { return statsPeriodMs; }
    public HttpCfg getHttp() { return http; }
    public BrowserCfg getBrowser() { return browser; }
    public ReadinessCfg getReadiness() { return readiness; }

    /** 프록시 작업 세트 상한: 동시성 + 2 (여분은 실패 교체용) */
    public int proxyWorkingSetCap() { return maxConcurrency + 2; }

    // ---------- fluent setters ----------
    public FetchConfig setMaxConcurrency(int v) { this.maxConcurrency = Math.max(1, v); return this; }
    public FetchConfig setMaxRetries(int v) { this.maxRetries = v; return this; }
    public FetchConfig setMaxTasksPerClient(int v) { this.maxTasksPerClient = v; return this; }
    public FetchConfig setRequestTimeout(Duration v) { this.requestTimeout = v; return this; }
    public FetchConfig setRequestTimeoutMs(long ms) { this.requestTimeout = Duration.ofMillis(Math.max(1, ms)); return this; }

    /** 지터 범위. 테스트에서는 (0, 0)으로 끈다. */
    public FetchConfig setJitter(Duration min, Duration max) {
        this.jitterMin = min;
        this.jitterMax = max;
        return this;
    }
    public FetchConfig setJitterMs(long minMs, long maxMs) {
        return setJitter(Duration.ofMillis(Math.max(0, minMs)), Duration.ofMillis(Math.max(0, maxMs)));
    }

    public FetchConfig setUseProxies(boolean v) { this.useProxies = v; return this; }
    public FetchConfig setProxyFile(Path v) { this.proxyFile = v; return this; }
    public FetchConfig setCookiesFile(Path v) { this.cookiesFile = v; return this; }
    public FetchConfig setStatsFile(Path v) { this.statsFile = v; return this; }
    public FetchConfig setStatsPeriodMs(long v) { this.statsPeriodMs = v; return this; }
    public FetchConfig setHttp(HttpCfg v) { this.http = (v != null ? v : new HttpCfg()); return this; }
    public FetchConfig setBrowser(BrowserCfg v) { this.browser = (v != null ? v : new BrowserCfg()); return this; }
    public FetchConfig setReadiness(ReadinessCfg v) { this.readiness = (v != null ? v : new ReadinessCfg()); return this; }

    // ---------- validate ----------
    public void validate() {
        if (maxConcurrency < 1) throw new IllegalArgumentException("maxConcurrency must be >= 1");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (maxTasksPerClient < 1) throw new IllegalArgumentException("maxTasksPerClient must be >= 1");
        requirePositive(requestTimeout, "requestTimeout");

        Objects.requireNonNull(jitterMin, "jitterMin");
        Objects.requireNonNull(jitterMax, "jitterMax");
        if (jitterMin.isNegative() || jitterMax.isNegative())
            throw new IllegalArgumentException("jitter bounds must be >= 0");
        if (jitterMax.compareTo(jitterMin) < 0)
            throw new IllegalArgumentException("jitterMax must be >= jitterMin");
        if (statsPeriodMs < 1) throw new IllegalArgumentException("statsPeriodMs must be > 0");

        Objects.requireNonNull(http, "http");
        Objects.requireNonNull(browser, "browser");
        Objects.requireNonNull(readiness, "readiness");

        requirePositive(browser.getNavigationTimeout(), "browser.navigationTimeout");
        if (browser.getUserAgents().isEmpty()) throw new IllegalArgumentException("browser.userAgents must not be empty");
        if (browser.getViewports().isEmpty()) throw new IllegalArgumentException("browser.viewports must not be empty");

        requirePositive(readiness.getTimeout(), "readiness.timeout");
        Objects.requireNonNull(readiness.getLazyLoadWait(), "readiness.lazyLoadWait");
        if (readiness.getFallbackSelector() != null && readiness.getPrimarySelector() == null)
            throw new IllegalArgumentException("readiness.fallbackSelector requires readiness.primarySelector");
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isNegative() || d.isZero())
            throw new IllegalArgumentException(name + " must be > 0");
    }

    // ---------- helpers ----------
    public static FetchConfig defaults() { return new FetchConfig(); }
}
