package com.pageharvest.core.util;

import com.pageharvest.core.model.FetchConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("YamlConfigLoader — harvest.yml 매핑")
class YamlConfigLoaderTest {

    @Test
    void mapsAllSections(@TempDir Path dir) throws IOException {
        Path yml = dir.resolve("harvest.yml");
        Files.writeString(yml, String.join("\n",
                "maxConcurrency: 6",
                "maxRetries: 3",
                "maxTasksPerClient: 15",
                "requestTimeoutMs: 12000",
                "jitter: { minMs: 0, maxMs: 50 }",
                "proxies: { enabled: true, file: proxies.yml }",
                "cookies: { file: cookies.json }",
                "stats: { file: out/progress.ndjson, periodMs: 500 }",
                "http:",
                "  followRedirects: false",
                "  userAgent: Bot/1",
                "  headers: { X-Requested-With: XMLHttpRequest }",
                "browser:",
                "  headless: false",
                "  navigationTimeoutMs: 45000",
                "  waitUntil: load",
                "  viewports: [\"1280x720\", {width: 1920, height: 1080}]",
                "  userAgents: [UA-A]",
                "  scriptFile: js/parse_listing_page.js",
                "  includeHtml: true",
                "readiness:",
                "  primarySelector: \"[data-name=SummaryHeader]\"",
                "  fallbackSelector: \"[data-name=PriceInfo]\"",
                "  timeoutMs: 10000",
                "  continueOnExhausted: false",
                "  scrollToElement: true",
                "  lazyLoadWaitMs: 0",
                ""));

        FetchConfig cfg = YamlConfigLoader.load(yml);

        assertThat(cfg.getMaxConcurrency()).isEqualTo(6);
        assertThat(cfg.getMaxRetries()).isEqualTo(3);
        assertThat(cfg.getMaxTasksPerClient()).isEqualTo(15);
        assertThat(cfg.getRequestTimeout()).isEqualTo(Duration.ofSeconds(12));
        assertThat(cfg.getJitterMin()).isEqualTo(Duration.ZERO);
        assertThat(cfg.getJitterMax()).isEqualTo(Duration.ofMillis(50));
        assertThat(cfg.getProxyFile()).isEqualTo(dir.toAbsolutePath().resolve("proxies.yml"));
        assertThat(cfg.getCookiesFile()).isEqualTo(dir.toAbsolutePath().resolve("cookies.json"));
        assertThat(cfg.getStatsFile()).isEqualTo(dir.toAbsolutePath().resolve("out/progress.ndjson"));
        assertThat(cfg.getStatsPeriodMs()).isEqualTo(500);

        assertThat(cfg.getHttp().isFollowRedirects()).isFalse();
        assertThat(cfg.getHttp().getDefaultUserAgent()).isEqualTo("Bot/1");
        assertThat(cfg.getHttp().getHeaders()).containsEntry("X-Requested-With", "XMLHttpRequest");

        assertThat(cfg.getBrowser().isHeadless()).isFalse();
        assertThat(cfg.getBrowser().getNavigationTimeout()).isEqualTo(Duration.ofSeconds(45));
        assertThat(cfg.getBrowser().getWaitUntil()).isEqualTo("load");
        assertThat(cfg.getBrowser().getViewports()).containsExactly(
                new FetchConfig.Viewport(1280, 720), new FetchConfig.Viewport(1920, 1080));
        assertThat(cfg.getBrowser().getUserAgents()).containsExactly("UA-A");
        assertThat(cfg.getBrowser().getScriptFile()).isEqualTo(dir.toAbsolutePath().resolve("js/parse_listing_page.js"));
        assertThat(cfg.getBrowser().isIncludeHtml()).isTrue();

        assertThat(cfg.getReadiness().getPrimarySelector()).isEqualTo("[data-name=SummaryHeader]");
        assertThat(cfg.getReadiness().getFallbackSelector()).isEqualTo("[data-name=PriceInfo]");
        assertThat(cfg.getReadiness().isContinueOnExhausted()).isFalse();
        assertThat(cfg.getReadiness().isScrollToElement()).isTrue();
        assertThat(cfg.getReadiness().getLazyLoadWait()).isEqualTo(Duration.ZERO);
    }

    @Test
    void emptyFileGivesDefaults(@TempDir Path dir) throws IOException {
        Path yml = dir.resolve("harvest.yml");
        Files.writeString(yml, "");
        FetchConfig cfg = YamlConfigLoader.load(yml);
        assertThat(cfg.getMaxRetries()).isEqualTo(5);
        assertThat(cfg.getProxyFile()).isNull();
    }

    @Test
    void invalidValuesFailValidation(@TempDir Path dir) throws IOException {
        Path yml = dir.resolve("harvest.yml");
        Files.writeString(yml, "maxTasksPerClient: 0\n");
        assertThatThrownBy(() -> YamlConfigLoader.load(yml))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxTasksPerClient");
    }

    @Test
    void missingFileIsIOException(@TempDir Path dir) {
        assertThatThrownBy(() -> YamlConfigLoader.load(dir.resolve("nope.yml")))
                .isInstanceOf(IOException.class);
    }
}
