package com.pageharvest.core.util;

import com.pageharvest.core.model.CookieSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CookieLoaderTest {

    @Test
    void readsBrowserExportAndDropsIncompleteEntries(@TempDir Path dir) throws IOException {
        Path f = dir.resolve("cookies.json");
        Files.writeString(f, "[" +
                "{\"name\":\"sid\",\"value\":\"abc\",\"domain\":\".ex.com\",\"path\":\"/\",\"secure\":true,"
                + "\"httpOnly\":true,\"expires\":1893456000,\"sameSite\":\"Lax\"}," +
                "{\"name\":\"novalue\"}" +
                "]");

        List<CookieSpec> cookies = CookieLoader.load(f);

        assertThat(cookies).singleElement().satisfies(c -> {
            assertThat(c.name()).isEqualTo("sid");
            assertThat(c.bareDomain()).isEqualTo("ex.com");
            assertThat(c.secure()).isTrue();
            assertThat(c.expires()).isEqualTo(1893456000.0);
        });
    }

    @Test
    void missingOrBrokenFileYieldsEmptyList(@TempDir Path dir) throws IOException {
        Path broken = dir.resolve("broken.json");
        Files.writeString(broken, "{oops");

        assertThat(CookieLoader.load(null)).isEmpty();
        assertThat(CookieLoader.load(dir.resolve("none.json"))).isEmpty();
        assertThat(CookieLoader.load(broken)).isEmpty();
    }
}
