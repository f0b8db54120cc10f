package com.pageharvest.core.proxy;

import com.pageharvest.core.model.ProxyEndpoint;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlProxySourceTest {

    @Test
    void readsProxiesSection(@TempDir Path dir) throws IOException {
        Path f = dir.resolve("proxies.yml");
        Files.writeString(f, String.join("\n",
                "proxies:",
                "  - name: italy",
                "    server: \"http://127.0.0.1:10801\"",
                "    acceptLanguage: \"it-IT,it;q=0.9\"",
                "    userAgent: \"ItaliaMapServices/2.3.1\"",
                "  - server: \"http://127.0.0.1:10802\"",
                "  - name: broken",
                ""));

        List<ProxyEndpoint> list = new YamlProxySource(f).listAvailableEndpoints();

        assertThat(list).hasSize(2);
        assertThat(list.get(0)).isEqualTo(new ProxyEndpoint("italy", "http://127.0.0.1:10801",
                "it-IT,it;q=0.9", "ItaliaMapServices/2.3.1"));
        assertThat(list.get(1).name()).isEqualTo("http://127.0.0.1:10802");
        assertThat(list.get(1).userAgent()).isNull();
    }

    @Test
    void rootListAndEmptyFile(@TempDir Path dir) throws IOException {
        Path list = dir.resolve("list.yml");
        Files.writeString(list, "- {name: a, server: \"http://h:1\"}\n");
        Path empty = dir.resolve("empty.yml");
        Files.writeString(empty, "");

        assertThat(new YamlProxySource(list).listAvailableEndpoints()).extracting(ProxyEndpoint::name).containsExactly("a");
        assertThat(new YamlProxySource(empty).listAvailableEndpoints()).isEmpty();
    }

    @Test
    void missingFileIsIOException(@TempDir Path dir) {
        assertThatThrownBy(() -> new YamlProxySource(dir.resolve("nope.yml")).listAvailableEndpoints())
                .isInstanceOf(IOException.class)
                .hasMessageContaining("proxy file not found");
    }
}
