package com.pageharvest.core.proxy;

import com.pageharvest.core.api.IProxySource;
import com.pageharvest.core.model.ProxyEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * proxies.yml 로더. 프록시 생성/헬스체크는 외부 도구 몫이고 여기서는 목록만 읽는다.
 *
 * proxies:
 *   - name: italy
 *     server: "http://127.0.0.1:10801"
 *     acceptLanguage: "it-IT,it;q=0.9,en-US;q=0.8,en;q=0.7"
 *     userAgent: "ItaliaMapServices/2.3.1"
 *
 * 루트가 바로 리스트여도 된다. name이 없으면 server를 이름으로 쓴다.
 */
public final class YamlProxySource implements IProxySource {
    private static final Logger LOG = LoggerFactory.getLogger(YamlProxySource.class);

    private final Path file;

    public YamlProxySource(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public List<ProxyEndpoint> listAvailableEndpoints() throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("proxy file not found at: " + file.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(file)) {
            Object root = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
            List<?> entries;
            if (root instanceof Map<?, ?> map && map.get("proxies") instanceof List<?> l) {
                entries = l;
            } else if (root instanceof List<?> list) {
                entries = list;
            } else {
                LOG.warn("No proxies defined in {}", file);
                return List.of();
            }

            List<ProxyEndpoint> out = new ArrayList<>(entries.size());
            for (Object e : entries) {
                if (!(e instanceof Map<?, ?> m)) {
                    LOG.warn("Skipping malformed proxy entry in {}: {}", file, e);
                    continue;
                }
                String server = str(m.get("server"));
                if (server == null) {
                    LOG.warn("Skipping proxy entry without server in {}: {}", file, m);
                    continue;
                }
                String name = str(m.get("name"));
                out.add(new ProxyEndpoint(name != null ? name : server, server,
                        str(m.get("acceptLanguage")), str(m.get("userAgent"))));
            }
            LOG.info("Loaded {} proxy endpoints from {}", out.size(), file);
            return out;
        }
    }

    private static String str(Object o) {
        if (o == null) return null;
        String s = String.valueOf(o).trim();
        return s.isEmpty() ? null : s;
    }
}
