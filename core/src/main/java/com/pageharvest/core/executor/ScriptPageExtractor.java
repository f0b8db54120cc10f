package com.pageharvest.core.executor;

import com.pageharvest.core.client.browser.LoadedPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JavaScript 파싱 스크립트를 페이지에서 evaluate한다.
 * 스크립트가 없으면 수집 시각(timestamp)만 남긴다.
 */
public final class ScriptPageExtractor implements PageExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(ScriptPageExtractor.class);
    static final String TIMESTAMP_SCRIPT = "new Date().toISOString()";

    private final String script; // null이면 timestamp only

    private ScriptPageExtractor(String script) {
        this.script = script;
    }

    public static ScriptPageExtractor timestampOnly() {
        return new ScriptPageExtractor(null);
    }

    public static ScriptPageExtractor ofScript(String script) {
        return new ScriptPageExtractor((script == null || script.isBlank()) ? null : script);
    }

    /** scriptFile이 null이면 timestampOnly() */
    public static ScriptPageExtractor fromFile(Path scriptFile) throws IOException {
        if (scriptFile == null) return timestampOnly();
        String js = Files.readString(scriptFile, StandardCharsets.UTF_8);
        LOG.info("Loaded parsing script {} ({} chars)", scriptFile, js.length());
        return ofScript(js);
    }

    public boolean hasScript() { return script != null; }

    @Override
    public Map<String, Object> extract(LoadedPage page) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (script == null) {
            out.put("timestamp", String.valueOf(page.evaluate(TIMESTAMP_SCRIPT)));
            return out;
        }
        Object r = page.evaluate(script);
        if (r instanceof Map<?, ?> m) {
            for (Map.Entry<?, ?> e : m.entrySet()) out.put(String.valueOf(e.getKey()), e.getValue());
        } else {
            // 객체가 아닌 반환값은 data 키 아래에 둔다
            out.put("data", r);
        }
        return out;
    }
}
