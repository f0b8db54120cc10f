package com.pageharvest.core.executor;

import com.pageharvest.core.client.browser.LoadedPage;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/** 렌더링된 HTML을 Jsoup으로 파싱해 호출자 함수에 넘긴다. 스크립트 없이 Java 쪽에서 추출할 때. */
public final class JsoupPageExtractor implements PageExtractor {
    private final Function<Document, Map<String, Object>> fn;

    public JsoupPageExtractor(Function<Document, Map<String, Object>> fn) {
        this.fn = Objects.requireNonNull(fn, "fn");
    }

    /** 제목과 meta description만 뽑는 기본 추출기 */
    public static JsoupPageExtractor titleAndDescription() {
        return new JsoupPageExtractor(doc -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("title", doc.title());
            var desc = doc.selectFirst("meta[name=description]");
            m.put("description", desc != null ? desc.attr("content") : null);
            return m;
        });
    }

    @Override
    public Map<String, Object> extract(LoadedPage page) {
        Document doc = Jsoup.parse(page.content(), page.url());
        Map<String, Object> r = fn.apply(doc);
        return (r == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(r);
    }
}
