package com.pageharvest.core.executor;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsoupPageExtractorTest {

    @Test
    void titleAndDescriptionFromRenderedHtml() {
        FakePage page = new FakePage();
        page.url = "https://ex.com/a";
        page.html = "<html><head><title>Listing 42</title>"
                + "<meta name=\"description\" content=\"2 rooms\"></head><body></body></html>";

        Map<String, Object> out = JsoupPageExtractor.titleAndDescription().extract(page);

        assertThat(out).containsEntry("title", "Listing 42").containsEntry("description", "2 rooms");
    }

    @Test
    void customFunctionSeesAbsoluteLinks() {
        FakePage page = new FakePage();
        page.url = "https://ex.com/list/";
        page.html = "<a class=item href=\"/offer/7\">x</a>";

        var ex = new JsoupPageExtractor(doc -> Map.of("first", doc.selectFirst("a.item").absUrl("href")));

        assertThat(ex.extract(page)).containsEntry("first", "https://ex.com/offer/7");
    }
}
