package com.pageharvest.core.executor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScriptPageExtractorTest {

    @Test
    void timestampOnlyWhenNoScript() throws Exception {
        FakePage page = new FakePage();
        var ex = ScriptPageExtractor.fromFile(null);

        assertThat(ex.hasScript()).isFalse();
        assertThat(ex.extract(page)).containsOnlyKeys("timestamp");
    }

    @Test
    void scriptFromFileReturnsObjectFields(@TempDir Path dir) throws Exception {
        String js = "() => ({ title: document.title, price: 10 })";
        Path file = dir.resolve("parse.js");
        Files.writeString(file, js);

        FakePage page = new FakePage();
        page.scripts.put(js, Map.of("title", "Flat", "price", 10));

        Map<String, Object> out = ScriptPageExtractor.fromFile(file).extract(page);
        assertThat(out).containsEntry("title", "Flat").containsEntry("price", 10);
    }

    @Test
    void nonObjectResultGoesUnderData() {
        FakePage page = new FakePage();
        page.scripts.put("() => [1, 2]", List.of(1, 2));

        assertThat(ScriptPageExtractor.ofScript("() => [1, 2]").extract(page)).containsEntry("data", List.of(1, 2));
    }
}
