package com.pageharvest.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pageharvest.core.model.ProgressSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressDumperTest {

    private static ProgressSnapshot snap() {
        return new ProgressSnapshot(10, 6, 4, 1, 1, 5, 2, 3_000, 120, 150);
    }

    @Test
    void ndjsonLineCarriesCounters() throws Exception {
        JsonNode n = new ObjectMapper().readTree(ProgressDumper.toNdjson(snap()));
        assertThat(n.get("percent").asDouble()).isEqualTo(50.0);
        assertThat(n.get("successful").asLong()).isEqualTo(4);
        assertThat(n.get("retries").asLong()).isEqualTo(1);
        assertThat(n.get("clientsRecycled").asLong()).isEqualTo(2);
        assertThat(n.get("itemsPerSec").asDouble()).isEqualTo(2.0);
        assertThat(n.get("heapPeakMb").asLong()).isEqualTo(150);
    }

    @Test
    void closeWritesFinalSnapshot(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("stats/progress.ndjson");
        ProgressDumper d = new ProgressDumper(ProgressDumperTest::snap, out, 60_000);
        d.start();
        d.close();
        d.close();

        List<String> lines = Files.readAllLines(out);
        assertThat(lines).hasSize(1);
        assertThat(lines.get(0)).contains("\"total\":10");
    }
}
