package com.pageharvest.app;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HarvestCliTest {

    @Test
    void defaultsToHttpMode() {
        HarvestCli.Args a = HarvestCli.parseArgs(new String[]{"harvest.yml", "urls.txt", "out.json"});
        assertThat(a.mode()).isEqualTo(HarvestCli.Mode.HTTP);
        assertThat(a.config()).isEqualTo(Path.of("harvest.yml"));
        assertThat(a.out()).isEqualTo(Path.of("out.json"));
    }

    @Test
    void modeOptionInBothForms() {
        assertThat(HarvestCli.parseArgs(new String[]{"--mode", "browser", "c.yml", "i.txt", "o.json"}).mode())
                .isEqualTo(HarvestCli.Mode.BROWSER);
        assertThat(HarvestCli.parseArgs(new String[]{"c.yml", "i.txt", "o.json", "--mode=HTTP"}).mode())
                .isEqualTo(HarvestCli.Mode.HTTP);
    }

    @Test
    void badArgumentsAreRejected() {
        assertThatThrownBy(() -> HarvestCli.parseArgs(new String[]{"c.yml", "i.txt"}))
                .hasMessageContaining("expected 3 arguments");
        assertThatThrownBy(() -> HarvestCli.parseArgs(new String[]{"c.yml", "i.txt", "o.json", "--fast"}))
                .hasMessageContaining("unknown option");
        assertThatThrownBy(() -> HarvestCli.parseArgs(new String[]{"--mode=ftp", "c.yml", "i.txt", "o.json"}))
                .hasMessageContaining("unknown mode");
        assertThatThrownBy(() -> HarvestCli.parseArgs(new String[]{"c.yml", "i.txt", "o.json", "--mode"}))
                .hasMessageContaining("requires a value");
    }

    @Test
    void usageErrorExitsWithCode2() {
        assertThat(HarvestCli.run(new String[0])).isEqualTo(HarvestCli.EXIT_USAGE);
    }
}
