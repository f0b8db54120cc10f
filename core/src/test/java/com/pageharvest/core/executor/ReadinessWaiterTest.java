package com.pageharvest.core.executor;

import com.pageharvest.core.model.FetchConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ReadinessWaiterTest {

    @Test
    void notConfiguredSkipsWaiting() {
        FakePage page = new FakePage();
        var w = new ReadinessWaiter(new FetchConfig.ReadinessCfg());

        assertThat(w.await(page)).isEqualTo(ReadinessWaiter.Stage.NOT_CONFIGURED);
        assertThat(page.waited).isEmpty();
    }

    @Test
    void primaryOnlyTimesOutWithoutFallback() {
        var cfg = new FetchConfig.ReadinessCfg().setPrimarySelector("#list");
        FakePage page = new FakePage();

        var w = new ReadinessWaiter(cfg);
        assertThat(w.await(page)).isEqualTo(ReadinessWaiter.Stage.TIMED_OUT);
        assertThat(w.describeTimeout("https://ex.com")).startsWith("Timeout waiting for selector '#list'");
    }

    @Test
    void scrollsToFoundElementAndWaitsForLazyLoad() {
        var cfg = new FetchConfig.ReadinessCfg()
                .setPrimarySelector("#list")
                .setFallbackSelector("#empty")
                .setScrollToElement(true)
                .setLazyLoadWait(Duration.ofMillis(1500));
        FakePage page = new FakePage().present("#empty");

        assertThat(new ReadinessWaiter(cfg).await(page)).isEqualTo(ReadinessWaiter.Stage.FALLBACK);
        assertThat(page.scrolled).containsExactly("#empty");
        assertThat(page.pauses).containsExactly(Duration.ofMillis(1500));
    }
}
