package com.pageharvest.core.service;

import com.pageharvest.core.model.ProgressSnapshot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressTrackerTest {

    @Test
    void countsSuccessRetryAndTerminalFailure() {
        List<Long> done = new ArrayList<>();
        ProgressTracker t = new ProgressTracker(3, (p, phase, d, total) -> done.add(d));

        t.update("a", true, false);
        t.update("b", false, true);
        t.update("b", false, true);
        t.update("b", false, false);
        t.update("c", true, false);
        t.recordRecycle();

        ProgressSnapshot s = t.snapshot();
        assertThat(s.total).isEqualTo(3);
        assertThat(s.processed).isEqualTo(5);
        assertThat(s.succeeded).isEqualTo(2);
        assertThat(s.failed).isEqualTo(1);
        assertThat(s.retried).isEqualTo(2);
        assertThat(s.uniqueSeen).isEqualTo(3);
        assertThat(s.clientsRecycled).isEqualTo(1);
        assertThat(s.completed()).isEqualTo(3);
        assertThat(s.progress()).isEqualTo(1.0);
        assertThat(done).containsExactly(1L, 1L, 1L, 2L, 3L);
    }

    @Test
    void listenerFailureDoesNotBreakCounting() {
        ProgressTracker t = new ProgressTracker(1, (p, phase, d, total) -> { throw new IllegalStateException("ui gone"); });
        t.update("x", true, false);
        assertThat(t.snapshot().succeeded).isEqualTo(1);
    }

    @Test
    void progressLineIsReadable() {
        ProgressSnapshot s = new ProgressSnapshot(4, 3, 2, 0, 1, 2, 0, 2_000, 50, 60);
        assertThat(ProgressTracker.progressLine(s))
                .startsWith("Progress: 50.0% (2/4)")
                .contains("Retries: 1")
                .contains("Rate: 1.50/s");
    }
}
