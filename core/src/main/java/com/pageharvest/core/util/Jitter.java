package com.pageharvest.core.util;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 클라이언트 생성/작업 완료 뒤의 랜덤 지연 [min, max].
 * 0~0 이면 sleeper를 호출하지 않는다.
 */
public final class Jitter {
    private final long minMs;
    private final long maxMs;
    private final Sleeper sleeper;

    public Jitter(Duration min, Duration max, Sleeper sleeper) {
        this.minMs = Math.max(0, Objects.requireNonNull(min, "min").toMillis());
        this.maxMs = Math.max(this.minMs, Objects.requireNonNull(max, "max").toMillis());
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public static Jitter none() {
        return new Jitter(Duration.ZERO, Duration.ZERO, Sleeper.NONE);
    }

    /** 다음 지연 시간 (min 이상 max 이하) */
    public Duration next() {
        if (maxMs == minMs) return Duration.ofMillis(minMs);
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(minMs, maxMs + 1));
    }

    public void pause() throws InterruptedException {
        if (maxMs == 0) return;
        sleeper.sleep(next());
    }
}
