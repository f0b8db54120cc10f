package com.pageharvest.core.util;

import java.time.Duration;

/** 대기 추상화. 테스트에서는 기록용/무대기 구현을 주입한다. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    Sleeper SYSTEM = d -> {
        long ms = Math.max(0, d.toMillis());
        if (ms > 0) Thread.sleep(ms);
    };

    Sleeper NONE = d -> {};
}
