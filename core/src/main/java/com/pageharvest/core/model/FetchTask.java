package com.pageharvest.core.model;

import java.util.Objects;

/**
 * WorkItem + 재시도 카운터.
 * 공유 큐 또는 그것을 꺼낸 워커 한 곳에만 존재하므로 동기화하지 않는다.
 */
public final class FetchTask {
    private final WorkItem item;
    private int retries; // 지금까지 큐에 되돌려진 횟수

    public FetchTask(WorkItem item) {
        this.item = Objects.requireNonNull(item, "item");
    }

    public WorkItem getItem() { return item; }
    public int getRetries() { return retries; }

    /** 재큐잉 직전에 호출 */
    public int incrementRetries() { return ++retries; }

    public String identity() { return item.identity(); }

    @Override public String toString() {
        return "FetchTask{" + item.identity() + ", retries=" + retries + "}";
    }
}
