package com.pageharvest.core.retry;

import com.pageharvest.core.model.FetchTask;

/** 지금까지 재시도 횟수가 maxRetries 미만이면 재시도. 지연(backoff) 없이 큐 꼬리로 보낸다. */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxRetries;

    public DefaultRetryPolicy() { this(5); }
    public DefaultRetryPolicy(int maxRetries) {
        this.maxRetries = Math.max(0, maxRetries);
    }

    @Override public boolean shouldRetry(FetchTask task) {
        return task.getRetries() < maxRetries;
    }

    @Override public int maxRetries() { return maxRetries; }

    @Override public String toString() { return "DefaultRetryPolicy{maxRetries=" + maxRetries + "}"; }
}
