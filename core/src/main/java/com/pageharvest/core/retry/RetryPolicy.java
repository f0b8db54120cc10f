package com.pageharvest.core.retry;

import com.pageharvest.core.model.FetchTask;

/** 실패한 시도 직후 재큐잉 여부를 결정하는 정책 */
public interface RetryPolicy {
    /** 이번 실패 뒤 다시 큐에 넣을지. task의 재시도 카운터는 아직 증가 전이다. */
    boolean shouldRetry(FetchTask task);

    /** 작업당 허용 재시도 횟수. 시도는 최대 maxRetries + 1번. */
    int maxRetries();
}
