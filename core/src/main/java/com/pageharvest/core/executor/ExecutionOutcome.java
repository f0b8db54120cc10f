package com.pageharvest.core.executor;

import com.pageharvest.core.model.FailureKind;
import com.pageharvest.core.model.FetchTask;
import com.pageharvest.core.model.ResultRecord;
import com.pageharvest.core.retry.RetryPolicy;

import java.util.Objects;

/**
 * 시도 한 번의 결과.
 * needsRetry가 true면 record는 이번 실패의 기록일 뿐 최종 결과가 아니다(워커가 버린다).
 */
public record ExecutionOutcome(ResultRecord record, boolean needsRetry) {

    public ExecutionOutcome {
        Objects.requireNonNull(record, "record");
    }

    public static ExecutionOutcome success(FetchTask task, Object payload) {
        return new ExecutionOutcome(ResultRecord.success(task, payload), false);
    }

    /**
     * 실패를 재시도 결정으로 접는다.
     * 재시도면 카운터를 올린 뒤 기록을 만들고, 아니면 현재 카운터로 최종 에러 레코드를 만든다.
     */
    public static ExecutionOutcome failure(FetchTask task, RetryPolicy policy, FailureKind kind, String message) {
        if (policy.shouldRetry(task)) {
            task.incrementRetries();
            return new ExecutionOutcome(ResultRecord.error(task, kind, message), true);
        }
        return new ExecutionOutcome(ResultRecord.error(task, kind, message), false);
    }

    public boolean isSuccess() { return record.isSuccess(); }

    public FailureKind failureKind() { return record.getErrorKind(); }
}
