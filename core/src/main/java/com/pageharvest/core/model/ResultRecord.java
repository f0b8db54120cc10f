package com.pageharvest.core.model;

import java.net.URI;
import java.util.Objects;

/**
 * WorkItem 당 정확히 하나 생성되는 최종 결과.
 * 성공이면 payload, 실패면 errorKind/errorMessage가 채워진다.
 */
public final class ResultRecord {

    public enum Status { SUCCESS, ERROR }

    private final String identity;
    private final URI url;
    private final Status status;
    private final Object payload;
    private final FailureKind errorKind;
    private final String errorMessage;
    private final int retriesUsed;

    private ResultRecord(String identity, URI url, Status status, Object payload,
                         FailureKind errorKind, String errorMessage, int retriesUsed) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.url = url;
        this.status = Objects.requireNonNull(status, "status");
        this.payload = payload;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
        this.retriesUsed = Math.max(0, retriesUsed);
    }

    public static ResultRecord success(FetchTask task, Object payload) {
        WorkItem item = task.getItem();
        return new ResultRecord(item.identity(), item.getUrl(), Status.SUCCESS, payload, null, null, task.getRetries());
    }

    public static ResultRecord error(FetchTask task, FailureKind kind, String message) {
        WorkItem item = task.getItem();
        return new ResultRecord(item.identity(), item.getUrl(), Status.ERROR, null,
                Objects.requireNonNull(kind, "kind"), message, task.getRetries());
    }

    public String getIdentity() { return identity; }
    public URI getUrl() { return url; }
    public Status getStatus() { return status; }
    public Object getPayload() { return payload; }
    public FailureKind getErrorKind() { return errorKind; }
    public String getErrorMessage() { return errorMessage; }
    /** 이 결과에 도달하기 전 수행된 재시도 횟수 */
    public int getRetriesUsed() { return retriesUsed; }

    public boolean isSuccess() { return status == Status.SUCCESS; }

    @Override public String toString() {
        return isSuccess()
                ? "ResultRecord{" + identity + ", SUCCESS, retries=" + retriesUsed + "}"
                : "ResultRecord{" + identity + ", ERROR " + errorKind + ": " + errorMessage + ", retries=" + retriesUsed + "}";
    }
}
