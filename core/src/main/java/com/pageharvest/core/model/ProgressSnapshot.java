package com.pageharvest.core.model;

/** ProgressTracker의 불변 스냅샷 DTO */
public final class ProgressSnapshot {
    public final int  total;
    public final long processed;      // 시도 횟수(재시도 포함)
    public final long succeeded;
    public final long failed;         // 최종 실패만
    public final long retried;        // 재큐잉 횟수
    public final int  uniqueSeen;     // 한 번 이상 시도된 식별자 수
    public final long clientsRecycled;
    public final long elapsedMs;
    public final long heapUsedMb;
    public final long heapPeakMb;

    public ProgressSnapshot(int total, long processed, long succeeded, long failed, long retried,
                            int uniqueSeen, long clientsRecycled, long elapsedMs,
                            long heapUsedMb, long heapPeakMb) {
        this.total = total;
        this.processed = processed;
        this.succeeded = succeeded;
        this.failed = failed;
        this.retried = retried;
        this.uniqueSeen = uniqueSeen;
        this.clientsRecycled = clientsRecycled;
        this.elapsedMs = elapsedMs;
        this.heapUsedMb = heapUsedMb;
        this.heapPeakMb = heapPeakMb;
    }

    /** 최종 결과가 확정된 작업 수 */
    public long completed() { return succeeded + failed; }

    /** 0.0~1.0 */
    public double progress() {
        if (total <= 0) return 1.0;
        return Math.min(1.0, (double) completed() / total);
    }

    /** 초당 처리(시도) 수 */
    public double itemsPerSecond() {
        return elapsedMs > 0 ? processed * 1000.0 / elapsedMs : 0.0;
    }
}
