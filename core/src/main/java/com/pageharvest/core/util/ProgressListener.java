package com.pageharvest.core.util;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param progress 0.0~1.0, 최종 결과가 확정된 작업 비율
     * @param phase    "fetch" | "done"
     * @param done     최종 결과 수(성공 + 최종 실패)
     * @param total    제출된 작업 수
     */
    void onProgress(double progress, String phase, long done, long total);

    ProgressListener NONE = (p, phase, d, t) -> {};
}
