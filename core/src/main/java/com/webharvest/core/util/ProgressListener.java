package com.webharvest.core.util;

/** 단계별 진행 콜백. 추출 단계에서는 워커 스레드에서 호출될 수 있다 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * @param progress 0.0~1.0
     * @param phase    "discover" | "extract" | "process"
     * @param done     처리 수(모르면 -1)
     * @param total    전체 수(모르면 -1)
     */
    void onProgress(double progress, String phase, long done, long total);

    /** done/total 로 진행률 계산. total 을 모르면 0.0 */
    default void step(String phase, long done, long total) {
        double p = (total > 0 && done >= 0) ? Math.min(1.0, (double) done / total) : 0.0;
        onProgress(p, phase, done, total);
    }

    ProgressListener NONE = (p, phase, d, t) -> {};
}
