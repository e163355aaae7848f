package com.calai.nutrilabel.nutrient.source.upstream;

import java.time.Duration;

/**
 * 外部 HTTP 重試規則
 * - maxAttempts=3：第 3 次失敗就放棄，降級成「查無資料」
 * - HTTP 429/5xx：httpBackoff × 第幾次（預設 0.6s, 1.2s）
 * - 網路 / IO 例外：ioBackoff × 第幾次（預設 0.5s, 1.0s）
 */
public final class UpstreamRetryPolicy {

    private final int maxAttempts;
    private final Duration httpBackoff;
    private final Duration ioBackoff;

    public UpstreamRetryPolicy(int maxAttempts, Duration httpBackoff, Duration ioBackoff) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.httpBackoff = httpBackoff;
        this.ioBackoff = ioBackoff;
    }

    public static UpstreamRetryPolicy from(UpstreamProperties props) {
        return new UpstreamRetryPolicy(
                props.maxAttemptsOrDefault(),
                props.httpBackoffOrDefault(),
                props.ioBackoffOrDefault()
        );
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /** attempt：剛失敗的是第幾次（1-based） */
    public Duration httpDelay(int attempt) {
        return httpBackoff.multipliedBy(Math.max(1, attempt));
    }

    public Duration ioDelay(int attempt) {
        return ioBackoff.multipliedBy(Math.max(1, attempt));
    }

    public boolean shouldGiveUp(int attempt) {
        return attempt >= maxAttempts;
    }
}
