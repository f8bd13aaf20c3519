package net.gpumeter.core.service;

import java.time.Duration;

public interface RetryPolicy {
    /** attempt는 1부터 */
    Duration nextBackoff(long attempt);

    /** 고정 백오프 정책 */
    static RetryPolicy fixed(Duration backoff) {
        return attempt -> backoff;
    }

    /** base * 2^(attempt-1), max로 상한 */
    static RetryPolicy exponential(Duration base, Duration max) {
        return new ExponentialRetryPolicy(base, max);
    }
}
