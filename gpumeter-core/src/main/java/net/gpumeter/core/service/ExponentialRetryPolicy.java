package net.gpumeter.core.service;

import java.time.Duration;

final class ExponentialRetryPolicy implements RetryPolicy {
    private final Duration base;
    private final Duration max;

    ExponentialRetryPolicy(Duration base, Duration max) {
        this.base = base; this.max = max;
    }

    @Override public Duration nextBackoff(long attempt) {
        long exp = Math.max(0, Math.min(attempt - 1, 20)); // overflow 방지
        long ms = base.toMillis() * (1L << exp);
        return Duration.ofMillis(Math.min(ms, max.toMillis()));
    }
}
