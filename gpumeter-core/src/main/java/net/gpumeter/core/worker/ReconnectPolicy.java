package net.gpumeter.core.worker;

import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;

/** 로그 전달 재연결: 지수 백오프(상한 있음) + 최대 시도 횟수 */
public record ReconnectPolicy(int maxAttempts, Duration minBackoff, Duration maxBackoff) {
    public ReconnectPolicy {
        if (maxAttempts < 0) throw new IllegalArgumentException("maxAttempts must be >= 0");
        if (minBackoff.compareTo(maxBackoff) > 0) throw new IllegalArgumentException("minBackoff > maxBackoff");
    }

    public static ReconnectPolicy defaults() {
        return new ReconnectPolicy(5, Duration.ofMillis(200), Duration.ofSeconds(5));
    }

    RetryBackoffSpec toRetry() {
        return Retry.backoff(maxAttempts, minBackoff).maxBackoff(maxBackoff).jitter(0.2);
    }
}
