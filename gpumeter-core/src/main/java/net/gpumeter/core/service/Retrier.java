package net.gpumeter.core.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/** 일시적 인프라 오류(blob 쓰기, 큐 적재) 재시도 */
public final class Retrier {
    private static final Logger log = LoggerFactory.getLogger(Retrier.class);

    private final RetryPolicy policy;
    private final int maxAttempts;

    public Retrier(RetryPolicy policy, int maxAttempts) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.policy = policy;
        this.maxAttempts = maxAttempts;
    }

    /** 마지막 시도의 예외를 그대로 던짐 */
    public <T> T call(String what, Callable<T> body) throws Exception {
        for (int attempt = 1; ; attempt++) {
            try {
                return body.call();
            } catch (Exception e) {
                if (attempt >= maxAttempts) {
                    log.warn("{} failed after {} attempts: {}", what, attempt, e.toString());
                    throw e;
                }
                var backoff = policy.nextBackoff(attempt);
                log.debug("{} failed (attempt {}/{}), retrying in {}: {}", what, attempt, maxAttempts, backoff, e.toString());
                Thread.sleep(backoff.toMillis());
            }
        }
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
