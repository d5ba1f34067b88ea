package com.fiftyalert.dispatcher.domain.dispatch;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Delay {@code baseDelay * 2^attempt}, capped at {@code maxDelay}, with jitter in [0.5, 1.5).
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;

    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    @Override
    public long computeDelayMs(int attempt) {
        if (attempt <= 0 || baseDelayMs == 0) {
            return 0L;
        }
        long exponential;
        if (attempt >= 62) {
            exponential = Long.MAX_VALUE;
        } else {
            long factor = 1L << attempt;
            exponential = factor > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * factor;
        }
        long capped = Math.min(maxDelayMs, exponential);
        double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
        return Math.min(maxDelayMs, Math.max(0L, (long) (capped * jitter)));
    }
}
