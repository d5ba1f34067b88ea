package com.fiftyalert.dispatcher.domain.dispatch;

/**
 * Strategy for computing the delay before retrying a transport attempt.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * @param attempt the number of attempts made so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempt);
}
