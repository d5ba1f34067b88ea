package com.fiftyalert.dispatcher.domain.dispatch;

import com.fiftyalert.dispatcher.domain.dispatch.TransportOutcome.AlreadyNotified;
import com.fiftyalert.dispatcher.domain.dispatch.TransportOutcome.PermanentFailure;
import com.fiftyalert.dispatcher.domain.dispatch.TransportOutcome.RateLimited;
import com.fiftyalert.dispatcher.domain.dispatch.TransportOutcome.Sent;
import com.fiftyalert.dispatcher.domain.dispatch.TransportOutcome.TransientFailure;
import com.fiftyalert.dispatcher.domain.policy.DispatchPolicy;
import com.fiftyalert.dispatcher.domain.recipient.Recipient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Delivers a batch to one recipient, retrying rate limits and transient failures up to
 * {@link DispatchPolicy#retryCeiling()} attempts.
 *
 * <p>Attempts run on the dispatch executor and backoff waits are scheduled on a delayed executor,
 * so no thread is parked while a recipient waits for its next attempt. The returned future never
 * completes exceptionally.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DispatchDriver {

    private final NotificationTransport transport;
    private final RetryPolicy retryPolicy;
    private final DispatchPolicy policy;
    private final ExecutorService dispatchExecutor;

    public CompletableFuture<DispatchOutcome> deliver(Recipient recipient, AlertBatch batch) {
        return sendAttempt(recipient, batch, 1)
                .exceptionally(error -> {
                    log.error("Dispatch to recipient {} aborted", recipient.id(), error);
                    return DispatchOutcome.failed("dispatch aborted: " + rootCause(error).getMessage());
                });
    }

    private CompletableFuture<DispatchOutcome> sendAttempt(Recipient recipient, AlertBatch batch, int attempt) {
        return CompletableFuture
                .supplyAsync(() -> transport.send(recipient, batch.content()), dispatchExecutor)
                .orTimeout(policy.attemptTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle(DispatchDriver::classify)
                .thenCompose(outcome -> resolve(recipient, batch, attempt, outcome));
    }

    private CompletableFuture<DispatchOutcome> resolve(
            Recipient recipient, AlertBatch batch, int attempt, TransportOutcome outcome) {
        if (outcome instanceof Sent) {
            log.debug("Delivered to recipient {} on attempt {}", recipient.id(), attempt);
            return CompletableFuture.completedFuture(DispatchOutcome.delivered());
        }
        if (outcome instanceof AlreadyNotified) {
            log.debug("Recipient {} already has notification {}", recipient.id(), batch.content().idempotencyKey());
            return CompletableFuture.completedFuture(DispatchOutcome.alreadyDelivered());
        }
        if (outcome instanceof PermanentFailure failure) {
            log.warn("dispatch.recipient.failed: recipient={}, attempt={}, reason={}",
                    recipient.id(), attempt, failure.reason());
            return CompletableFuture.completedFuture(DispatchOutcome.failed(failure.reason()));
        }

        var reason = retryableReason(outcome);
        if (attempt >= policy.retryCeiling()) {
            log.warn("dispatch.recipient.exhausted: recipient={}, attempts={}, last_reason={}",
                    recipient.id(), attempt, reason);
            return CompletableFuture.completedFuture(DispatchOutcome.failed(reason));
        }

        var delayMs = retryPolicy.computeDelayMs(attempt);
        log.debug("Retrying recipient {} in {}ms after attempt {}: {}", recipient.id(), delayMs, attempt, reason);
        var delayed = CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS, dispatchExecutor);
        return CompletableFuture
                .supplyAsync(() -> attempt + 1, delayed)
                .thenCompose(next -> sendAttempt(recipient, batch, next));
    }

    static TransportOutcome classify(TransportOutcome outcome, Throwable error) {
        if (error == null) {
            return outcome != null ? outcome : new PermanentFailure("transport returned no outcome");
        }
        var cause = rootCause(error);
        if (cause instanceof TimeoutException) {
            return new TransientFailure("attempt timed out");
        }
        return new PermanentFailure(cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    private static String retryableReason(TransportOutcome outcome) {
        if (outcome instanceof RateLimited rateLimited) {
            return "rate limited: " + rateLimited.reason();
        }
        return ((TransientFailure) outcome).reason();
    }

    private static Throwable rootCause(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
