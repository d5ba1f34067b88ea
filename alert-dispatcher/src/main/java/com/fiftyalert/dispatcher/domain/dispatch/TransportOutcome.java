package com.fiftyalert.dispatcher.domain.dispatch;

/**
 * Closed set of results a transport attempt can have.
 */
public sealed interface TransportOutcome {

    record Sent() implements TransportOutcome {
    }

    /** The recipient's history already contains this notification. */
    record AlreadyNotified() implements TransportOutcome {
    }

    record RateLimited(String reason) implements TransportOutcome {
    }

    /** Timeouts, connection resets, 5xx responses. */
    record TransientFailure(String reason) implements TransportOutcome {
    }

    record PermanentFailure(String reason) implements TransportOutcome {
    }
}
