package com.fiftyalert.dispatcher.domain.session;

public enum SessionState {
    IDLE,
    VALIDATING,
    DIFFING,
    FETCHING_RECIPIENTS,
    DISPATCHING,
    DECIDING,
    /** Ledger holds every pending key (or there was nothing pending). */
    COMMITTED,
    /** Nothing recorded; the same batch is retried in full on the next run. */
    DEFERRED,
    /** Run refused to record a suspicious outcome; needs operator attention before retrying. */
    FATAL,
    /** Notifications went out but the ledger write failed; re-running would duplicate sends. */
    UNRECORDED;

    public boolean isTerminal() {
        return this == COMMITTED || this == DEFERRED || this == FATAL || this == UNRECORDED;
    }
}
