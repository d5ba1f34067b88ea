package com.fiftyalert.dispatcher.domain.ledger;

import java.time.Instant;
import java.util.Set;

/**
 * Snapshot of the alert keys already dispatched. {@code lastUpdated} is null for a ledger
 * that has never been committed.
 */
public record LedgerState(Set<String> sentAlerts, Instant lastUpdated) {

    public LedgerState {
        sentAlerts = Set.copyOf(sentAlerts);
    }

    public static LedgerState empty() {
        return new LedgerState(Set.of(), null);
    }

    public boolean contains(String alertKey) {
        return sentAlerts.contains(alertKey);
    }

    public int size() {
        return sentAlerts.size();
    }
}
