package com.fiftyalert.dispatcher.domain.session;

import com.fiftyalert.dispatcher.domain.dispatch.AlertContent;
import lombok.Builder;

import java.util.List;

@Builder(toBuilder = true)
public record SessionReport(
        String runId,
        SessionState state,
        String reason,
        int candidates,
        int invalid,
        int duplicates,
        int alreadyRecorded,
        int stale,
        int pending,
        int recipients,
        AlertContent notification,
        DeliveryTally tally,
        List<String> committedKeys
) {

    public SessionReport {
        tally = tally != null ? tally : DeliveryTally.empty();
        committedKeys = committedKeys != null ? List.copyOf(committedKeys) : List.of();
    }

    /**
     * True only when the run ended with the ledger in step with what was delivered.
     */
    public boolean success() {
        return state == SessionState.COMMITTED;
    }
}
