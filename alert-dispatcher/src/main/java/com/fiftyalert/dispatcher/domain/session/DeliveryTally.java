package com.fiftyalert.dispatcher.domain.session;

import com.fiftyalert.dispatcher.domain.dispatch.DispatchOutcome;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Aggregate of per-recipient outcomes of one run.
 */
public record DeliveryTally(int delivered, int alreadyDelivered, int failed, List<String> failureReasons) {

    public DeliveryTally {
        failureReasons = List.copyOf(failureReasons);
    }

    public static DeliveryTally empty() {
        return new DeliveryTally(0, 0, 0, List.of());
    }

    public static DeliveryTally of(Collection<DispatchOutcome> outcomes) {
        int delivered = 0;
        int alreadyDelivered = 0;
        var failures = new ArrayList<String>();
        for (var outcome : outcomes) {
            if (outcome instanceof DispatchOutcome.Delivered) {
                delivered++;
            } else if (outcome instanceof DispatchOutcome.AlreadyDelivered) {
                alreadyDelivered++;
            } else if (outcome instanceof DispatchOutcome.Failed failed) {
                failures.add(failed.reason());
            }
        }
        return new DeliveryTally(delivered, alreadyDelivered, failures.size(), failures);
    }

    public int attempts() {
        return delivered + alreadyDelivered + failed;
    }

    /**
     * (delivered + alreadyDelivered) / attempts; 1.0 when nothing was attempted.
     */
    public double effectiveRate() {
        return attempts() == 0 ? 1.0 : (double) (delivered + alreadyDelivered) / attempts();
    }

    public boolean allAlreadyDelivered() {
        return alreadyDelivered > 0 && delivered == 0 && failed == 0;
    }
}
