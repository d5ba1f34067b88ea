package com.fiftyalert.dispatcher.domain.dispatch;

import com.fiftyalert.common.event.ScoringEvent;

import java.util.List;

/**
 * Pending events of one run, sent to every recipient as a single notification.
 */
public record AlertBatch(List<ScoringEvent> events, AlertContent content) {

    public AlertBatch {
        events = List.copyOf(events);
    }

    public List<String> alertKeys() {
        return events.stream().map(ScoringEvent::alertKey).toList();
    }
}
