package com.fiftyalert.dispatcher.domain.dispatch;

import com.fiftyalert.common.event.ScoringEvent;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Plain-text notification for a batch of pending events. Events are listed newest first and the
 * subject names the newest performance.
 */
@Component
public class AlertContentComposer {

    static final String PROMO_CODE = "NBA50";

    private static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.US);

    public AlertContent compose(List<ScoringEvent> events) {
        if (events.isEmpty()) {
            throw new IllegalArgumentException("Cannot compose a notification without events");
        }
        var newestFirst = events.stream()
                .sorted(Comparator.comparing(ScoringEvent::date).reversed())
                .toList();
        var latest = newestFirst.get(0);

        var subject = "DoorDash 50% OFF Today! " + latest.player() + " scored " + latest.points() + " points";
        var text = new StringBuilder();
        for (var event : newestFirst) {
            text.append(event.player()).append(": ")
                    .append(event.points()).append(" points, ")
                    .append(event.team()).append(" vs ").append(event.opponent()).append(", ")
                    .append(LocalDate.parse(event.date()).format(DISPLAY_DATE))
                    .append('\n');
        }
        text.append('\n')
                .append("Use code ").append(PROMO_CODE).append(" at checkout. Valid today only!");

        return new AlertContent(idempotencyKey(events), subject, text.toString());
    }

    static String idempotencyKey(List<ScoringEvent> events) {
        var joined = String.join("|", events.stream().map(ScoringEvent::alertKey).sorted().toList());
        return UUID.nameUUIDFromBytes(joined.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
