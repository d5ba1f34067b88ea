package com.fiftyalert.dispatcher.domain.validation;

import com.fiftyalert.common.event.ScoringEvent;
import com.fiftyalert.dispatcher.domain.policy.DispatchPolicy;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Sanity rules a candidate event must pass before it may trigger any external side effect.
 * Every rule is evaluated so the log shows the full set of problems for one event.
 */
@Component
@RequiredArgsConstructor
public class EventValidator {

    public static final int MIN_POINTS = 50;
    public static final int MAX_POINTS = 100;

    private static final Pattern TEAM_CODE = Pattern.compile("[A-Z]{2,4}");

    private final DispatchPolicy policy;
    private final Clock clock;

    /**
     * @return violation descriptions, empty when the event is valid
     */
    public List<String> validate(ScoringEvent event) {
        var violations = new ArrayList<String>();
        if (isBlank(event.player())) {
            violations.add("player is missing");
        }
        checkPoints(event.points(), violations);
        checkDate(event.date(), violations);
        checkTeam(event.team(), violations);
        return List.copyOf(violations);
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(policy.zone()));
    }

    /**
     * First day of the season start month; last year's when today is earlier in the calendar.
     */
    public LocalDate seasonStart(LocalDate today) {
        var year = today.getMonthValue() < policy.seasonStartMonth() ? today.getYear() - 1 : today.getYear();
        return LocalDate.of(year, policy.seasonStartMonth(), 1);
    }

    private void checkPoints(Integer points, List<String> violations) {
        if (points == null) {
            violations.add("points is missing or not an integer");
        } else if (points > MAX_POINTS) {
            violations.add("points " + points + " is impossible (above " + MAX_POINTS + "), likely upstream corruption");
        } else if (points < MIN_POINTS) {
            violations.add("points " + points + " is below " + MIN_POINTS);
        }
    }

    private void checkDate(String date, List<String> violations) {
        if (isBlank(date)) {
            violations.add("date is missing");
            return;
        }
        LocalDate parsed;
        try {
            parsed = LocalDate.parse(date, DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            violations.add("date '" + date + "' is not a yyyy-MM-dd calendar date");
            return;
        }
        var today = today();
        if (parsed.isAfter(today)) {
            violations.add("date " + parsed + " is in the future (today is " + today + ")");
        }
        var seasonStart = seasonStart(today);
        if (parsed.isBefore(seasonStart)) {
            violations.add("date " + parsed + " is before the season start " + seasonStart);
        }
    }

    private void checkTeam(String team, List<String> violations) {
        if (isBlank(team)) {
            violations.add("team is missing");
        } else if (!TEAM_CODE.matcher(team).matches()) {
            violations.add("team '" + team + "' is not a 2-4 letter uppercase code");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
