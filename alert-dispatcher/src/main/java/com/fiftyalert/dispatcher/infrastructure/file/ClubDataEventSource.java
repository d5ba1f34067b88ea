package com.fiftyalert.dispatcher.infrastructure.file;

import com.fiftyalert.common.event.ScoringEvent;
import com.fiftyalert.dispatcher.domain.event.ScoringEventSource;
import com.fiftyalert.dispatcher.domain.exceptions.EventSourceException;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads candidate events from the season "50+ club" document written by the data collection job.
 * Rows are passed on as found; validation is the session's concern. A row that is not a JSON object
 * is skipped with a warning, and a field of the wrong shape reaches validation as missing, so one bad
 * row never hides the others.
 */
@Slf4j
public class ClubDataEventSource implements ScoringEventSource {

    private final Path path;
    private final ObjectMapper objectMapper;

    public ClubDataEventSource(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ScoringEvent> fetchCandidates() {
        if (!Files.exists(path)) {
            throw EventSourceException.missing(path);
        }
        ClubDataDocument document;
        try {
            document = objectMapper.readValue(Files.readAllBytes(path), ClubDataDocument.class);
        } catch (IOException | JacksonException e) {
            throw EventSourceException.unreadable(path, e);
        }
        if (document == null || document.scorers() == null) {
            log.warn("No scorers listed in {}", path);
            return List.of();
        }
        log.info("events.loaded: path={}, season={}, last_checked={}, scorers={}",
                path, document.season(), document.lastCheckedDate(), document.scorers().size());
        var events = new ArrayList<ScoringEvent>(document.scorers().size());
        for (int index = 0; index < document.scorers().size(); index++) {
            if (document.scorers().get(index) instanceof Map<?, ?> row) {
                events.add(toEvent(row, index));
            } else {
                log.warn("Skipping scorers[{}] in {}: expected an object but found {}",
                        index, path, document.scorers().get(index));
            }
        }
        return List.copyOf(events);
    }

    private ScoringEvent toEvent(Map<?, ?> row, int index) {
        return ScoringEvent.builder()
                .date(text(row, "date", index))
                .player(text(row, "player", index))
                .team(text(row, "team", index))
                .points(integerPoints(row.get("points")))
                .opponent(text(row, "opponent", index))
                .build();
    }

    private String text(Map<?, ?> row, String field, int index) {
        var raw = row.get(field);
        if (raw == null || raw instanceof String) {
            return (String) raw;
        }
        if (raw instanceof Number || raw instanceof Boolean) {
            return String.valueOf(raw);
        }
        log.warn("scorers[{}].{} in {} is not a scalar, treating it as missing", index, field, path);
        return null;
    }

    /**
     * Only integral JSON numbers count as points; anything else (strings, fractions, booleans)
     * becomes null and is rejected by validation.
     */
    static Integer integerPoints(Object raw) {
        if (raw instanceof Integer value) {
            return value;
        }
        if (raw instanceof Long value && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return value.intValue();
        }
        if (raw instanceof BigInteger value && value.bitLength() < Integer.SIZE) {
            return value.intValue();
        }
        return null;
    }

    record ClubDataDocument(
            Object season,
            Object lastUpdated,
            Object lastCheckedDate,
            Object totalGames,
            List<Object> scorers
    ) {
    }
}
