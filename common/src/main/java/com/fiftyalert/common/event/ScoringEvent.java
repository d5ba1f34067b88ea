package com.fiftyalert.common.event;

import lombok.Builder;

/**
 * One 50+ point performance as recorded by the season data job.
 *
 * <p>{@code date} is carried as received ({@code yyyy-MM-dd}) and {@code points} is null when the
 * upstream value was not an integer, so that validation can report the problem instead of the
 * reader rejecting the whole document.
 */
@Builder(toBuilder = true)
public record ScoringEvent(
        String date,
        String player,
        String team,
        Integer points,
        String opponent
) {

    public static final String KEY_SEPARATOR = "_";

    /**
     * Dedup identity: {@code date_player_points}. Two events with the same key are the same
     * notification opportunity even if team or opponent differ.
     */
    public String alertKey() {
        return date + KEY_SEPARATOR + player + KEY_SEPARATOR + points;
    }
}
