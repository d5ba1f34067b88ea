package com.fiftyalert.dispatcher.domain.exceptions;

import java.nio.file.Path;

public class EventSourceException extends RuntimeException {

    private EventSourceException(String message, Throwable cause) {
        super(message, cause);
    }

    public static EventSourceException missing(Path source) {
        return new EventSourceException("Scoring data file not found: " + source, null);
    }

    public static EventSourceException unreadable(Path source, Throwable cause) {
        return new EventSourceException("Could not read scoring data " + source + ": " + cause.getMessage(), cause);
    }
}
