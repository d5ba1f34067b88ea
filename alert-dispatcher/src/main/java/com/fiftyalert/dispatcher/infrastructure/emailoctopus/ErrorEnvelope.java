package com.fiftyalert.dispatcher.infrastructure.emailoctopus;

/**
 * Error body returned by the API: {@code {"error": {"code": "...", "message": "..."}}}.
 */
record ErrorEnvelope(Error error) {

    record Error(String code, String message) {
    }
}
