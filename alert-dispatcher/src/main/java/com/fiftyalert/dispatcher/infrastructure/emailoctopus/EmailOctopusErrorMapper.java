package com.fiftyalert.dispatcher.infrastructure.emailoctopus;

import com.fiftyalert.dispatcher.domain.dispatch.TransportOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Maps a non-2xx API response onto the closed set of transport outcomes. This is the only place
 * that knows the provider's error codes.
 */
@Slf4j
@RequiredArgsConstructor
public class EmailOctopusErrorMapper {

    static final String MEMBER_ALREADY_IN_AUTOMATION = "MEMBER_ALREADY_IN_AUTOMATION";
    static final String TOO_MANY_REQUESTS = "TOO_MANY_REQUESTS";

    private static final int HTTP_TOO_MANY_REQUESTS = 429;

    private final ObjectMapper objectMapper;

    public TransportOutcome map(int status, String body) {
        var error = parseError(body);
        var code = error != null ? error.code() : null;
        var reason = describe(status, error, body);

        if (MEMBER_ALREADY_IN_AUTOMATION.equals(code)) {
            return new TransportOutcome.AlreadyNotified();
        }
        if (status == HTTP_TOO_MANY_REQUESTS || TOO_MANY_REQUESTS.equals(code)) {
            return new TransportOutcome.RateLimited(reason);
        }
        if (status >= 500) {
            return new TransportOutcome.TransientFailure(reason);
        }
        return new TransportOutcome.PermanentFailure(reason);
    }

    private ErrorEnvelope.Error parseError(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            var envelope = objectMapper.readValue(body, ErrorEnvelope.class);
            return envelope != null ? envelope.error() : null;
        } catch (JacksonException e) {
            log.debug("Error body is not an API error envelope: {}", e.getMessage());
            return null;
        }
    }

    private static String describe(int status, ErrorEnvelope.Error error, String body) {
        if (error != null && error.code() != null) {
            return "HTTP " + status + " " + error.code() + (error.message() != null ? ": " + error.message() : "");
        }
        return "HTTP " + status + (body != null && !body.isBlank() ? ": " + abbreviate(body) : "");
    }

    private static String abbreviate(String body) {
        var trimmed = body.strip();
        return trimmed.length() <= 200 ? trimmed : trimmed.substring(0, 200) + "...";
    }
}
