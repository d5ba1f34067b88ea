package com.fiftyalert.dispatcher.infrastructure.emailoctopus;

import com.fiftyalert.common.json.JacksonConfig;
import com.fiftyalert.dispatcher.domain.dispatch.TransportOutcome;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EmailOctopusErrorMapperTest {

    private final EmailOctopusErrorMapper mapper = new EmailOctopusErrorMapper(JacksonConfig.createObjectMapper());

    private static String error(String code) {
        return "{\"error\": {\"code\": \"" + code + "\", \"message\": \"details\"}}";
    }

    @Test
    void shouldMapAlreadyInAutomationRegardlessOfStatus() {
        assertThat(mapper.map(400, error("MEMBER_ALREADY_IN_AUTOMATION"))).isEqualTo(new TransportOutcome.AlreadyNotified());
        assertThat(mapper.map(409, error("MEMBER_ALREADY_IN_AUTOMATION"))).isEqualTo(new TransportOutcome.AlreadyNotified());
    }

    @Test
    void shouldMapRateLimitByStatusOrCode() {
        assertThat(mapper.map(429, "")).isEqualTo(new TransportOutcome.RateLimited("HTTP 429"));
        assertThat(mapper.map(403, error("TOO_MANY_REQUESTS")))
                .isEqualTo(new TransportOutcome.RateLimited("HTTP 403 TOO_MANY_REQUESTS: details"));
    }

    @Test
    void shouldMapServerErrorsAsTransient() {
        assertThat(mapper.map(502, "<html>Bad Gateway</html>"))
                .isEqualTo(new TransportOutcome.TransientFailure("HTTP 502: <html>Bad Gateway</html>"));
    }

    @Test
    void shouldMapEverythingElseAsPermanent() {
        assertThat(mapper.map(401, error("API_KEY_INVALID")))
                .isEqualTo(new TransportOutcome.PermanentFailure("HTTP 401 API_KEY_INVALID: details"));
        assertThat(mapper.map(404, null)).isEqualTo(new TransportOutcome.PermanentFailure("HTTP 404"));
    }

    @Test
    void shouldAbbreviateLongBodies() {
        var outcome = (TransportOutcome.TransientFailure) mapper.map(500, "x".repeat(500));

        assertThat(outcome.reason()).hasSize("HTTP 500: ".length() + 200 + 3);
    }
}
