package com.fiftyalert.dispatcher.infrastructure.emailoctopus;

import com.fiftyalert.dispatcher.application.config.DispatcherProperties;
import com.fiftyalert.dispatcher.domain.dispatch.AlertContent;
import com.fiftyalert.dispatcher.domain.dispatch.NotificationTransport;
import com.fiftyalert.dispatcher.domain.dispatch.TransportOutcome;
import com.fiftyalert.dispatcher.domain.recipient.Recipient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import tools.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Queues a list contact into the alert automation. The automation's email template renders the
 * message, so only the contact id travels with the request.
 */
@Slf4j
@RequiredArgsConstructor
public class EmailOctopusTransport implements NotificationTransport {

    private static final String QUEUE = "/automations/{automationId}/queue";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final EmailOctopusErrorMapper errorMapper;
    private final DispatcherProperties.EmailOctopus properties;

    @Override
    public TransportOutcome send(Recipient recipient, AlertContent content) {
        var payload = objectMapper.writeValueAsString(Map.of(
                "api_key", properties.apiKey(),
                "list_member_id", recipient.id()));
        try {
            TransportOutcome outcome = restClient.post()
                    .uri(QUEUE, properties.automationId())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .exchange((request, response) -> {
                        var status = response.getStatusCode();
                        if (status.is2xxSuccessful()) {
                            return new TransportOutcome.Sent();
                        }
                        var body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                        return errorMapper.map(status.value(), body);
                    });
            log.debug("Queued recipient {} for notification {}: {}", recipient.id(), content.idempotencyKey(), outcome);
            return outcome;
        } catch (ResourceAccessException e) {
            return new TransportOutcome.TransientFailure("I/O error: " + e.getMessage());
        } catch (RestClientException e) {
            return new TransportOutcome.PermanentFailure("request failed: " + e.getMessage());
        }
    }
}
