package com.fiftyalert.dispatcher.infrastructure.emailoctopus;

import com.fiftyalert.dispatcher.application.config.DispatcherProperties;
import com.fiftyalert.dispatcher.domain.recipient.Recipient;
import com.fiftyalert.dispatcher.domain.recipient.RecipientFetch;
import com.fiftyalert.dispatcher.domain.recipient.RecipientSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Pages through the subscribed contacts of one list. Any failure makes the whole audience
 * unavailable; a partial audience is never returned.
 */
@Slf4j
@RequiredArgsConstructor
public class EmailOctopusRecipientSource implements RecipientSource {

    private static final String SUBSCRIBED_CONTACTS =
            "/lists/{listId}/contacts/subscribed?api_key={apiKey}&limit={limit}&page={page}";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final DispatcherProperties.EmailOctopus properties;

    @Override
    public RecipientFetch fetchAll() {
        var recipients = new ArrayList<Recipient>();
        try {
            for (int page = 1; page <= properties.maxPages(); page++) {
                var contacts = fetchPage(page);
                var rows = contacts.data() != null ? contacts.data() : List.<ContactPage.Contact>of();
                collect(rows, recipients);
                log.debug("Fetched contact page {} with {} rows", page, rows.size());
                if (rows.isEmpty() || !contacts.hasNext()) {
                    log.info("recipients.fetched: list_id={}, pages={}, recipients={}",
                            properties.listId(), page, recipients.size());
                    return RecipientFetch.available(recipients);
                }
            }
        } catch (RestClientException | JacksonException e) {
            log.warn("recipients.unavailable: list_id={}, reason={}", properties.listId(), e.getMessage());
            return RecipientFetch.unavailable(e.getMessage());
        }
        var reason = "contact list exceeds " + properties.maxPages() + " pages of " + properties.pageSize();
        log.warn("recipients.unavailable: list_id={}, reason={}", properties.listId(), reason);
        return RecipientFetch.unavailable(reason);
    }

    private ContactPage fetchPage(int page) {
        var body = restClient.get()
                .uri(SUBSCRIBED_CONTACTS, properties.listId(), properties.apiKey(), properties.pageSize(), page)
                .exchange((request, response) -> {
                    var content = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                    if (!response.getStatusCode().is2xxSuccessful()) {
                        throw new ContactListException(
                                "contact listing failed with HTTP " + response.getStatusCode().value() + " on page " + page);
                    }
                    return content;
                });
        var contacts = objectMapper.readValue(body, ContactPage.class);
        if (contacts == null) {
            throw new ContactListException("empty contact listing response on page " + page);
        }
        return contacts;
    }

    private static void collect(List<ContactPage.Contact> rows, List<Recipient> recipients) {
        for (var row : rows) {
            if (row == null || row.id() == null || row.id().isBlank()) {
                log.warn("Skipping contact without id: {}", row);
                continue;
            }
            recipients.add(new Recipient(row.id(), row.emailAddress()));
        }
    }

    private static final class ContactListException extends RestClientException {

        private ContactListException(String message) {
            super(message);
        }
    }
}
