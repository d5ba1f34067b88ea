package com.fiftyalert.dispatcher.infrastructure.emailoctopus;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of {@code GET /lists/{listId}/contacts/subscribed}.
 */
record ContactPage(List<Contact> data, Paging paging) {

    record Contact(String id, @JsonProperty("email_address") String emailAddress) {
    }

    record Paging(String next) {
    }

    boolean hasNext() {
        return paging != null && paging.next() != null && !paging.next().isBlank();
    }
}
