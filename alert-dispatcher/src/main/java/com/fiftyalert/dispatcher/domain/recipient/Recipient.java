package com.fiftyalert.dispatcher.domain.recipient;

/**
 * Audience member as reported by the recipient source for one run.
 */
public record Recipient(String id, String address) {
}
