package com.fiftyalert.dispatcher.domain.dispatch;

/**
 * What a recipient is told. {@code idempotencyKey} is stable for the same set of alert keys,
 * so a transport that remembers it can recognise a repeat of the same logical notification.
 */
public record AlertContent(String idempotencyKey, String subject, String text) {
}
