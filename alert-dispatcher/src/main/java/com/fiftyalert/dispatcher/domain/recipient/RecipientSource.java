package com.fiftyalert.dispatcher.domain.recipient;

/**
 * Domain port for the subscriber audience. Implementations page through their backend and
 * report failures as {@link RecipientFetch.Unavailable} rather than throwing.
 */
public interface RecipientSource {

    RecipientFetch fetchAll();
}
