package com.fiftyalert.dispatcher.domain.recipient;

import java.util.List;

/**
 * Result of asking for the current audience. {@link Unavailable} means the audience could not be
 * determined; an {@link Available} with no recipients means it is legitimately empty.
 */
public sealed interface RecipientFetch permits RecipientFetch.Available, RecipientFetch.Unavailable {

    static RecipientFetch available(List<Recipient> recipients) {
        return new Available(recipients);
    }

    static RecipientFetch unavailable(String reason) {
        return new Unavailable(reason);
    }

    record Available(List<Recipient> recipients) implements RecipientFetch {

        public Available {
            recipients = List.copyOf(recipients);
        }
    }

    record Unavailable(String reason) implements RecipientFetch {
    }
}
