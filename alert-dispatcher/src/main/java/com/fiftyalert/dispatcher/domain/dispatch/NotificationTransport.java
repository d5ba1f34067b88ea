package com.fiftyalert.dispatcher.domain.dispatch;

import com.fiftyalert.dispatcher.domain.recipient.Recipient;

/**
 * Domain port for delivering one notification to one recipient.
 *
 * <p>Implementations translate their wire-level responses into {@link TransportOutcome} and must
 * not throw; retries are applied by {@link DispatchDriver} above this layer.
 */
public interface NotificationTransport {

    TransportOutcome send(Recipient recipient, AlertContent content);
}
