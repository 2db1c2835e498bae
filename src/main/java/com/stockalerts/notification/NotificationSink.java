package com.stockalerts.notification;

import com.stockalerts.exception.DeliveryFailureException;

/**
 * Outbound channel for alert notifications.
 */
public interface NotificationSink {

    /**
     * Hands {@code message} to the transport for the recipient identified by {@code ownerKey}.
     *
     * @throws DeliveryFailureException if the transport rejected or could not accept the message
     */
    void send(String ownerKey, String message);
}
