package com.stockalerts.notification;

import com.stockalerts.exception.DeliveryFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Renders fired alerts and hands them to the {@link NotificationSink}.
 *
 * <p>Delivery is synchronous so the caller can record the outcome in the trigger history.
 * Failures are not retried here.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationSink notificationSink;
    private final NotificationTemplateEngine notificationTemplateEngine;

    public NotificationService(
            NotificationSink notificationSink, NotificationTemplateEngine notificationTemplateEngine) {
        this.notificationSink = notificationSink;
        this.notificationTemplateEngine = notificationTemplateEngine;
    }

    /**
     * @throws DeliveryFailureException if the sink could not deliver the message
     */
    public void deliver(AlertNotification notification) {
        String message = notificationTemplateEngine.render(notification);
        try {
            notificationSink.send(notification.getOwnerKey(), message);
        } catch (DeliveryFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DeliveryFailureException("Notification sink failed for alert " + notification.getAlertId(), e);
        }
        log.info(
                "Notification sent for alert {} ({} {} {}%)",
                notification.getAlertId(),
                notification.getSymbol(),
                notification.getKind().describe(),
                notification.getMovePercent());
    }
}
