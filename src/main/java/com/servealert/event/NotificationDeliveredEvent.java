package com.servealert.event;

import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the delivery gate once the device gateway has accepted a notification.
 * The lifecycle manager listens so the stored alert records the hand-off.
 */
public class NotificationDeliveredEvent extends ApplicationEvent {

    private final String alertId;
    private final String notificationId;
    private final LocalDateTime deliveredAt;

    public NotificationDeliveredEvent(Object source, String alertId, String notificationId, LocalDateTime deliveredAt) {
        super(source);
        this.alertId = alertId;
        this.notificationId = notificationId;
        this.deliveredAt = deliveredAt;
    }

    public String getAlertId() {
        return alertId;
    }

    public String getNotificationId() {
        return notificationId;
    }

    public LocalDateTime getDeliveredAt() {
        return deliveredAt;
    }
}
