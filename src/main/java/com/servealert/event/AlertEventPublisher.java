package com.servealert.event;

import com.servealert.domain.enums.AlertChangeType;
import com.servealert.domain.model.NotificationResponse;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for the
 * alert engine's events. Listeners run synchronously on the publishing thread.
 */
@Component
public class AlertEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public AlertEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Alert collection ----

    public void publishAlertsCreated(Object source, List<String> alertIds) {
        applicationEventPublisher.publishEvent(
                new AlertCollectionChangedEvent(source, AlertChangeType.CREATED, alertIds, "generate"));
    }

    public void publishAlertUpdated(Object source, String alertId, String command) {
        applicationEventPublisher.publishEvent(
                new AlertCollectionChangedEvent(source, AlertChangeType.UPDATED, List.of(alertId), command));
    }

    public void publishAlertsReloaded(Object source, List<String> alertIds) {
        applicationEventPublisher.publishEvent(
                new AlertCollectionChangedEvent(source, AlertChangeType.RELOADED, alertIds, "reload"));
    }

    public void publishAlertsCleared(Object source) {
        applicationEventPublisher.publishEvent(
                new AlertCollectionChangedEvent(source, AlertChangeType.CLEARED, List.of(), "clearAll"));
    }

    // ---- Notifications ----

    public void publishNotificationDelivered(
            Object source, String alertId, String notificationId, LocalDateTime deliveredAt) {
        applicationEventPublisher.publishEvent(
                new NotificationDeliveredEvent(source, alertId, notificationId, deliveredAt));
    }

    public void publishNotificationResponse(Object source, NotificationResponse response) {
        applicationEventPublisher.publishEvent(new NotificationResponseEvent(source, response));
    }
}
