package com.servealert.delivery;

import com.servealert.domain.model.NotificationResponse;
import com.servealert.event.AlertEventPublisher;
import java.time.Clock;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.stereotype.Controller;

/**
 * Return path from the device: a client sends the user's reaction to
 * {@code /app/notifications/response} and it is re-published as an application event.
 */
@Controller
public class NotificationResponseController {

    private static final Logger log = LoggerFactory.getLogger(NotificationResponseController.class);

    private final AlertEventPublisher alertEventPublisher;
    private final Clock clock;

    public NotificationResponseController(AlertEventPublisher alertEventPublisher, Clock clock) {
        this.alertEventPublisher = alertEventPublisher;
        this.clock = clock;
    }

    @MessageMapping("/notifications/response")
    public void onResponse(NotificationResponse response) {
        if (response.getReceivedAt() == null) {
            response.setReceivedAt(LocalDateTime.now(clock));
        }
        log.debug("Notification response for alert {}: {}", response.getAlertId(), response.getActionIdentifier());
        alertEventPublisher.publishNotificationResponse(this, response);
    }
}
