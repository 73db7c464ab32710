package com.servealert.delivery;

import com.servealert.config.ServeAlertProperties;
import com.servealert.domain.enums.NotificationAction;
import com.servealert.domain.model.NotificationResponse;
import com.servealert.event.NotificationResponseEvent;
import com.servealert.exception.BaseException;
import com.servealert.lifecycle.AlertLifecycleService;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Turns a user's reaction to a delivered notification into a lifecycle call.
 *
 * <p>ACKNOWLEDGE acknowledges as {@value #NOTIFICATION_USER}, DISMISS dismisses, and
 * anything else (view details, a plain tap) marks the alert read. A rejected transition,
 * such as dismissing a CRITICAL alert from the lock screen, is logged and dropped.
 *
 * <p>Only the most recent responses are kept in the history; the oldest is evicted first.
 */
@Service
public class NotificationResponseHandler {

    private static final Logger log = LoggerFactory.getLogger(NotificationResponseHandler.class);

    public static final String NOTIFICATION_USER = "notification";

    private final AlertLifecycleService alertLifecycleService;
    private final int historyCapacity;
    private final Deque<NotificationResponse> responseHistory = new ArrayDeque<>();

    public NotificationResponseHandler(
            AlertLifecycleService alertLifecycleService, ServeAlertProperties serveAlertProperties) {
        this.alertLifecycleService = alertLifecycleService;
        this.historyCapacity = Math.max(1, serveAlertProperties.getNotifications().getResponseHistoryCapacity());
    }

    @EventListener
    public void onNotificationResponse(NotificationResponseEvent event) {
        handleResponse(event.getResponse());
    }

    public void handleResponse(NotificationResponse response) {
        synchronized (responseHistory) {
            responseHistory.addLast(response);
            while (responseHistory.size() > historyCapacity) {
                responseHistory.removeFirst();
            }
        }

        String alertId = response.getAlertId();
        if (alertId == null) {
            log.warn("Notification response {} carries no alert id, ignoring", response.getNotificationId());
            return;
        }

        NotificationAction action = NotificationAction.fromIdentifier(response.getActionIdentifier());
        try {
            switch (action) {
                case ACKNOWLEDGE -> alertLifecycleService.acknowledgeAlert(alertId, NOTIFICATION_USER);
                case DISMISS -> alertLifecycleService.dismissAlert(alertId);
                default -> alertLifecycleService.markAsRead(alertId);
            }
            log.info("Applied notification action {} to alert {}", action, alertId);
        } catch (BaseException e) {
            log.warn("Notification action {} on alert {} rejected: {} ({})",
                    action, alertId, e.getMessage(), e.getErrorCode());
        } catch (RuntimeException e) {
            log.error("Failed to handle notification action {} on alert {}: {}", action, alertId, e.getMessage(), e);
        }
    }

    public List<NotificationResponse> getResponseHistory() {
        synchronized (responseHistory) {
            return List.copyOf(responseHistory);
        }
    }

    public void clearResponseHistory() {
        synchronized (responseHistory) {
            responseHistory.clear();
        }
    }
}
