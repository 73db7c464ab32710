package com.servealert.delivery;

import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.model.Alert;
import com.servealert.domain.model.NotificationPayload;
import com.servealert.domain.model.NotificationSettings;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Renders an alert into what the device shows: a priority-prefixed title, a body cut to
 * {@value #MAX_BODY_LENGTH} characters, a per-priority sound and routing data.
 */
@Component
public class NotificationPayloadFactory {

    static final int MAX_BODY_LENGTH = 100;
    static final String ELLIPSIS = "...";

    public NotificationPayload build(Alert alert, NotificationSettings settings) {
        Map<String, String> data = new LinkedHashMap<>();
        data.put("alertId", alert.getId());
        data.put("type", String.valueOf(alert.getType()));
        data.put("priority", String.valueOf(alert.getPriority()));

        return NotificationPayload.builder()
                .title(formatTitle(alert))
                .body(formatBody(alert.getMessage()))
                .data(data)
                .sound(settings.isCustomSounds() ? soundFor(alert.getPriority()) : null)
                .badge(settings.isBadge() ? 1 : null)
                .categoryId(categoryId(alert.getPriority()))
                .vibrate(settings.isVibration())
                .build();
    }

    public String formatTitle(Alert alert) {
        return titlePrefix(alert.getPriority()) + ": " + alert.getTitle();
    }

    public String formatBody(String message) {
        if (message == null) {
            return "";
        }
        return message.length() > MAX_BODY_LENGTH ? message.substring(0, MAX_BODY_LENGTH) + ELLIPSIS : message;
    }

    public static String categoryId(AlertPriority priority) {
        return priority + "_ALERT";
    }

    static String titlePrefix(AlertPriority priority) {
        return switch (priority) {
            case CRITICAL -> "🚨 CRITICAL";
            case HIGH -> "⚠️ HIGH";
            case MEDIUM -> "📢 ALERT";
            case LOW -> "💡 INFO";
        };
    }

    static String soundFor(AlertPriority priority) {
        return switch (priority) {
            case CRITICAL -> "critical-alert.caf";
            case HIGH -> "high-priority.caf";
            case MEDIUM -> "medium-alert.caf";
            case LOW -> "low-priority.caf";
        };
    }
}
