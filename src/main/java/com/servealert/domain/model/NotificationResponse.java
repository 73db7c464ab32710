package com.servealert.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A user's reaction to a delivered notification, as reported by the device.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationResponse {

    private String notificationId;
    private String title;
    private String body;
    private String categoryId;
    private Map<String, String> data;

    /** Raw action identifier, e.g. "ACKNOWLEDGE" or "view-details". Null for a plain tap. */
    private String actionIdentifier;

    private String userText;
    private LocalDateTime receivedAt;

    @JsonIgnore
    public String getAlertId() {
        return data != null ? data.get("alertId") : null;
    }
}
