package com.servealert.delivery;

import com.servealert.domain.model.NotificationCategory;
import com.servealert.domain.model.NotificationPayload;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Frame pushed to the device over STOMP. {@code kind} tells the client what to do with
 * it; only the fields relevant to that kind are set.
 */
@Value
@Builder
public class DeviceNotificationMessage {

    public enum Kind {
        PRESENT,
        CANCEL,
        CANCEL_ALL,
        REGISTER_CATEGORIES
    }

    Kind kind;
    String handle;
    NotificationPayload payload;
    List<NotificationCategory> categories;
    LocalDateTime sentAt;
}
