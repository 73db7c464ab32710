package com.servealert.lifecycle.command;

import com.servealert.domain.model.Alert;
import java.time.LocalDateTime;

/**
 * Books a successful device hand-off against the stored alert. An alert only reaches
 * the device when it was eligible, so {@code shouldNotify} is set alongside.
 */
public class RecordNotificationSentCommand extends SingleAlertCommand {

    private final String notificationId;
    private final LocalDateTime deliveredAt;

    public RecordNotificationSentCommand(String alertId, String notificationId, LocalDateTime deliveredAt) {
        super(alertId);
        this.notificationId = notificationId;
        this.deliveredAt = deliveredAt;
    }

    @Override
    public String name() {
        return "recordNotificationSent";
    }

    @Override
    protected Alert update(Alert current, LocalDateTime now) {
        return current.toBuilder()
                .shouldNotify(true)
                .notificationSent(true)
                .notificationId(notificationId)
                .notificationScheduledAt(
                        current.getNotificationScheduledAt() != null
                                ? current.getNotificationScheduledAt()
                                : deliveredAt)
                .build();
    }
}
