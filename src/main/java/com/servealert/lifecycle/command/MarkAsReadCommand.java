package com.servealert.lifecycle.command;

import com.servealert.domain.model.Alert;
import java.time.LocalDateTime;

/** Allowed in every status. A second call keeps the first read time. */
public class MarkAsReadCommand extends SingleAlertCommand {

    public MarkAsReadCommand(String alertId) {
        super(alertId);
    }

    @Override
    public String name() {
        return "markAsRead";
    }

    @Override
    protected Alert update(Alert current, LocalDateTime now) {
        if (current.isRead()) {
            return current;
        }
        return current.toBuilder().read(true).readAt(now).build();
    }
}
