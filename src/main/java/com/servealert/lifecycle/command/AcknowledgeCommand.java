package com.servealert.lifecycle.command;

import com.servealert.domain.enums.AlertStatus;
import com.servealert.domain.model.Alert;
import com.servealert.exception.InvalidAlertTransitionException;
import java.time.LocalDateTime;

/** ACTIVE to ACKNOWLEDGED. Also marks the alert read. */
public class AcknowledgeCommand extends SingleAlertCommand {

    private final String userId;

    public AcknowledgeCommand(String alertId, String userId) {
        super(alertId);
        this.userId = userId;
    }

    @Override
    public String name() {
        return "acknowledge";
    }

    @Override
    protected Alert update(Alert current, LocalDateTime now) {
        if (current.getStatus() == AlertStatus.ACKNOWLEDGED) {
            throw InvalidAlertTransitionException.alreadyAcknowledged(current.getId());
        }
        requireOpen(current);

        return current.toBuilder()
                .status(AlertStatus.ACKNOWLEDGED)
                .acknowledgedAt(now)
                .acknowledgedBy(userId)
                .read(true)
                .readAt(current.getReadAt() != null ? current.getReadAt() : now)
                .build();
    }
}
