package com.servealert.lifecycle.command;

import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.enums.AlertStatus;
import com.servealert.domain.model.Alert;
import com.servealert.exception.InvalidAlertTransitionException;
import java.time.LocalDateTime;

/**
 * ACTIVE to DISMISSED. Critical alerts can only be resolved, and an acknowledged alert
 * is already being handled, so neither can be dismissed.
 */
public class DismissCommand extends SingleAlertCommand {

    public DismissCommand(String alertId) {
        super(alertId);
    }

    @Override
    public String name() {
        return "dismiss";
    }

    @Override
    protected Alert update(Alert current, LocalDateTime now) {
        if (current.getPriority() == AlertPriority.CRITICAL) {
            throw InvalidAlertTransitionException.cannotDismissCritical(current.getId());
        }
        requireOpen(current);
        if (current.getStatus() != AlertStatus.ACTIVE) {
            throw InvalidAlertTransitionException.unsupported(current.getId(), current.getStatus(), name());
        }

        return current.toBuilder()
                .status(AlertStatus.DISMISSED)
                .dismissedAt(now)
                .build();
    }
}
