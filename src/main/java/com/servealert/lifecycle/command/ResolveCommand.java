package com.servealert.lifecycle.command;

import com.servealert.domain.enums.AlertStatus;
import com.servealert.domain.model.Alert;
import java.time.LocalDateTime;

/** ACTIVE or ACKNOWLEDGED to RESOLVED. */
public class ResolveCommand extends SingleAlertCommand {

    public ResolveCommand(String alertId) {
        super(alertId);
    }

    @Override
    public String name() {
        return "resolve";
    }

    @Override
    protected Alert update(Alert current, LocalDateTime now) {
        requireOpen(current);
        return current.toBuilder()
                .status(AlertStatus.RESOLVED)
                .resolvedAt(now)
                .build();
    }
}
