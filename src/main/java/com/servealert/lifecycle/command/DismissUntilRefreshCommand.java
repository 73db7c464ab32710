package com.servealert.lifecycle.command;

import com.servealert.domain.model.Alert;
import java.time.LocalDateTime;

/** Hides the alert from the working view until the next reload. Status is untouched. */
public class DismissUntilRefreshCommand extends SingleAlertCommand {

    public DismissUntilRefreshCommand(String alertId) {
        super(alertId);
    }

    @Override
    public String name() {
        return "dismissUntilRefresh";
    }

    @Override
    protected Alert update(Alert current, LocalDateTime now) {
        if (current.isDismissedUntilRefresh()) {
            return current;
        }
        return current.toBuilder().dismissedUntilRefresh(true).build();
    }
}
