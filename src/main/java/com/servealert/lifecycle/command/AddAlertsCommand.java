package com.servealert.lifecycle.command;

import com.servealert.domain.model.Alert;
import com.servealert.lifecycle.AlertState;
import com.servealert.lifecycle.AlertTransition;
import java.time.LocalDateTime;
import java.util.List;

/** Inserts freshly synthesized alerts at the front of the collection. */
public class AddAlertsCommand implements AlertCommand {

    private final List<Alert> alerts;

    public AddAlertsCommand(List<Alert> alerts) {
        this.alerts = List.copyOf(alerts);
    }

    @Override
    public String name() {
        return "generate";
    }

    @Override
    public AlertTransition apply(AlertState state, LocalDateTime now) {
        if (alerts.isEmpty()) {
            return new AlertTransition(state, List.of(), false);
        }
        return AlertTransition.changed(state.withPrepended(alerts), alerts);
    }
}
