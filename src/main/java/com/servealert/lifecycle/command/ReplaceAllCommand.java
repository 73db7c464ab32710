package com.servealert.lifecycle.command;

import com.servealert.domain.model.Alert;
import com.servealert.lifecycle.AlertState;
import com.servealert.lifecycle.AlertTransition;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Swaps the whole collection for a reloaded one. Hidden-until-refresh flags do not
 * survive a reload.
 */
public class ReplaceAllCommand implements AlertCommand {

    private final List<Alert> alerts;

    public ReplaceAllCommand(List<Alert> alerts) {
        this.alerts = List.copyOf(alerts);
    }

    @Override
    public String name() {
        return "reload";
    }

    @Override
    public AlertTransition apply(AlertState state, LocalDateTime now) {
        List<Alert> reloaded = alerts.stream()
                .map(alert -> alert.isDismissedUntilRefresh()
                        ? alert.toBuilder().dismissedUntilRefresh(false).build()
                        : alert)
                .toList();
        return AlertTransition.changed(AlertState.of(reloaded), reloaded);
    }
}
