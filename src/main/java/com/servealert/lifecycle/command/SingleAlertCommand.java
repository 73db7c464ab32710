package com.servealert.lifecycle.command;

import com.servealert.domain.model.Alert;
import com.servealert.exception.AlertNotFoundException;
import com.servealert.exception.InvalidAlertTransitionException;
import com.servealert.lifecycle.AlertState;
import com.servealert.lifecycle.AlertTransition;
import java.time.LocalDateTime;
import lombok.Getter;

/**
 * Base for commands that act on one alert by id.
 *
 * <p>Subclasses return either a modified copy of the alert or the very same instance
 * when there is nothing to change; the latter yields an unchanged transition.
 */
@Getter
public abstract class SingleAlertCommand implements AlertCommand {

    private final String alertId;

    protected SingleAlertCommand(String alertId) {
        this.alertId = alertId;
    }

    @Override
    public final AlertTransition apply(AlertState state, LocalDateTime now) {
        Alert current = state.find(alertId).orElseThrow(() -> new AlertNotFoundException(alertId));
        Alert next = update(current, now);
        if (next == current) {
            return AlertTransition.unchanged(state, current);
        }
        return AlertTransition.changed(state.withReplaced(next), next);
    }

    protected abstract Alert update(Alert current, LocalDateTime now);

    protected static void requireOpen(Alert alert) {
        if (alert.getStatus().isTerminal()) {
            throw InvalidAlertTransitionException.closed(alert.getId(), alert.getStatus());
        }
    }
}
