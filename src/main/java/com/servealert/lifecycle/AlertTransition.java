package com.servealert.lifecycle;

import com.servealert.domain.model.Alert;
import java.util.List;
import lombok.Value;

/**
 * Outcome of applying one command: the next state and the alerts the command touched.
 * {@code changed} is false for no-op commands such as re-reading an already read alert.
 */
@Value
public class AlertTransition {

    AlertState state;
    List<Alert> affected;
    boolean changed;

    public static AlertTransition changed(AlertState state, List<Alert> affected) {
        return new AlertTransition(state, List.copyOf(affected), true);
    }

    public static AlertTransition changed(AlertState state, Alert affected) {
        return new AlertTransition(state, List.of(affected), true);
    }

    public static AlertTransition unchanged(AlertState state, Alert current) {
        return new AlertTransition(state, List.of(current), false);
    }

    /** The single alert a per-alert command acted on. */
    public Alert getAlert() {
        return affected.isEmpty() ? null : affected.get(0);
    }
}
