package com.servealert.lifecycle.command;

import com.servealert.lifecycle.AlertState;
import com.servealert.lifecycle.AlertTransition;
import java.time.LocalDateTime;

/** The only command that removes alerts from the collection. */
public class ClearAllCommand implements AlertCommand {

    @Override
    public String name() {
        return "clearAll";
    }

    @Override
    public AlertTransition apply(AlertState state, LocalDateTime now) {
        return AlertTransition.changed(AlertState.empty(), state.getAlerts());
    }
}
