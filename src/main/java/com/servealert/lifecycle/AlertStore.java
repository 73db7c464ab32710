package com.servealert.lifecycle;

import com.servealert.lifecycle.command.AlertCommand;
import java.time.LocalDateTime;
import org.springframework.stereotype.Component;

/**
 * Mutable holder for the current {@link AlertState}. Every command goes through
 * {@link #dispatch}, which runs the reducer and swaps the state under the store's
 * monitor, so readers always see a whole snapshot.
 */
@Component
public class AlertStore {

    private AlertState state = AlertState.empty();
    private LocalDateTime lastSyncedAt;

    public synchronized AlertTransition dispatch(AlertCommand command, LocalDateTime now) {
        AlertTransition transition = AlertStateReducer.reduce(state, command, now);
        state = transition.getState();
        return transition;
    }

    public synchronized AlertState snapshot() {
        return state;
    }

    /** Last time the working set was known to match persistence; null before the first load. */
    public synchronized LocalDateTime getLastSyncedAt() {
        return lastSyncedAt;
    }

    public synchronized void markSynced(LocalDateTime at) {
        this.lastSyncedAt = at;
    }
}
